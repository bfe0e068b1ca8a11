package io.clientportal.sdk.portfolio;

import java.math.BigDecimal;

/**
 * Live intraday P&amp;L for one account partition.
 *
 * @param accountId       account the row belongs to.
 * @param model           partition / model name, when the gateway reports one.
 * @param dailyPnl        daily P&amp;L ({@code dpl}).
 * @param netLiquidation  net liquidation value ({@code nl}).
 * @param unrealizedPnl   unrealised P&amp;L ({@code upl}).
 * @param excessLiquidity excess liquidity ({@code el}).
 * @param marketValue     market value ({@code mv}).
 */
public record PnlRow(
    String accountId,
    String model,
    BigDecimal dailyPnl,
    BigDecimal netLiquidation,
    BigDecimal unrealizedPnl,
    BigDecimal excessLiquidity,
    BigDecimal marketValue
) {
}
