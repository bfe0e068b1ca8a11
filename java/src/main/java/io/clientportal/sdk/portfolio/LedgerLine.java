package io.clientportal.sdk.portfolio;

import java.math.BigDecimal;

/**
 * Cash and valuation figures for one currency of the account ledger. The gateway reports an aggregate line under the
 * {@code BASE} key.
 */
public record LedgerLine(
    String currency,
    String accountCode,
    BigDecimal cashBalance,
    BigDecimal settledCash,
    BigDecimal netLiquidationValue,
    BigDecimal stockMarketValue,
    BigDecimal unrealizedPnl,
    BigDecimal realizedPnl,
    BigDecimal exchangeRate,
    BigDecimal interest,
    BigDecimal dividends,
    Long timestamp
) {
}
