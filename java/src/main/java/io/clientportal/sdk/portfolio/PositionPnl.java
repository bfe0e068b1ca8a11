package io.clientportal.sdk.portfolio;

import java.math.BigDecimal;

public record PositionPnl(
    String accountId,
    long conid,
    String contractDescription,
    BigDecimal position,
    BigDecimal dailyPnl,
    BigDecimal unrealizedPnl,
    BigDecimal realizedPnl,
    BigDecimal marketValue
) {
}
