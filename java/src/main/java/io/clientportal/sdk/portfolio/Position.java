package io.clientportal.sdk.portfolio;

import java.math.BigDecimal;

/**
 * One portfolio position as reported by {@code /portfolio/{accountId}/positions/{page}}.
 */
public record Position(
    String accountId,
    long conid,
    String contractDescription,
    BigDecimal position,
    BigDecimal marketPrice,
    BigDecimal marketValue,
    String currency,
    BigDecimal averageCost,
    BigDecimal averagePrice,
    BigDecimal realizedPnl,
    BigDecimal unrealizedPnl,
    String assetClass,
    String expiry,
    String putOrCall,
    BigDecimal strike,
    BigDecimal multiplier,
    Long underlyingConid
) {
}
