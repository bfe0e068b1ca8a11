package io.clientportal.sdk.market;

import java.math.BigDecimal;

/**
 * Real-time market data snapshot for one contract. Fields the gateway has not populated yet are {@code null}.
 */
public record Snapshot(
    long conid,
    String symbol,
    BigDecimal lastPrice,
    BigDecimal bid,
    BigDecimal ask,
    Long bidSize,
    Long askSize,
    Long volume,
    BigDecimal change,
    BigDecimal changePercent,
    BigDecimal high,
    BigDecimal low,
    BigDecimal open,
    BigDecimal close,
    String serverId,
    Long updated
) {
}
