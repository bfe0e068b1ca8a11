package io.clientportal.sdk.scanner;

import java.math.BigDecimal;

/**
 * Single contract returned by a market scan.
 */
public record ScanResult(
    long conid,
    String symbol,
    String contractDescription,
    String secType,
    String exchange,
    String currency,
    BigDecimal price,
    BigDecimal change,
    BigDecimal changePercent,
    Long volume,
    BigDecimal marketCap,
    BigDecimal pe,
    BigDecimal dividend
) {
}
