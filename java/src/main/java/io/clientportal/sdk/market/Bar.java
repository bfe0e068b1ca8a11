package io.clientportal.sdk.market;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Historical OHLCV bar. {@code timestamp} is epoch milliseconds as sent by the gateway; volume is a decimal because
 * fractional share volumes occur.
 */
public record Bar(long timestamp, BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close, BigDecimal volume) {

    public Instant time() {
        return Instant.ofEpochMilli(timestamp);
    }
}
