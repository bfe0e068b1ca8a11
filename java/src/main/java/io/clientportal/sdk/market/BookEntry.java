package io.clientportal.sdk.market;

import java.math.BigDecimal;

public record BookEntry(BigDecimal price, Long size, String exchange) {
}
