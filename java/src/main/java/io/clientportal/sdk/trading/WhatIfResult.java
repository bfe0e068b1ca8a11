package io.clientportal.sdk.trading;

import java.math.BigDecimal;

/**
 * Margin impact preview of an order. Amounts are the post-trade values.
 */
public record WhatIfResult(BigDecimal equity, BigDecimal initial, BigDecimal maintenance, String warning, String error) {

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    public boolean hasWarning() {
        return warning != null && !warning.isBlank();
    }
}
