package io.clientportal.sdk.portfolio;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Balances and margin figures from {@code /portfolio/{accountId}/summary}. The full payload stays available through
 * {@link #raw()} for fields not mapped here.
 */
public record AccountSummary(
    String accountCode,
    String accountReady,
    String accountType,
    BigDecimal netLiquidation,
    BigDecimal availableFunds,
    BigDecimal buyingPower,
    BigDecimal excessLiquidity,
    BigDecimal totalCashValue,
    BigDecimal grossPositionValue,
    BigDecimal equityWithLoanValue,
    BigDecimal initialMarginRequirement,
    BigDecimal maintenanceMarginRequirement,
    BigDecimal accruedCash,
    BigDecimal cushion,
    Integer dayTradesRemaining,
    Boolean marginInReview,
    Map<String, Object> raw
) {
    public AccountSummary {
        raw = raw == null ? Map.of() : raw;
    }
}
