package io.clientportal.sdk.trading;

import java.util.Optional;

/**
 * Order states reported by the gateway. Unlisted states are kept as raw strings on {@link LiveOrder}.
 */
public enum OrderStatus {
    SUBMITTED("Submitted"),
    FILLED("Filled"),
    CANCELLED("Cancelled"),
    PENDING_SUBMIT("PendingSubmit"),
    PRE_SUBMITTED("PreSubmitted"),
    PENDING_CANCEL("PendingCancel");

    private final String code;

    OrderStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<OrderStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (OrderStatus status : values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
