package io.clientportal.sdk.trading;

/**
 * Order types with their gateway wire codes.
 */
public enum OrderType {
    MARKET("MKT"),
    LIMIT("LMT"),
    STOP("STP"),
    STOP_LIMIT("STP_LMT");

    private final String code;

    OrderType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean requiresPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    public boolean requiresAuxPrice() {
        return this == STOP || this == STOP_LIMIT;
    }

    public static OrderType fromCode(String code) {
        for (OrderType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown order type " + code);
    }
}
