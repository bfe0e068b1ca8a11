package io.clientportal.sdk.trading;

public enum TimeInForce {
    DAY,
    GTC,
    IOC,
    FOK;

    public String code() {
        return name();
    }
}
