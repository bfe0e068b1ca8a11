package io.clientportal.sdk.trading;

public enum OrderSide {
    BUY,
    SELL;

    public String code() {
        return name();
    }
}
