package io.clientportal.sdk.trading;

public record OrderResult(String orderId, String localOrderId, String orderStatus, String encryptMessage) {

    static final OrderResult EMPTY = new OrderResult(null, null, null, null);
}
