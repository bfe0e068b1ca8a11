package io.clientportal.sdk.trading;

import io.clientportal.sdk.ClientPortalException;

/**
 * The what-if preview reported an error, so the order was not sent.
 */
public final class OrderRejectedException extends ClientPortalException {

    private static final long serialVersionUID = 1L;

    public OrderRejectedException(String message) {
        super(message);
    }
}
