package io.clientportal.sdk;

public final class AccessForbiddenException extends ClientPortalApiException {

    private static final long serialVersionUID = 1L;

    public AccessForbiddenException(String message) {
        super(403, null, message);
    }
}
