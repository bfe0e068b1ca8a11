package io.clientportal.sdk;

/**
 * The session could not be restored through the reauthenticate endpoint. A manual login through the gateway
 * is required before further calls can succeed.
 */
public final class ReauthenticationFailedException extends ClientPortalException {

    private static final long serialVersionUID = 1L;

    public ReauthenticationFailedException(String message) {
        super(message);
    }

    public ReauthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
