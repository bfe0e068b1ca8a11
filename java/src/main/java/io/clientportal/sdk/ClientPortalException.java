package io.clientportal.sdk;

/**
 * Base exception thrown by the Client Portal Java SDK.
 */
public class ClientPortalException extends Exception {

    private static final long serialVersionUID = 1L;

    public ClientPortalException(String message) {
        super(message);
    }

    public ClientPortalException(String message, Throwable cause) {
        super(message, cause);
    }
}
