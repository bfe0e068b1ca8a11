package io.clientportal.sdk;

/**
 * Raised when the gateway could not be reached (connect failure, reset, timeout) on every attempt.
 */
public final class NetworkException extends ClientPortalException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public NetworkException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
