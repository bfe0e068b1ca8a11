package io.clientportal.sdk;

/**
 * Raised once the gateway has answered every attempt with a 5xx status. Carries the status of the last attempt.
 */
public final class ServerErrorException extends ClientPortalApiException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public ServerErrorException(int statusCode, int attempts) {
        super(statusCode, null, "Server error: " + statusCode + " after " + attempts + " attempt(s)");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
