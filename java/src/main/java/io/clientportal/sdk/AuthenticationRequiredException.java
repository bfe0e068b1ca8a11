package io.clientportal.sdk;

/**
 * The gateway session is not authenticated: either a request was answered with 401, or the auth status
 * endpoint reported {@code authenticated=false}.
 */
public final class AuthenticationRequiredException extends ClientPortalApiException {

    private static final long serialVersionUID = 1L;

    public AuthenticationRequiredException(String message) {
        super(401, null, message);
    }
}
