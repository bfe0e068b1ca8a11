package io.clientportal.sdk.session;

import io.clientportal.sdk.ClientPortalException;

import java.util.Map;

/**
 * Contract adapters rely on to make sure the gateway session is usable before issuing a request.
 */
public interface SessionGuard {

    /**
     * Returns once the session is known to be authenticated, checking with the gateway when the cached status is stale.
     *
     * @throws io.clientportal.sdk.AuthenticationRequiredException  when the gateway reports the session as unauthenticated.
     * @throws io.clientportal.sdk.ReauthenticationFailedException  when an expired session could not be restored.
     */
    void ensureLive() throws ClientPortalException;

    default Map<String, Object> sessionInfo() throws ClientPortalException {
        ensureLive();
        return Map.of();
    }

    default void logout() {
        // default no-op
    }
}
