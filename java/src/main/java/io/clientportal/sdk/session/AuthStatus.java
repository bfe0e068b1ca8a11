package io.clientportal.sdk.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.clientportal.sdk.internal.Json;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of the gateway's {@code /iserver/auth/status} answer. Replaced wholesale on every check.
 *
 * @param authenticated whether the session may perform trading and data operations.
 * @param raw           the full payload as returned by the gateway.
 * @param checkedAt     when the status was obtained.
 */
public record AuthStatus(boolean authenticated, Map<String, Object> raw, Instant checkedAt) {

    public AuthStatus {
        Objects.requireNonNull(checkedAt, "checkedAt");
        raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    static AuthStatus from(JsonNode payload, Instant checkedAt) {
        boolean authenticated = payload != null && payload.path("authenticated").asBoolean(false);
        return new AuthStatus(authenticated, Json.toMap(payload), checkedAt);
    }

    public boolean connected() {
        return Boolean.TRUE.equals(raw.get("connected"));
    }

    public boolean competing() {
        return Boolean.TRUE.equals(raw.get("competing"));
    }

    public String message() {
        Object message = raw.get("message");
        return message == null ? null : message.toString();
    }

    AuthStatus withCheckedAt(Instant instant) {
        return new AuthStatus(authenticated, raw, instant);
    }
}
