package io.clientportal.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clientportal.sdk.ClientPortalApiException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding error payloads returned by the gateway. The gateway answers with either
 * {@code {"error": "..."}} or {@code {"code": "...", "message": "..."}}; plain-text bodies are kept verbatim.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static ClientPortalApiException decode(int statusCode, byte[] body) {
        if (body == null || body.length == 0) {
            return new ClientPortalApiException(statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(body);
            if (!node.isObject()) {
                return new ClientPortalApiException(statusCode, null, node.asText(null));
            }
            String code = node.hasNonNull("code") ? node.get("code").asText() : null;
            String message = node.hasNonNull("message") ? node.get("message").asText() : null;
            if (message == null && node.hasNonNull("error")) {
                message = node.get("error").asText();
            }
            return new ClientPortalApiException(statusCode, code, message);
        } catch (IOException ex) {
            String fallback = new String(body, StandardCharsets.UTF_8).trim();
            return new ClientPortalApiException(statusCode, null, fallback);
        }
    }
}
