package io.clientportal.sdk.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.clientportal.sdk.AccessForbiddenException;
import io.clientportal.sdk.AuthenticationRequiredException;
import io.clientportal.sdk.ClientPortalException;
import io.clientportal.sdk.Config;
import io.clientportal.sdk.NetworkException;
import io.clientportal.sdk.ServerErrorException;
import io.clientportal.sdk.internal.ApiErrorDecoder;
import io.clientportal.sdk.internal.HttpUtil;
import io.clientportal.sdk.internal.Json;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Executes single calls against the gateway with bounded automatic retry.
 *
 * <h2>Outcome classification</h2>
 * <ul>
 *   <li>{@code 401} fails immediately with {@link AuthenticationRequiredException}.</li>
 *   <li>{@code 403} fails immediately with {@link AccessForbiddenException}.</li>
 *   <li>{@code >= 500} is retried per {@link RetryPolicy}; once exhausted, {@link ServerErrorException} carries the last status.</li>
 *   <li>Connection failures and timeouts are retried on the same schedule; once exhausted, {@link NetworkException}.</li>
 *   <li>Any other non-2xx fails immediately with {@link io.clientportal.sdk.ClientPortalApiException}.</li>
 * </ul>
 *
 * <p>
 * A 2xx with an empty body yields an empty JSON object; a 2xx with malformed JSON is a fatal
 * {@link ClientPortalException}. The transport knows nothing about sessions and is safe for concurrent use.
 * </p>
 */
public final class GatewayTransport {

    private static final Logger LOGGER = Logger.getLogger(GatewayTransport.class.getName());

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final RetryPolicy retryPolicy;

    public GatewayTransport(Config config) {
        Config resolved = Objects.requireNonNull(config, "config").withDefaults();
        this.httpClient = resolved.getHttpClient();
        this.baseUrl = resolved.getBaseUrl();
        this.requestTimeout = resolved.getRequestTimeout();
        this.retryPolicy = resolved.retryPolicy();
    }

    public GatewayTransport(HttpClient httpClient, String baseUrl, Duration requestTimeout, RetryPolicy retryPolicy) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        String base = Objects.requireNonNull(baseUrl, "baseUrl").trim();
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Config.DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.DEFAULT : retryPolicy;
    }

    public JsonNode get(String path) throws ClientPortalException {
        return request("GET", path, null, null);
    }

    public JsonNode get(String path, Map<String, ?> params) throws ClientPortalException {
        return request("GET", path, params, null);
    }

    public JsonNode post(String path) throws ClientPortalException {
        return request("POST", path, null, null);
    }

    public JsonNode post(String path, Object body) throws ClientPortalException {
        return request("POST", path, null, body);
    }

    public JsonNode delete(String path) throws ClientPortalException {
        return request("DELETE", path, null, null);
    }

    /**
     * Issues {@code method path} and returns the parsed JSON response.
     *
     * @param method HTTP verb ({@code GET}, {@code POST}, {@code DELETE}, ...).
     * @param path   path relative to the configured base URL.
     * @param params optional query parameters; null values are skipped.
     * @param body   optional payload serialised as JSON.
     * @return the response body, or an empty object when the body is empty.
     * @throws ClientPortalException classified as described on the class.
     */
    public JsonNode request(String method, String path, Map<String, ?> params, Object body) throws ClientPortalException {
        String verb = Objects.requireNonNull(method, "method").trim().toUpperCase(Locale.ROOT);
        Objects.requireNonNull(path, "path");
        URI uri = HttpUtil.buildUri(baseUrl, path, params);
        byte[] payload = serialize(verb, path, body);
        int maxAttempts = retryPolicy.maxAttempts();

        for (int attempt = 0; ; attempt++) {
            int attemptNumber = attempt + 1;
            HttpResponse<byte[]> response;
            try {
                response = HttpUtil.sendJson(httpClient, verb, uri, payload, requestTimeout);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ClientPortalException(verb + " " + path + " interrupted", ex);
            } catch (IOException ex) {
                if (attemptNumber < maxAttempts) {
                    Duration delay = retryPolicy.delayForAttempt(attempt);
                    LOGGER.warning(() -> String.format(Locale.ROOT,
                        "[clientportal-sdk] %s %s failed (%s), retrying in %d ms (attempt %d/%d)",
                        verb, path, describe(ex), delay.toMillis(), attemptNumber, maxAttempts));
                    pause(verb, path, delay);
                    continue;
                }
                throw new NetworkException(
                    verb + " " + path + " failed after " + attemptNumber + " attempt(s): " + describe(ex),
                    attemptNumber,
                    ex
                );
            }

            int status = response.statusCode();
            if (status == 401) {
                throw new AuthenticationRequiredException("Authentication required for " + verb + " " + path);
            }
            if (status == 403) {
                throw new AccessForbiddenException("Access forbidden for " + verb + " " + path);
            }
            if (status >= 500) {
                if (attemptNumber < maxAttempts) {
                    Duration delay = retryPolicy.delayForAttempt(attempt);
                    LOGGER.warning(() -> String.format(Locale.ROOT,
                        "[clientportal-sdk] server error %d on %s %s, retrying in %d ms (attempt %d/%d)",
                        status, verb, path, delay.toMillis(), attemptNumber, maxAttempts));
                    pause(verb, path, delay);
                    continue;
                }
                throw new ServerErrorException(status, attemptNumber);
            }
            if (status < 200 || status >= 300) {
                throw ApiErrorDecoder.decode(status, response.body());
            }
            return decode(verb, path, response.body());
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private static byte[] serialize(String verb, String path, Object body) throws ClientPortalException {
        if (body == null) {
            return null;
        }
        try {
            return Json.mapper().writeValueAsBytes(body);
        } catch (JsonProcessingException ex) {
            throw new ClientPortalException("encode request for " + verb + " " + path + ": " + ex.getOriginalMessage(), ex);
        }
    }

    private static JsonNode decode(String verb, String path, byte[] body) throws ClientPortalException {
        if (body == null || new String(body, StandardCharsets.UTF_8).isBlank()) {
            return Json.mapper().createObjectNode();
        }
        try {
            return Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw new ClientPortalException("decode response for " + verb + " " + path + ": " + ex.getMessage(), ex);
        }
    }

    private static void pause(String verb, String path, Duration delay) throws ClientPortalException {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ClientPortalException(verb + " " + path + " interrupted during retry backoff", ex);
        }
    }

    private static String describe(IOException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
