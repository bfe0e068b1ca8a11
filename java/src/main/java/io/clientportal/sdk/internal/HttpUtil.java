package io.clientportal.sdk.internal;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helper methods for issuing HTTP requests with JSON payloads.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    /**
     * Sends one request. {@code jsonBody} is the already serialised payload, or {@code null} for an empty body.
     */
    public static HttpResponse<byte[]> sendJson(HttpClient client, String method, URI uri, byte[] jsonBody, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(timeout);

        if (jsonBody == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(jsonBody));
            builder.header("Content-Type", "application/json");
        }

        builder.header("Accept", "application/json");

        HttpRequest request = builder.build();
        return client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    }

    /**
     * Joins {@code baseUrl} and {@code path} and appends the URL-encoded query string. Null parameter values are skipped.
     */
    public static URI buildUri(String baseUrl, String path, Map<String, ?> params) {
        StringBuilder url = new StringBuilder(baseUrl);
        if (path != null && !path.isEmpty()) {
            if (!path.startsWith("/")) {
                url.append('/');
            }
            url.append(path);
        }

        if (params != null && !params.isEmpty()) {
            StringJoiner query = new StringJoiner("&");
            for (Map.Entry<String, ?> entry : params.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                query.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(String.valueOf(entry.getValue()), StandardCharsets.UTF_8));
            }
            if (query.length() > 0) {
                url.append(url.indexOf("?") >= 0 ? '&' : '?').append(query);
            }
        }
        return URI.create(url.toString());
    }
}
