package io.clientportal.sdk;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.clientportal.sdk.session.SessionGuard;
import io.clientportal.sdk.transport.GatewayTransport;
import io.clientportal.sdk.transport.RetryPolicy;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process gateway for adapter tests. Responses are registered per {@code METHOD /path} (path relative to
 * {@code /v1/api}); unregistered routes answer 404. Every request is recorded.
 *
 * <p>
 * Response bodies may use single quotes in place of double quotes to keep fixtures readable.
 * </p>
 */
public final class GatewayStub implements AutoCloseable {

    public static final SessionGuard ALWAYS_LIVE = () -> {
    };

    private final HttpServer server;
    private final Map<String, Reply> routes = new ConcurrentHashMap<>();
    private final List<Recorded> requests = Collections.synchronizedList(new ArrayList<>());

    public GatewayStub() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    public String baseUrl() {
        return "http://localhost:" + server.getAddress().getPort() + "/v1/api";
    }

    public GatewayTransport transport() {
        return new GatewayTransport(
            HttpClient.newHttpClient(),
            baseUrl(),
            Duration.ofSeconds(5),
            new RetryPolicy(0, Duration.ofMillis(10), 2.0)
        );
    }

    public GatewayStub on(String method, String path, String json) {
        return on(method, path, 200, json);
    }

    public GatewayStub on(String method, String path, int status, String json) {
        routes.put(method + " " + path, new Reply(status, json.replace('\'', '"')));
        return this;
    }

    public List<Recorded> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public int count(String method, String path) {
        return (int) requests().stream()
            .filter(r -> r.method().equals(method) && r.path().equals(path))
            .count();
    }

    public Recorded last(String method, String path) {
        List<Recorded> snapshot = requests();
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            Recorded r = snapshot.get(i);
            if (r.method().equals(method) && r.path().equals(path)) {
                return r;
            }
        }
        throw new AssertionError("no " + method + " " + path + " request recorded");
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        if (path.startsWith("/v1/api")) {
            path = path.substring("/v1/api".length());
        }
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new Recorded(method, path, exchange.getRequestURI().getRawQuery(), body));

        Reply reply = routes.get(method + " " + path);
        if (reply == null) {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
            return;
        }
        byte[] bytes = reply.json().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(reply.status(), bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private record Reply(int status, String json) {
    }

    public record Recorded(String method, String path, String query, String body) {
    }
}
