package io.clientportal.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.clientportal.sdk.AccessForbiddenException;
import io.clientportal.sdk.AuthenticationRequiredException;
import io.clientportal.sdk.ClientPortalApiException;
import io.clientportal.sdk.ClientPortalException;
import io.clientportal.sdk.NetworkException;
import io.clientportal.sdk.ServerErrorException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GatewayTransportTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private URI baseUri;
    private final AtomicInteger calls = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort() + "/v1/api");
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void retriesServerErrorsWithBackoffUntilExhausted() {
        server.createContext("/v1/api/portfolio/accounts", exchange -> {
            calls.incrementAndGet();
            respond(exchange, 500, Map.of("error", "internal"));
        });
        GatewayTransport transport = transport(new RetryPolicy(3, Duration.ofMillis(100), 2.0));

        long started = System.nanoTime();
        ServerErrorException ex = assertThrows(ServerErrorException.class,
            () -> transport.get("/portfolio/accounts"));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals(4, calls.get());
        assertEquals(4, ex.getAttempts());
        assertEquals(500, ex.getStatusCode());
        // 100 + 200 + 400
        assertTrue(elapsedMillis >= 700, "expected backoff of at least 700ms but took " + elapsedMillis);
    }

    @Test
    void recoversWhenServerErrorIsTransient() throws Exception {
        server.createContext("/v1/api/portfolio/accounts", exchange -> {
            if (calls.incrementAndGet() < 3) {
                respond(exchange, 500, Map.of("error", "busy"));
                return;
            }
            respond(exchange, 200, Map.of("ok", true));
        });
        GatewayTransport transport = transport(new RetryPolicy(3, Duration.ofMillis(100), 2.0));

        long started = System.nanoTime();
        JsonNode result = transport.get("/portfolio/accounts");
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertTrue(result.path("ok").asBoolean());
        assertEquals(3, calls.get());
        assertTrue(elapsedMillis >= 300, "expected backoff of at least 300ms but took " + elapsedMillis);
    }

    @Test
    void unauthorizedIsNeverRetried() {
        server.createContext("/v1/api/iserver/accounts", exchange -> {
            calls.incrementAndGet();
            respond(exchange, 401, Map.of("error", "not authenticated"));
        });
        GatewayTransport transport = transport(new RetryPolicy(3, Duration.ofMillis(10), 2.0));

        AuthenticationRequiredException ex = assertThrows(AuthenticationRequiredException.class,
            () -> transport.get("/iserver/accounts"));

        assertEquals(1, calls.get());
        assertEquals(401, ex.getStatusCode());
    }

    @Test
    void forbiddenIsNeverRetried() {
        server.createContext("/v1/api/iserver/accounts", exchange -> {
            calls.incrementAndGet();
            respond(exchange, 403, Map.of("error", "forbidden"));
        });
        GatewayTransport transport = transport(new RetryPolicy(3, Duration.ofMillis(10), 2.0));

        AccessForbiddenException ex = assertThrows(AccessForbiddenException.class,
            () -> transport.get("/iserver/accounts"));

        assertEquals(1, calls.get());
        assertEquals(403, ex.getStatusCode());
    }

    @Test
    void otherClientErrorsSurfaceGatewayMessage() {
        server.createContext("/v1/api/iserver/secdef/search", exchange -> {
            calls.incrementAndGet();
            respond(exchange, 400, Map.of("error", "symbol required"));
        });
        GatewayTransport transport = transport(new RetryPolicy(3, Duration.ofMillis(10), 2.0));

        ClientPortalApiException ex = assertThrows(ClientPortalApiException.class,
            () -> transport.get("/iserver/secdef/search"));

        assertEquals(1, calls.get());
        assertEquals(400, ex.getStatusCode());
        assertEquals("symbol required", ex.getMessage());
    }

    @Test
    void emptyBodyYieldsEmptyObject() throws Exception {
        server.createContext("/v1/api/tickle", exchange -> {
            calls.incrementAndGet();
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        GatewayTransport transport = transport(RetryPolicy.DEFAULT);

        JsonNode result = transport.post("/tickle");

        assertTrue(result.isObject());
        assertEquals(0, result.size());
    }

    @Test
    void malformedJsonIsFatal() {
        server.createContext("/v1/api/portfolio/accounts", exchange -> {
            calls.incrementAndGet();
            byte[] payload = "{not json".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
        });
        GatewayTransport transport = transport(new RetryPolicy(3, Duration.ofMillis(10), 2.0));

        ClientPortalException ex = assertThrows(ClientPortalException.class,
            () -> transport.get("/portfolio/accounts"));

        assertFalse(ex instanceof ClientPortalApiException);
        assertEquals(1, calls.get());
    }

    @Test
    void networkFailuresAreRetriedThenReported() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress(0), 0);
        closed.start();
        int port = closed.getAddress().getPort();
        closed.stop(0);
        GatewayTransport transport = new GatewayTransport(
            HttpClient.newHttpClient(),
            "http://localhost:" + port + "/v1/api",
            Duration.ofSeconds(2),
            new RetryPolicy(2, Duration.ofMillis(10), 2.0)
        );

        NetworkException ex = assertThrows(NetworkException.class, () -> transport.get("/portfolio/accounts"));

        assertEquals(3, ex.getAttempts());
        assertNotNull(ex.getCause());
    }

    @Test
    void sendsJsonBodyAndEncodedQuery() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        AtomicReference<String> contentType = new AtomicReference<>();
        AtomicReference<String> accept = new AtomicReference<>();
        AtomicReference<JsonNode> body = new AtomicReference<>();
        server.createContext("/v1/api/iserver/scanner/run", exchange -> {
            calls.incrementAndGet();
            query.set(exchange.getRequestURI().getRawQuery());
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            accept.set(exchange.getRequestHeaders().getFirst("Accept"));
            body.set(MAPPER.readTree(exchange.getRequestBody()));
            respond(exchange, 200, Map.of("ok", true));
        });
        GatewayTransport transport = transport(RetryPolicy.DEFAULT);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", "BRK B");
        params.put("skipped", null);
        transport.request("POST", "iserver/scanner/run", params, Map.of("type", "MOST_ACTIVE"));

        assertEquals("symbol=BRK+B", query.get());
        assertEquals("application/json", contentType.get());
        assertEquals("application/json", accept.get());
        assertEquals("MOST_ACTIVE", body.get().path("type").asText());
    }

    private GatewayTransport transport(RetryPolicy policy) {
        return new GatewayTransport(HttpClient.newHttpClient(), baseUri.toString(), Duration.ofSeconds(5), policy);
    }

    private static void respond(HttpExchange exchange, int status, Map<String, ?> body) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}
