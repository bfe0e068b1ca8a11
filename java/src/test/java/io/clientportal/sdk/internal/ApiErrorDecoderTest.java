package io.clientportal.sdk.internal;

import io.clientportal.sdk.ClientPortalApiException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorDecoderTest {

    @Test
    void readsCodeAndMessage() {
        ClientPortalApiException ex = ApiErrorDecoder.decode(400, bytes("{\"code\":\"BAD_CONID\",\"message\":\"unknown conid\"}"));

        assertEquals(400, ex.getStatusCode());
        assertEquals("BAD_CONID", ex.getCode());
        assertEquals("unknown conid", ex.getMessage());
    }

    @Test
    void fallsBackToErrorField() {
        ClientPortalApiException ex = ApiErrorDecoder.decode(404, bytes("{\"error\":\"no such account\"}"));

        assertNull(ex.getCode());
        assertEquals("no such account", ex.getMessage());
    }

    @Test
    void keepsPlainTextBodies() {
        ClientPortalApiException ex = ApiErrorDecoder.decode(429, bytes("Too many requests <html>"));

        assertEquals("Too many requests <html>", ex.getMessage());
    }

    @Test
    void emptyBodyUsesStatusMessage() {
        ClientPortalApiException ex = ApiErrorDecoder.decode(410, new byte[0]);

        assertEquals("Gateway request failed with status 410", ex.getMessage());
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
