package io.clientportal.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class NumbersTest {

    @Test
    void stripsFormattingFromGatewayStrings() {
        assertEquals(0, new BigDecimal("123.45").compareTo(Numbers.decimal("C123.45")));
        assertEquals(0, new BigDecimal("1234").compareTo(Numbers.decimal("1,234")));
        assertEquals(0, new BigDecimal("2.5").compareTo(Numbers.decimal("2.5%")));
        assertEquals(0, new BigDecimal("-0.75").compareTo(Numbers.decimal("-0.75")));
    }

    @Test
    void appliesMagnitudeSuffixes() {
        assertEquals(0, new BigDecimal("1200000").compareTo(Numbers.decimal("1.2M")));
        assertEquals(0, new BigDecimal("850").compareTo(Numbers.decimal("0.85K")));
        assertEquals(0, new BigDecimal("3000000000").compareTo(Numbers.decimal("3B")));
    }

    @Test
    void blanksAndPlaceholdersAreNull() {
        assertNull(Numbers.decimal((String) null));
        assertNull(Numbers.decimal(""));
        assertNull(Numbers.decimal("N/A"));
        assertNull(Numbers.decimal("-"));
        assertNull(Numbers.decimal("USD"));
        assertNull(Numbers.decimal("1.2.3"));
    }

    @Test
    void unwrapsAmountAndValueObjects() throws IOException {
        assertEquals(0, new BigDecimal("10.5").compareTo(Numbers.decimal(node("{\"amount\":10.5,\"currency\":\"USD\"}"))));
        assertEquals(0, new BigDecimal("12").compareTo(Numbers.decimal(node("{\"value\":\"12\"}"))));
        assertEquals(0, new BigDecimal("7").compareTo(Numbers.decimal(node("{\"after\":7}"))));
        assertNull(Numbers.decimal(node("{\"a\":1,\"b\":2}")));
        assertNull(Numbers.decimal(node("null")));
        assertNull(Numbers.decimal((JsonNode) null));
    }

    @Test
    void integersTolerateDecimalsAndSuffixes() throws IOException {
        assertEquals(42L, Numbers.integer(node("42")));
        assertEquals(1_500_000L, Numbers.integer(node("\"1.5M\"")));
        assertEquals(3L, Numbers.integer(node("3.7")));
        assertNull(Numbers.smallInteger(node("9999999999")));
        assertEquals(7, Numbers.smallInteger(node("\"7\"")));
    }

    @Test
    void zeroOrNull() {
        assertTrue(Numbers.isZeroOrNull(null));
        assertTrue(Numbers.isZeroOrNull(new BigDecimal("0.00")));
        assertFalse(Numbers.isZeroOrNull(BigDecimal.ONE));
    }

    private static JsonNode node(String json) throws IOException {
        return Json.mapper().readTree(json);
    }
}
