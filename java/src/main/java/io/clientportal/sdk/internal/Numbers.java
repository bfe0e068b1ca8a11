package io.clientportal.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Lenient numeric parsing for gateway payloads.
 *
 * <p>
 * The gateway mixes plain numbers, formatted strings ({@code "C123.45"}, {@code "1,234"}, {@code "2.5%"}) and wrapper
 * objects ({@code {"amount": 10.0, "currency": "USD"}}, {@code {"value": "12"}}). Volume fields may carry a
 * {@code K}/{@code M}/{@code B} magnitude suffix ({@code "1.2M"}). Every helper returns {@code null}
 * when no number can be recovered; none of them throw.
 * </p>
 */
public final class Numbers {

    private static final Logger LOGGER = Logger.getLogger(Numbers.class.getName());
    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.\\-]");
    private static final Set<String> BLANKS = Set.of("", "-", "n/a", "na", "null", "none");

    private Numbers() {
    }

    public static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isObject()) {
            if (node.has("amount")) {
                return decimal(node.get("amount"));
            }
            if (node.has("value")) {
                return decimal(node.get("value"));
            }
            if (node.size() == 1) {
                Iterator<JsonNode> values = node.elements();
                return decimal(values.next());
            }
            return null;
        }
        if (node.isTextual()) {
            return decimal(node.asText());
        }
        return null;
    }

    public static BigDecimal decimal(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (BLANKS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return null;
        }
        int scale = magnitude(trimmed.charAt(trimmed.length() - 1));
        String cleaned = NON_NUMERIC.matcher(trimmed).replaceAll("");
        if (cleaned.isEmpty() || "-".equals(cleaned)) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(cleaned);
            return scale == 0 ? value : value.scaleByPowerOfTen(scale).stripTrailingZeros();
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.FINE, () -> "[clientportal-sdk] could not parse decimal value: " + raw);
            return null;
        }
    }

    private static int magnitude(char suffix) {
        switch (Character.toUpperCase(suffix)) {
            case 'K':
                return 3;
            case 'M':
                return 6;
            case 'B':
                return 9;
            default:
                return 0;
        }
    }

    public static Long integer(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        BigDecimal value = decimal(node);
        if (value == null) {
            return null;
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException ex) {
            return value.longValue();
        }
    }

    public static Integer smallInteger(JsonNode node) {
        Long value = integer(node);
        if (value == null || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return null;
        }
        return value.intValue();
    }

    public static boolean isZeroOrNull(BigDecimal value) {
        return value == null || value.signum() == 0;
    }
}
