package com.field.audit.stringify;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient readers for raw item properties.
 * Host values arrive as strings, numbers or booleans depending on storage, so every reader
 * accepts all three and falls back to a neutral value.
 */
public final class ItemValues {

    public static final String VALUE = "value";

    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*([+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    private static final double LONG_RANGE = 0x1p63;
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private ItemValues() {
        // utility class
    }

    /**
     * Reads a property as text. Null becomes the empty string; integral numbers print without a fraction.
     */
    public static String text(Map<String, Object> item, String key) {
        return item != null ? asText(item.get(key)) : "";
    }

    public static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Math.abs(d) < LONG_RANGE
                        ? String.valueOf((long) d)
                        : BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
            }
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    /**
     * Truthiness of a property: null, false, zero, {@code ""}, {@code "0"} and empty collections are false.
     */
    public static boolean isTruthy(Map<String, Object> item, String key) {
        return item != null && isTruthy(item.get(key));
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0 && !"0".contentEquals(text);
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        return true;
    }

    /**
     * Reads a property as a whole number, truncating fractions and saturating at the long range.
     * Non-numeric input yields 0.
     */
    public static long asLong(Map<String, Object> item, String key) {
        Object value = item != null ? item.get(key) : null;
        if (value instanceof BigDecimal decimal) {
            return saturate(decimal);
        }
        if (value instanceof BigInteger integer) {
            return saturate(new BigDecimal(integer));
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        BigDecimal parsed = leadingNumber(value);
        return parsed != null ? saturate(parsed) : 0L;
    }

    private static long saturate(BigDecimal value) {
        if (value.compareTo(LONG_MAX) > 0) {
            return Long.MAX_VALUE;
        }
        if (value.compareTo(LONG_MIN) < 0) {
            return Long.MIN_VALUE;
        }
        return value.longValue();
    }

    /**
     * Reads a property as a floating point number. Non-numeric input yields 0.
     */
    public static double asDouble(Map<String, Object> item, String key) {
        Object value = item != null ? item.get(key) : null;
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        BigDecimal parsed = leadingNumber(value);
        return parsed != null ? parsed.doubleValue() : 0.0;
    }

    private static BigDecimal leadingNumber(Object value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = LEADING_NUMBER.matcher(value.toString());
        if (!matcher.find()) {
            return null;
        }
        try {
            return new BigDecimal(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
