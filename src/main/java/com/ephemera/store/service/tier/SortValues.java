package com.ephemera.store.service.tier;

import com.ephemera.store.enums.SortOrder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Ordering rules for payload values, shared by both tiers.
 * <p>
 * Values of different types are ordered by type bracket the way MongoDB orders BSON
 * types (null, numbers, strings, objects, arrays, booleans, dates). Within a bracket
 * numbers compare numerically whatever their Java type, strings lexically.
 * Range checks ({@link #isBeyond}, {@link #isBetter}) only match values of the same
 * bracket, like {@code $gt}/{@code $lt} do.
 */
public final class SortValues {

    /** Marks a path that does not exist in the payload (as opposed to an explicit null). */
    public static final Object MISSING = new Object() {
        @Override
        public String toString() {
            return "MISSING";
        }
    };

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private SortValues() {
    }

    static int bracket(Object v) {
        if (v == null) return 0;
        if (v instanceof Number) return 1;
        if (v instanceof CharSequence) return 2;
        if (v instanceof Map) return 3;
        if (v instanceof Collection || v.getClass().isArray()) return 4;
        if (v instanceof Boolean) return 5;
        if (v instanceof Date || v instanceof Instant) return 6;
        return 7;
    }

    public static boolean sameBracket(Object a, Object b) {
        return bracket(a) == bracket(b);
    }

    /**
     * Ascending 3-way comparison.
     */
    public static int compare(Object a, Object b) {
        final int ba = bracket(a);
        final int bb = bracket(b);
        if (ba != bb) return Integer.compare(ba, bb);
        switch (ba) {
            case 0:
                return 0;
            case 1:
                return compareNumbers((Number) a, (Number) b);
            case 2:
                return a.toString().compareTo(b.toString());
            case 5:
                return Boolean.compare((Boolean) a, (Boolean) b);
            case 6:
                return toInstant(a).compareTo(toInstant(b));
            default:
                return String.valueOf(a).compareTo(String.valueOf(b));
        }
    }

    public static int compare(Object a, Object b, SortOrder order) {
        return order == SortOrder.ASC ? compare(a, b) : compare(b, a);
    }

    /**
     * True when {@code value} lies strictly after {@code cursor} in {@code order}.
     */
    public static boolean isBeyond(Object value, Object cursor, SortOrder order) {
        return sameBracket(value, cursor) && compare(value, cursor, order) > 0;
    }

    /**
     * True when {@code value} ranks strictly ahead of {@code target}: higher for DESC,
     * lower for ASC.
     */
    public static boolean isBetter(Object value, Object target, SortOrder order) {
        return sameBracket(value, target) && compare(value, target, order) < 0;
    }

    /**
     * Follows a dotted path through nested maps. Returns {@link #MISSING} when any
     * segment is absent.
     */
    public static Object lookup(Object payload, String path) {
        Object cur = payload;
        for (String segment : path.split("\\.")) {
            if (!(cur instanceof Map)) return MISSING;
            final Map<?, ?> m = (Map<?, ?>) cur;
            if (!m.containsKey(segment)) return MISSING;
            cur = m.get(segment);
        }
        return cur;
    }

    /**
     * The value an entry sorts by: the field itself, or {@code defaultValue} when the
     * field is missing or null and a default was given ({@code $ifNull} semantics).
     * Returns {@link #MISSING} when the entry does not take part in the ordering.
     */
    public static Object effectiveValue(Object payload, String field, Object defaultValue) {
        final Object v = lookup(payload, field);
        if ((v == MISSING || v == null) && defaultValue != null) return defaultValue;
        return v;
    }

    /**
     * Types a cursor or default value taken from a query string: integers and decimals
     * become numbers, anything else stays a string.
     */
    public static Object parse(String raw) {
        if (raw == null || raw.isEmpty()) return null;
        if (INTEGER.matcher(raw).matches()) {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException tooLarge) {
                // out of long range, falls through to decimal
            }
        }
        if (DECIMAL.matcher(raw).matches()) {
            final double d = Double.parseDouble(raw);
            if (Double.isFinite(d)) return d;
        }
        return raw;
    }

    private static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return toBigInteger(a).compareTo(toBigInteger(b));
        }
        final double da = a.doubleValue();
        final double db = b.doubleValue();
        if (!Double.isFinite(da) || !Double.isFinite(db)) {
            return Double.compare(da, db);
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short
                || n instanceof Byte || n instanceof BigInteger;
    }

    private static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger ? (BigInteger) n : BigInteger.valueOf(n.longValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) return (BigDecimal) n;
        if (n instanceof BigInteger) return new BigDecimal((BigInteger) n);
        if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
        return new BigDecimal(n.toString());
    }

    private static Instant toInstant(Object v) {
        return v instanceof Date ? ((Date) v).toInstant() : (Instant) v;
    }
}
