package com.acme.finops.ottl.pdata;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.TypeError;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Normalization, copying and equality for engine values.
 */
public final class Values {
    private Values() {
    }

    public static String typeName(Object value) {
        ValueType type = ValueType.of(value);
        return type == null ? value.getClass().getName() : type.displayName();
    }

    /**
     * Converts a host value into the engine's value set.
     *
     * @throws TypeError when the host type has no engine counterpart
     */
    public static Object toValue(Object value) throws TypeError {
        Object normalized = normalizeOrNull(value, true);
        if (normalized == UNSUPPORTED) {
            throw new TypeError("unsupported value type " + value.getClass().getName());
        }
        return normalized;
    }

    /**
     * Like {@link #toValue(Object)} but rejects times and durations, which cannot live in
     * attribute maps.
     */
    public static Object toAttributeValue(Object value) throws TypeError {
        Object normalized = normalizeOrNull(value, false);
        if (normalized == UNSUPPORTED) {
            throw new TypeError("unsupported attribute value type " + typeName(value));
        }
        return normalized;
    }

    static Object normalizeAttribute(Object value) {
        Object normalized = normalizeOrNull(value, false);
        if (normalized == UNSUPPORTED) {
            throw new IllegalArgumentException("unsupported attribute value type " + value.getClass().getName());
        }
        return normalized;
    }

    private static final Object UNSUPPORTED = new Object();

    private static Object normalizeOrNull(Object value, boolean allowTime) {
        if (value == null
            || value instanceof String
            || value instanceof Long
            || value instanceof Double
            || value instanceof Boolean
            || value instanceof byte[]
            || value instanceof PMap
            || value instanceof PSlice) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof Instant || value instanceof Duration) {
            return allowTime ? value : UNSUPPORTED;
        }
        if (value instanceof Map<?, ?> raw) {
            PMap out = new PMap();
            for (Map.Entry<?, ?> e : raw.entrySet()) {
                Object nested = normalizeOrNull(e.getValue(), false);
                if (nested == UNSUPPORTED) {
                    return UNSUPPORTED;
                }
                out.put(String.valueOf(e.getKey()), nested);
            }
            return out;
        }
        if (value instanceof List<?> raw) {
            PSlice out = new PSlice();
            for (Object item : raw) {
                Object nested = normalizeOrNull(item, false);
                if (nested == UNSUPPORTED) {
                    return UNSUPPORTED;
                }
                out.add(nested);
            }
            return out;
        }
        if (value instanceof Object[] raw) {
            return normalizeOrNull(Arrays.asList(raw), allowTime);
        }
        return UNSUPPORTED;
    }

    public static Object deepCopy(Object value) {
        if (value instanceof PMap m) {
            return m.copy();
        }
        if (value instanceof PSlice s) {
            return s.copy();
        }
        if (value instanceof byte[] b) {
            return b.clone();
        }
        return value;
    }

    public static boolean deepEquals(Object a, Object b) {
        if (a instanceof byte[] x && b instanceof byte[] y) {
            return Arrays.equals(x, y);
        }
        if (a == null || b == null) {
            return a == b;
        }
        return a.equals(b);
    }

    static int deepHashCode(Object value) {
        if (value instanceof byte[] b) {
            return Arrays.hashCode(b);
        }
        return value == null ? 0 : value.hashCode();
    }

    /**
     * Plain {@code java.util} view for JSON rendering. Byte arrays are kept as is.
     */
    public static Object toRaw(Object value) {
        if (value instanceof PMap m) {
            return m.toRaw();
        }
        if (value instanceof PSlice s) {
            return s.toRaw();
        }
        if (value instanceof Instant || value instanceof Duration) {
            return value.toString();
        }
        return value;
    }

    /**
     * Nanoseconds since the Unix epoch.
     *
     * @throws EvaluationException when {@code t} does not fit in a signed 64-bit nanosecond count
     */
    public static long unixNano(Instant t) throws EvaluationException {
        try {
            return Math.addExact(Math.multiplyExact(t.getEpochSecond(), 1_000_000_000L), t.getNano());
        } catch (ArithmeticException e) {
            throw new EvaluationException("time " + t + " is out of range for unix nanoseconds", e);
        }
    }
}
