package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.TypeError;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.PSlice;
import com.acme.finops.ottl.pdata.Values;
import com.acme.finops.ottl.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Strict and coercing conversions used by typed getters.
 *
 * <p>Strict conversions accept exactly one kind and raise {@link TypeError} otherwise,
 * nil included. The {@code *_LIKE} conversions return {@code null} for nil and for inputs
 * that do not parse.</p>
 */
public final class Coercions {
    private Coercions() {
    }

    public static final Coercion<String> STRING = v -> {
        if (v instanceof String s) return s;
        throw TypeError.expected("string", v);
    };

    public static final Coercion<Long> INT = v -> {
        if (v instanceof Long l) return l;
        throw TypeError.expected("int", v);
    };

    public static final Coercion<Double> FLOAT = v -> {
        if (v instanceof Double d) return d;
        throw TypeError.expected("double", v);
    };

    public static final Coercion<Boolean> BOOL = v -> {
        if (v instanceof Boolean b) return b;
        throw TypeError.expected("bool", v);
    };

    public static final Coercion<PMap> MAP = v -> {
        if (v instanceof PMap m) return m;
        throw TypeError.expected("map", v);
    };

    public static final Coercion<PSlice> SLICE = v -> {
        if (v instanceof PSlice s) return s;
        throw TypeError.expected("slice", v);
    };

    public static final Coercion<Instant> TIME = v -> {
        if (v instanceof Instant t) return t;
        throw TypeError.expected("time", v);
    };

    public static final Coercion<Duration> DURATION = v -> {
        if (v instanceof Duration d) return d;
        throw TypeError.expected("duration", v);
    };

    public static final Coercion<String> STRING_LIKE = Coercions::toStringLike;

    public static final Coercion<Long> INT_LIKE = v -> {
        if (v == null) return null;
        if (v instanceof Long l) return l;
        if (v instanceof Double d) return (long) d.doubleValue();
        if (v instanceof Boolean b) return b ? 1L : 0L;
        if (v instanceof String s) {
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        throw new TypeError("unsupported type for int conversion: " + Values.typeName(v));
    };

    public static final Coercion<Double> FLOAT_LIKE = v -> {
        if (v == null) return null;
        if (v instanceof Double d) return d;
        if (v instanceof Long l) return l.doubleValue();
        if (v instanceof Boolean b) return b ? 1d : 0d;
        if (v instanceof String s) {
            return parseDoubleOrNull(s);
        }
        throw new TypeError("unsupported type for double conversion: " + Values.typeName(v));
    };

    public static final Coercion<Boolean> BOOL_LIKE = v -> {
        if (v == null) return null;
        if (v instanceof Boolean b) return b;
        if (v instanceof Long l) return l != 0L;
        if (v instanceof Double d) return d != 0d;
        if (v instanceof String s) {
            return parseBool(s);
        }
        throw new TypeError("unsupported type for bool conversion: " + Values.typeName(v));
    };

    public static final Coercion<byte[]> BYTES_LIKE = v -> {
        if (v == null) return null;
        if (v instanceof byte[] b) return b;
        if (v instanceof String s) return s.getBytes(StandardCharsets.UTF_8);
        if (v instanceof Long l) return ByteBuffer.allocate(Long.BYTES).putLong(l).array();
        if (v instanceof Double d) return ByteBuffer.allocate(Double.BYTES).putDouble(d).array();
        if (v instanceof Boolean b) return new byte[]{(byte) (b ? 1 : 0)};
        throw new TypeError("unsupported type for bytes conversion: " + Values.typeName(v));
    };

    private static String toStringLike(Object v) throws EvaluationException {
        if (v == null) return null;
        if (v instanceof String s) return s;
        if (v instanceof byte[] b) return HexFormat.of().formatHex(b);
        if (v instanceof Long l) return Long.toString(l);
        if (v instanceof Double d) return formatDouble(d);
        if (v instanceof Boolean b) return Boolean.toString(b);
        if (v instanceof Instant t) return t.toString();
        if (v instanceof Duration d) return d.toString();
        if (v instanceof PMap || v instanceof PSlice) {
            try {
                return JsonCodec.writeValue(v);
            } catch (JsonProcessingException e) {
                throw new EvaluationException("unable to render " + Values.typeName(v) + " as JSON", e);
            }
        }
        throw new TypeError("unsupported type for string conversion: " + Values.typeName(v));
    }

    /**
     * Shortest decimal rendering: {@code 2.0} renders as {@code 2}, {@code 1.5} as {@code 1.5}.
     */
    public static String formatDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        double abs = Math.abs(d);
        if (abs != 0d && (abs < 1e-6 || abs >= 1e21)) {
            return Double.toString(d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    static Double parseDoubleOrNull(String s) {
        String t = s.trim();
        if (t.isEmpty() || !t.equals(s)) {
            return null;
        }
        char last = t.charAt(t.length() - 1);
        if (last == 'd' || last == 'D' || last == 'f' || last == 'F') {
            return null;
        }
        try {
            return Double.parseDouble(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Boolean parseBool(String s) throws EvaluationException {
        return switch (s) {
            case "1", "t", "T", "true", "TRUE", "True" -> Boolean.TRUE;
            case "0", "f", "F", "false", "FALSE", "False" -> Boolean.FALSE;
            default -> throw new EvaluationException("invalid syntax for bool: \"" + s + "\"");
        };
    }
}
