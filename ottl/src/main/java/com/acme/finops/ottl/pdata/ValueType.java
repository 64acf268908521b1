package com.acme.finops.ottl.pdata;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed set of value kinds the engine works with.
 */
public enum ValueType {
    EMPTY("nil"),
    STRING("string"),
    INT("int"),
    DOUBLE("double"),
    BOOL("bool"),
    BYTES("bytes"),
    MAP("map"),
    SLICE("slice"),
    TIME("time"),
    DURATION("duration");

    private final String displayName;

    ValueType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Classifies an already normalized value, or returns {@code null} for host types outside the set.
     */
    public static ValueType of(Object value) {
        if (value == null) return EMPTY;
        if (value instanceof String) return STRING;
        if (value instanceof Long) return INT;
        if (value instanceof Double) return DOUBLE;
        if (value instanceof Boolean) return BOOL;
        if (value instanceof byte[]) return BYTES;
        if (value instanceof PMap) return MAP;
        if (value instanceof PSlice) return SLICE;
        if (value instanceof Instant) return TIME;
        if (value instanceof Duration) return DURATION;
        return null;
    }
}
