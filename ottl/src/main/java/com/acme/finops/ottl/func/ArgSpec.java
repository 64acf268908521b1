package com.acme.finops.ottl.func;

import java.util.Objects;

/**
 * One declared parameter.
 */
public record ArgSpec(String name, ArgType type, boolean optional) {
    public ArgSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static ArgSpec required(String name, ArgType type) {
        return new ArgSpec(name, type, false);
    }

    public static ArgSpec optional(String name, ArgType type) {
        return new ArgSpec(name, type, true);
    }
}
