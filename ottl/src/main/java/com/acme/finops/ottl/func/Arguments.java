package com.acme.finops.ottl.func;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bound arguments of one call, keyed by parameter name. Optional parameters the call did
 * not supply are absent.
 */
public final class Arguments<K> {
    private final String functionName;
    private final Map<String, Object> values;

    Arguments(String functionName, Map<String, Object> values) {
        this.functionName = functionName;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String functionName() {
        return functionName;
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalStateException("argument " + name + " of " + functionName + " is not bound");
        }
        return (T) values.get(name);
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> optional(String name) {
        return Optional.ofNullable((T) values.get(name));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }
}
