package com.acme.finops.ottl.func;

import com.acme.finops.ottl.ConfigException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds name-indexed function catalogs.
 */
public final class FactoryMap {
    private FactoryMap() {
    }

    @SafeVarargs
    public static <K> Map<String, Factory<K>> of(Factory<K>... factories) throws ConfigException {
        return of(List.of(factories));
    }

    /**
     * @throws ConfigException on a duplicate name or an invalid signature
     */
    public static <K> Map<String, Factory<K>> of(Collection<? extends Factory<K>> factories) throws ConfigException {
        Map<String, Factory<K>> out = new LinkedHashMap<>();
        for (Factory<K> f : factories) {
            String name = f.name();
            if (name == null || name.isEmpty()) {
                throw new ConfigException("function factory without a name");
            }
            f.signature().validate(name);
            if (out.putIfAbsent(name, f) != null) {
                throw new ConfigException("duplicate function name " + name);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Union of catalogs; duplicates across the inputs are rejected.
     */
    @SafeVarargs
    public static <K> Map<String, Factory<K>> merge(Map<String, Factory<K>>... catalogs) throws ConfigException {
        Map<String, Factory<K>> out = new LinkedHashMap<>();
        for (Map<String, Factory<K>> catalog : catalogs) {
            for (Factory<K> f : catalog.values()) {
                if (out.putIfAbsent(f.name(), f) != null) {
                    throw new ConfigException("duplicate function name " + f.name());
                }
            }
        }
        return Collections.unmodifiableMap(out);
    }
}
