package com.acme.finops.ottl.path;

import com.acme.finops.ottl.ConfigException;

import java.util.Map;

/**
 * Resolves uppercase enum symbols such as {@code SPAN_KIND_SERVER} to their int values.
 */
@FunctionalInterface
public interface EnumParser {
    long parse(String symbol) throws ConfigException;

    static EnumParser none() {
        return symbol -> {
            throw new ConfigException("enum symbol " + symbol + " is not supported in this context");
        };
    }

    static EnumParser of(Map<String, Long> table) {
        Map<String, Long> copy = Map.copyOf(table);
        return symbol -> {
            Long v = copy.get(symbol);
            if (v == null) {
                throw new ConfigException("enum symbol " + symbol + " not found");
            }
            return v;
        };
    }
}
