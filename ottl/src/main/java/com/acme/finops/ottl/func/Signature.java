package com.acme.finops.ottl.func;

import com.acme.finops.ottl.ConfigException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered parameter list of a function.
 */
public record Signature(List<ArgSpec> parameters) {
    public Signature {
        parameters = List.copyOf(parameters);
    }

    public static Signature of(ArgSpec... parameters) {
        return new Signature(List.of(parameters));
    }

    public static Signature none() {
        return new Signature(List.of());
    }

    public int size() {
        return parameters.size();
    }

    public int indexOf(String name) {
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Checks that names are unique and that no required parameter follows an optional one.
     */
    public void validate(String functionName) throws ConfigException {
        Set<String> seen = new HashSet<>();
        boolean sawOptional = false;
        for (ArgSpec spec : parameters) {
            if (!seen.add(spec.name())) {
                throw new ConfigException("function " + functionName + " declares parameter "
                    + spec.name() + " twice");
            }
            if (spec.optional()) {
                sawOptional = true;
            } else if (sawOptional) {
                throw new ConfigException("function " + functionName + " declares required parameter "
                    + spec.name() + " after an optional one");
            }
        }
    }
}
