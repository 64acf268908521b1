package com.acme.finops.ottl.path;

import com.acme.finops.ottl.ConfigException;

import java.util.Collection;

/**
 * Validation helpers shared by path resolvers.
 */
public final class Paths {
    private Paths() {
    }

    /**
     * Rejects keys and trailing fields after a scalar field.
     */
    public static void requireTerminal(Path<?> path) throws ConfigException {
        if (!path.keys().isEmpty()) {
            throw new ConfigException("field " + path.name() + " does not support indexing in path " + path.string());
        }
        requireNoNext(path);
    }

    /**
     * Rejects trailing fields; keys are allowed.
     */
    public static void requireNoNext(Path<?> path) throws ConfigException {
        if (path.next() != null) {
            throw new ConfigException("field " + path.name() + " has no sub-field " + path.next().name()
                + " in path " + path.string());
        }
    }

    public static ConfigException unknownField(Path<?> path, String contextName, Collection<String> known) {
        return new ConfigException("invalid path " + path.string() + ": unknown field '" + path.name()
            + "' for context " + contextName + "; known fields: " + String.join(", ", known));
    }

    public static ConfigException missingField(Path<?> path, Collection<String> known) {
        return new ConfigException("path " + path.string() + " requires a sub-field after '" + path.name()
            + "'; known fields: " + String.join(", ", known));
    }
}
