package com.acme.finops.ottl.transform;

import com.acme.finops.ottl.ErrorMode;

import java.util.List;
import java.util.Objects;

/**
 * Statements run in one transform context, optionally gated by conditions (any of them
 * must hold).
 *
 * @param errorMode group-level override, {@code null} to use the processor's mode
 */
public record ContextStatements(String context, List<String> statements, List<String> conditions, ErrorMode errorMode) {
    public ContextStatements {
        Objects.requireNonNull(context, "context");
        statements = List.copyOf(statements);
        conditions = List.copyOf(conditions);
    }

    public ContextStatements(String context, List<String> statements) {
        this(context, statements, List.of(), null);
    }

    public ErrorMode errorModeOr(ErrorMode fallback) {
        return errorMode == null ? fallback : errorMode;
    }
}
