package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.ErrorMode;

import java.util.List;
import java.util.Objects;

/**
 * Conditions evaluated in one transform context. A record matching any of them is dropped.
 *
 * @param context   transform context name, for example {@code span} or {@code datapoint}
 * @param errorMode group-level override, {@code null} to use the processor's mode
 */
public record ContextConditions(String context, List<String> conditions, ErrorMode errorMode) {
    public ContextConditions {
        Objects.requireNonNull(context, "context");
        conditions = List.copyOf(conditions);
    }

    public ContextConditions(String context, List<String> conditions) {
        this(context, conditions, null);
    }

    public ErrorMode errorModeOr(ErrorMode fallback) {
        return errorMode == null ? fallback : errorMode;
    }
}
