package com.acme.finops.ottl.func;

import java.util.Objects;

/**
 * Configuration-time information handed to {@link Factory#createFunction}.
 *
 * @param contextName name of the transform context the function is compiled for
 */
public record FunctionContext(String contextName) {
    public FunctionContext {
        Objects.requireNonNull(contextName, "contextName");
    }
}
