package com.acme.finops.ottl;

import com.acme.finops.ottl.pdata.Values;

/**
 * A strict getter observed a value of the wrong kind.
 *
 * <p>Type-testing converters such as {@code IsString} catch exactly this type and answer
 * {@code false}; anything else is propagated.</p>
 */
public class TypeError extends EvaluationException {
    public TypeError(String message) {
        super(message);
    }

    public static TypeError expected(String expected, Object actual) {
        return new TypeError("expected " + expected + " but got " + Values.typeName(actual));
    }
}
