package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;

/**
 * Converts a raw engine value into the Java type a function parameter expects.
 */
@FunctionalInterface
public interface Coercion<T> {
    T coerce(Object value) throws EvaluationException;
}
