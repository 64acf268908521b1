package com.acme.finops.ottl.func;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.expr.ExprFunc;

/**
 * Named, schema-described constructor of a function instance.
 *
 * <p>Names starting with a lowercase letter are editors (statement heads), names starting
 * with an uppercase letter are converters (values).</p>
 */
public interface Factory<K> {
    String name();

    Signature signature();

    /**
     * Validates domain constraints on the bound arguments and returns the function.
     */
    ExprFunc<K> createFunction(FunctionContext context, Arguments<K> arguments) throws ConfigException;
}
