package com.acme.finops.ottl.func;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.expr.ExprFunc;
import com.acme.finops.ottl.expr.Getter;

import java.util.List;

/**
 * A converter passed as an argument. The consuming function instantiates it with getters of
 * its own choosing.
 */
public interface FunctionGetter<K> {
    String name();

    ExprFunc<K> instantiate(List<Getter<K>> arguments) throws ConfigException;
}
