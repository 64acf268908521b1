package com.acme.finops.ottl.func;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.expr.Getter;
import com.acme.finops.ottl.lang.Ast;

/**
 * The compiler services the binder needs to turn parsed arguments into getters.
 */
public interface ValueCompiler<K> {
    Getter<K> compileValue(Ast.ValueNode node) throws ConfigException;

    GetSetter<K> compilePath(Ast.PathNode node) throws ConfigException;

    long resolveEnum(Ast.EnumSymbol symbol) throws ConfigException;
}
