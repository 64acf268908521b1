package com.acme.finops.ottl.func;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.expr.ExprFunc;

import java.util.Objects;

/**
 * Base class holding name and signature.
 */
public abstract class FunctionFactory<K> implements Factory<K> {
    private final String name;
    private final Signature signature;

    protected FunctionFactory(String name, Signature signature) {
        this.name = Objects.requireNonNull(name, "name");
        this.signature = Objects.requireNonNull(signature, "signature");
    }

    /**
     * Factory whose creation step is a lambda.
     */
    public static <K> FunctionFactory<K> of(String name, Signature signature, Creator<K> creator) {
        Objects.requireNonNull(creator, "creator");
        return new FunctionFactory<>(name, signature) {
            @Override
            public ExprFunc<K> createFunction(FunctionContext context, Arguments<K> arguments) throws ConfigException {
                return creator.create(context, arguments);
            }
        };
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final Signature signature() {
        return signature;
    }

    @Override
    public String toString() {
        return name;
    }

    @FunctionalInterface
    public interface Creator<K> {
        ExprFunc<K> create(FunctionContext context, Arguments<K> arguments) throws ConfigException;
    }
}
