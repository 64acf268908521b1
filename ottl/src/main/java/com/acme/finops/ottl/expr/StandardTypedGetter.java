package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.pdata.ValueType;

import java.util.Objects;

public final class StandardTypedGetter<K, T> implements TypedGetter<K, T> {
    private final Getter<K> delegate;
    private final Coercion<T> coercion;
    private final boolean literal;
    private final T literalValue;
    private final boolean literalResolved;

    public StandardTypedGetter(Getter<K> delegate, Coercion<T> coercion) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.coercion = Objects.requireNonNull(coercion, "coercion");
        this.literal = LiteralGetter.isLiteral(delegate);
        T resolved = null;
        boolean ok = false;
        if (literal && delegate instanceof Literal<K> lit && isImmutable(lit.value())) {
            try {
                resolved = coercion.coerce(lit.value());
                ok = isImmutable(resolved);
            } catch (EvaluationException e) {
                // the error is raised again on every evaluation
                ok = false;
            }
        }
        this.literalValue = resolved;
        this.literalResolved = ok;
    }

    public static <K, T> StandardTypedGetter<K, T> of(Getter<K> delegate, Coercion<T> coercion) {
        return new StandardTypedGetter<>(delegate, coercion);
    }

    @Override
    public T get(ExecContext ctx, K tCtx) throws EvaluationException {
        if (literalResolved) {
            return literalValue;
        }
        return coercion.coerce(delegate.get(ctx, tCtx));
    }

    @Override
    public boolean isLiteral() {
        return literal;
    }

    public Getter<K> delegate() {
        return delegate;
    }

    private static boolean isImmutable(Object value) {
        ValueType type = ValueType.of(value);
        return type != ValueType.MAP && type != ValueType.SLICE && type != ValueType.BYTES;
    }
}
