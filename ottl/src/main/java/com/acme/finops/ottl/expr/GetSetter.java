package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;

import java.util.Objects;

/**
 * A resolved path: readable, and writable unless {@link #readOnly()}.
 */
public interface GetSetter<K> extends Getter<K>, Setter<K> {

    default boolean readOnly() {
        return false;
    }

    static <K> GetSetter<K> of(Getter<K> getter, Setter<K> setter) {
        Objects.requireNonNull(getter, "getter");
        Objects.requireNonNull(setter, "setter");
        return new GetSetter<>() {
            @Override
            public Object get(ExecContext ctx, K tCtx) throws EvaluationException {
                return getter.get(ctx, tCtx);
            }

            @Override
            public void set(ExecContext ctx, K tCtx, Object value) throws EvaluationException {
                setter.set(ctx, tCtx, value);
            }
        };
    }

    static <K> GetSetter<K> readOnly(String path, Getter<K> getter) {
        Objects.requireNonNull(getter, "getter");
        return new GetSetter<>() {
            @Override
            public Object get(ExecContext ctx, K tCtx) throws EvaluationException {
                return getter.get(ctx, tCtx);
            }

            @Override
            public void set(ExecContext ctx, K tCtx, Object value) throws EvaluationException {
                throw new EvaluationException("path " + path + " is read-only");
            }

            @Override
            public boolean readOnly() {
                return true;
            }
        };
    }
}
