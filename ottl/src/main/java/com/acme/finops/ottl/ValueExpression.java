package com.acme.finops.ottl;

import com.acme.finops.ottl.expr.Getter;

import java.util.Objects;

/**
 * A compiled standalone value such as {@code Concat([name, "x"], "-")}.
 */
public final class ValueExpression<K> {
    private final Getter<K> getter;
    private final String source;

    ValueExpression(Getter<K> getter, String source) {
        this.getter = Objects.requireNonNull(getter, "getter");
        this.source = Objects.requireNonNull(source, "source");
    }

    public Object eval(ExecContext ctx, K tCtx) throws EvaluationException {
        return getter.get(ctx, tCtx);
    }

    public String source() {
        return source;
    }
}
