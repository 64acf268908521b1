package com.acme.finops.ottl;

import com.acme.finops.ottl.expr.BoolExpr;

import java.util.Objects;

/**
 * A compiled boolean condition and the text it came from.
 */
public final class Condition<K> implements BoolExpr<K> {
    private final BoolExpr<K> expr;
    private final String source;

    Condition(BoolExpr<K> expr, String source) {
        this.expr = Objects.requireNonNull(expr, "expr");
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public boolean eval(ExecContext ctx, K tCtx) throws EvaluationException {
        return expr.eval(ctx, tCtx);
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
