package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.lang.MathOp;

import java.util.Objects;

final class MathGetter<K> implements Getter<K> {
    private final Getter<K> left;
    private final MathOp op;
    private final Getter<K> right;

    MathGetter(Getter<K> left, MathOp op, Getter<K> right) {
        this.left = Objects.requireNonNull(left, "left");
        this.op = Objects.requireNonNull(op, "op");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public Object get(ExecContext ctx, K tCtx) throws EvaluationException {
        return Arithmetic.apply(left.get(ctx, tCtx), op, right.get(ctx, tCtx));
    }
}
