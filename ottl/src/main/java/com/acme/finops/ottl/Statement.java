package com.acme.finops.ottl;

import com.acme.finops.ottl.expr.BoolExpr;
import com.acme.finops.ottl.expr.ExprFunc;

import java.util.Objects;

/**
 * A compiled {@code editor(...) where ...} statement.
 */
public final class Statement<K> {
    private final ExprFunc<K> function;
    private final BoolExpr<K> condition;
    private final String source;

    Statement(ExprFunc<K> function, BoolExpr<K> condition, String source) {
        this.function = Objects.requireNonNull(function, "function");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Runs the editor if the where clause holds.
     */
    public Result execute(ExecContext ctx, K tCtx) throws EvaluationException {
        boolean matched = condition.eval(ctx, tCtx);
        if (!matched) {
            return new Result(null, false);
        }
        return new Result(function.eval(ctx, tCtx), true);
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }

    public record Result(Object value, boolean conditionMatched) {}
}
