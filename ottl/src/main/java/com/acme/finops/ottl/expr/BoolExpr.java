package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;

@FunctionalInterface
public interface BoolExpr<K> {
    boolean eval(ExecContext ctx, K tCtx) throws EvaluationException;
}
