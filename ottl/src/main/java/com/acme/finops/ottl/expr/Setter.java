package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;

@FunctionalInterface
public interface Setter<K> {
    void set(ExecContext ctx, K tCtx, Object value) throws EvaluationException;
}
