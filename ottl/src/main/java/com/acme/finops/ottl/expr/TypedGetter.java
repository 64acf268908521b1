package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;

/**
 * A getter whose result has already been coerced to {@code T}.
 */
public interface TypedGetter<K, T> extends LiteralGetter {
    T get(ExecContext ctx, K tCtx) throws EvaluationException;
}
