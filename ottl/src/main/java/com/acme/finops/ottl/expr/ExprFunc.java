package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;

/**
 * A bound function instance. Editors mutate the record and usually return {@code null};
 * converters return a value.
 */
@FunctionalInterface
public interface ExprFunc<K> {
    Object eval(ExecContext ctx, K tCtx) throws EvaluationException;
}
