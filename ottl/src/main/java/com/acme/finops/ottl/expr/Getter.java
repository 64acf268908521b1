package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;

/**
 * Reads a value from a record context. Implementations are built once at configuration time
 * and must be safe for concurrent use.
 *
 * @param <K> the per-signal transform context
 */
@FunctionalInterface
public interface Getter<K> {
    Object get(ExecContext ctx, K tCtx) throws EvaluationException;
}
