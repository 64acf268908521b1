package com.acme.finops.ottl.path;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;

/**
 * One bracket segment of a path or converter result.
 */
@FunctionalInterface
public interface Key<K> {
    /**
     * @return a {@code String} map key or a {@code Long} slice index
     */
    Object resolve(ExecContext ctx, K tCtx) throws EvaluationException;
}
