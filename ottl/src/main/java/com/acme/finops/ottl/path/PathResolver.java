package com.acme.finops.ottl.path;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.expr.GetSetter;

/**
 * Per-signal table mapping paths to accessors. Unresolvable paths fail at configuration time.
 */
@FunctionalInterface
public interface PathResolver<K> {
    GetSetter<K> resolve(Path<K> path) throws ConfigException;
}
