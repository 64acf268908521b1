package com.acme.finops.ottl.expr;

/**
 * Implemented by getters that may be constant. A literal getter returns the same value for
 * every record, which lets functions precompute on it at bind time.
 */
public interface LiteralGetter {
    boolean isLiteral();

    static boolean isLiteral(Object getter) {
        return getter instanceof LiteralGetter lg && lg.isLiteral();
    }
}
