package com.acme.finops.ottl.path;

import com.acme.finops.ottl.TypeError;
import com.acme.finops.ottl.expr.Getter;
import com.acme.finops.ottl.pdata.Values;

public final class Keys {
    private Keys() {
    }

    public static <K> Key<K> of(String key) {
        return (ctx, tCtx) -> key;
    }

    public static <K> Key<K> of(long index) {
        Long boxed = index;
        return (ctx, tCtx) -> boxed;
    }

    /**
     * A key computed per record. The getter must yield a string or an int.
     */
    public static <K> Key<K> dynamic(Getter<K> getter) {
        return (ctx, tCtx) -> {
            Object v = getter.get(ctx, tCtx);
            if (v instanceof String || v instanceof Long) {
                return v;
            }
            throw new TypeError("key must resolve to a string or an int but got " + Values.typeName(v));
        };
    }
}
