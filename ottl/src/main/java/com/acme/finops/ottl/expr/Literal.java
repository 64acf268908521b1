package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.pdata.Values;

/**
 * Constant getter. Mutable values (maps, slices, bytes) are copied on every read so a
 * function mutating its argument can never change the configured constant.
 */
public final class Literal<K> implements Getter<K>, LiteralGetter {
    private final Object value;

    public Literal(Object value) {
        this.value = value;
    }

    public static <K> Literal<K> of(Object value) {
        return new Literal<>(value);
    }

    public Object value() {
        return Values.deepCopy(value);
    }

    @Override
    public Object get(ExecContext ctx, K tCtx) {
        return Values.deepCopy(value);
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public String toString() {
        return "Literal[" + value + "]";
    }
}
