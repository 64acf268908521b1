package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.lang.MathOp;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.PSlice;
import com.acme.finops.ottl.pdata.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factories for the composite getters the compiler emits.
 */
public final class Getters {
    private Getters() {
    }

    public static <K> Getter<K> math(Getter<K> left, MathOp op, Getter<K> right) {
        return new MathGetter<>(left, op, right);
    }

    public static <K> Getter<K> negate(Getter<K> operand) {
        return (ctx, tCtx) -> Arithmetic.negate(operand.get(ctx, tCtx));
    }

    public static <K> Getter<K> list(List<Getter<K>> elements) {
        return new ListGetter<>(elements);
    }

    public static <K> Getter<K> map(Map<String, Getter<K>> entries) {
        return new MapGetter<>(entries);
    }

    private static final class ListGetter<K> implements Getter<K>, LiteralGetter {
        private final List<Getter<K>> elements;
        private final boolean literal;

        ListGetter(List<Getter<K>> elements) {
            this.elements = List.copyOf(elements);
            this.literal = this.elements.stream().allMatch(LiteralGetter::isLiteral);
        }

        @Override
        public Object get(ExecContext ctx, K tCtx) throws EvaluationException {
            PSlice out = new PSlice();
            for (Getter<K> g : elements) {
                out.add(Values.toAttributeValue(g.get(ctx, tCtx)));
            }
            return out;
        }

        @Override
        public boolean isLiteral() {
            return literal;
        }
    }

    private static final class MapGetter<K> implements Getter<K>, LiteralGetter {
        private final Map<String, Getter<K>> entries;
        private final boolean literal;

        MapGetter(Map<String, Getter<K>> entries) {
            this.entries = new LinkedHashMap<>(entries);
            this.literal = this.entries.values().stream().allMatch(LiteralGetter::isLiteral);
        }

        @Override
        public Object get(ExecContext ctx, K tCtx) throws EvaluationException {
            PMap out = new PMap();
            for (Map.Entry<String, Getter<K>> e : entries.entrySet()) {
                out.put(e.getKey(), Values.toAttributeValue(e.getValue().get(ctx, tCtx)));
            }
            return out;
        }

        @Override
        public boolean isLiteral() {
            return literal;
        }
    }

    /**
     * Evaluates each getter in order.
     */
    public static <K> List<Object> getAll(List<? extends Getter<K>> getters, ExecContext ctx, K tCtx)
        throws EvaluationException {
        List<Object> out = new ArrayList<>(getters.size());
        for (Getter<K> g : getters) {
            out.add(g.get(ctx, tCtx));
        }
        return out;
    }
}
