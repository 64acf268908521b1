package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.expr.Coercions;
import com.acme.finops.ottl.expr.Getter;
import com.acme.finops.ottl.expr.TypedGetter;
import com.acme.finops.ottl.func.ArgSpec;
import com.acme.finops.ottl.func.ArgType;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.func.FunctionFactory;
import com.acme.finops.ottl.func.Signature;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.PSlice;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class CollectionConverters {
    private CollectionConverters() {
    }

    static <K> Factory<K> keys() {
        return FunctionFactory.of("Keys", Signature.of(ArgSpec.required("target", ArgType.MAP)), (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            return (ctx, tCtx) -> PSlice.fromRaw(target.get(ctx, tCtx).keys());
        });
    }

    /**
     * {@code Sort(target, order)} returns a sorted copy of a slice; other values come back
     * unchanged.
     *
     * <p>All ints sort as ints, all strings as strings, all bools with false first. A mix of
     * ints and doubles sorts as doubles. Any other mix sorts by string form, and elements
     * that have no string form are dropped.</p>
     */
    static <K> Factory<K> sort() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.GETTER),
            ArgSpec.optional("order", ArgType.STRING_LITERAL));
        return FunctionFactory.of("Sort", signature, (fc, args) -> {
            Getter<K> target = args.get("target");
            String order = args.<String>optional("order").orElse("asc");
            if (!"asc".equals(order) && !"desc".equals(order)) {
                throw new ConfigException("invalid arguments: " + order + ". Order should be either \"asc\" or \"desc\"");
            }
            boolean descending = "desc".equals(order);
            return (ctx, tCtx) -> {
                Object v = target.get(ctx, tCtx);
                if (!(v instanceof PSlice slice)) {
                    return v;
                }
                return sorted(slice.asList(), descending);
            };
        });
    }

    private static PSlice sorted(List<Object> items, boolean descending) {
        boolean allLong = true;
        boolean allNumeric = true;
        boolean allString = true;
        boolean allBool = true;
        for (Object o : items) {
            allLong &= o instanceof Long;
            allNumeric &= o instanceof Long || o instanceof Double;
            allString &= o instanceof String;
            allBool &= o instanceof Boolean;
        }
        List<Object> out = new ArrayList<>();
        Comparator<Object> cmp;
        if (allLong) {
            out.addAll(items);
            cmp = Comparator.comparingLong(o -> (Long) o);
        } else if (allNumeric) {
            for (Object o : items) {
                out.add(((Number) o).doubleValue());
            }
            cmp = Comparator.comparingDouble(o -> (Double) o);
        } else if (allString) {
            out.addAll(items);
            cmp = Comparator.comparing(o -> (String) o);
        } else if (allBool) {
            out.addAll(items);
            cmp = Comparator.comparing(o -> (Boolean) o);
        } else {
            for (Object o : items) {
                String s = asStringOrNull(o);
                if (s != null) {
                    out.add(s);
                }
            }
            cmp = Comparator.comparing(o -> (String) o);
        }
        out.sort(descending ? cmp.reversed() : cmp);
        return PSlice.fromRaw(out);
    }

    private static String asStringOrNull(Object o) {
        try {
            return Coercions.STRING_LIKE.coerce(o);
        } catch (EvaluationException e) {
            return null;
        }
    }
}
