package com.acme.finops.ottl.path;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.TypeError;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.PSlice;
import com.acme.finops.ottl.pdata.Values;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks key chains through nested maps and slices.
 */
public final class Indexing {
    private Indexing() {
    }

    /**
     * Reads {@code root[k1][k2]...}. A missing map key or a nil intermediate yields {@code null}.
     */
    public static <K> Object get(ExecContext ctx, K tCtx, Object root, List<Key<K>> keys) throws EvaluationException {
        return walk(ctx, tCtx, root, keys, false);
    }

    /**
     * Like {@link #get} but a missing map key is an error. Used when indexing converter results.
     */
    public static <K> Object getStrict(ExecContext ctx, K tCtx, Object root, List<Key<K>> keys)
        throws EvaluationException {
        return walk(ctx, tCtx, root, keys, true);
    }

    private static <K> Object walk(ExecContext ctx, K tCtx, Object root, List<Key<K>> keys, boolean strict)
        throws EvaluationException {
        Object current = root;
        for (Key<K> key : keys) {
            Object k = key.resolve(ctx, tCtx);
            if (current == null && !strict) {
                return null;
            }
            if (k instanceof String s) {
                if (!(current instanceof PMap m)) {
                    throw new TypeError("type " + Values.typeName(current) + " does not support string indexing");
                }
                if (!m.containsKey(s)) {
                    if (strict) {
                        throw new EvaluationException("key not found in map: " + s);
                    }
                    return null;
                }
                current = m.get(s);
            } else {
                long idx = (Long) k;
                if (!(current instanceof PSlice slice)) {
                    throw new TypeError("type " + Values.typeName(current) + " does not support int indexing");
                }
                current = slice.get(checkIndex(idx, slice.size()));
            }
        }
        return current;
    }

    /**
     * Writes {@code value} at {@code root[k1][k2]...}, creating intermediate maps where a
     * string key meets a missing entry. All keys are resolved and checked before the tree is
     * touched.
     */
    public static <K> void set(ExecContext ctx, K tCtx, PMap root, List<Key<K>> keys, Object value)
        throws EvaluationException {
        if (keys.isEmpty()) {
            throw new EvaluationException("at least one key is required");
        }
        List<Object> resolved = new ArrayList<>(keys.size());
        for (Key<K> key : keys) {
            resolved.add(key.resolve(ctx, tCtx));
        }
        if (!(resolved.get(0) instanceof String)) {
            throw new TypeError("map must be indexed by a string key");
        }
        Object attributeValue = Values.deepCopy(Values.toAttributeValue(value));
        validatePath(root, resolved);

        Object current = root;
        for (int i = 0; i < resolved.size(); i++) {
            Object k = resolved.get(i);
            boolean last = i == resolved.size() - 1;
            if (current instanceof PMap m) {
                String s = (String) k;
                if (last) {
                    m.put(s, attributeValue);
                    return;
                }
                Object child = m.get(s);
                current = child == null ? m.putEmptyMap(s) : child;
            } else {
                PSlice slice = (PSlice) current;
                int idx = (int) (long) (Long) k;
                if (last) {
                    slice.set(idx, attributeValue);
                    return;
                }
                Object child = slice.get(idx);
                if (child == null) {
                    child = new PMap();
                    slice.set(idx, child);
                }
                current = child;
            }
        }
    }

    private static void validatePath(PMap root, List<Object> keys) throws EvaluationException {
        Object current = root;
        for (int i = 0; i < keys.size(); i++) {
            Object k = keys.get(i);
            if (current == null) {
                if (!(k instanceof String)) {
                    throw new EvaluationException("index " + k + " out of bounds");
                }
                current = new PMap();
            }
            if (k instanceof String s) {
                if (!(current instanceof PMap m)) {
                    throw new TypeError("type " + Values.typeName(current) + " does not support string indexing");
                }
                current = m.get(s);
            } else {
                if (!(current instanceof PSlice slice)) {
                    throw new TypeError("type " + Values.typeName(current) + " does not support int indexing");
                }
                current = slice.get(checkIndex((Long) k, slice.size()));
            }
        }
    }

    private static int checkIndex(long idx, int size) throws EvaluationException {
        if (idx < 0 || idx >= size) {
            throw new EvaluationException("index " + idx + " out of bounds");
        }
        return (int) idx;
    }
}
