package com.acme.finops.ottl.pdata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Mutable string-keyed value map, insertion ordered. Values are restricted to the
 * attribute value kinds (no times or durations).
 */
public final class PMap {
    private final LinkedHashMap<String, Object> entries;

    public PMap() {
        this.entries = new LinkedHashMap<>();
    }

    /**
     * Builds a map from alternating key/value arguments.
     */
    public static PMap of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("odd number of key/value arguments");
        }
        PMap out = new PMap();
        for (int i = 0; i < keyValues.length; i += 2) {
            out.put((String) keyValues[i], keyValues[i + 1]);
        }
        return out;
    }

    public static PMap fromRaw(Map<String, ?> raw) {
        PMap out = new PMap();
        raw.forEach(out::put);
        return out;
    }

    public Object get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public void put(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("map key must not be null");
        }
        entries.put(key, Values.normalizeAttribute(value));
    }

    public PMap putEmptyMap(String key) {
        PMap nested = new PMap();
        entries.put(key, nested);
        return nested;
    }

    public Object remove(String key) {
        return entries.remove(key);
    }

    public boolean removeIf(BiPredicate<String, Object> predicate) {
        boolean removed = false;
        Iterator<Map.Entry<String, Object>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Object> e = it.next();
            if (predicate.test(e.getKey(), e.getValue())) {
                it.remove();
                removed = true;
            }
        }
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    public Set<Map.Entry<String, Object>> entrySet() {
        return Collections.unmodifiableMap(entries).entrySet();
    }

    public PMap copy() {
        PMap out = new PMap();
        entries.forEach((k, v) -> out.entries.put(k, Values.deepCopy(v)));
        return out;
    }

    /**
     * Replaces this map's content with a deep copy of {@code other}.
     */
    public void replaceWith(PMap other) {
        if (other == this) {
            return;
        }
        PMap snapshot = other.copy();
        entries.clear();
        entries.putAll(snapshot.entries);
    }

    public Map<String, Object> toRaw() {
        Map<String, Object> out = new LinkedHashMap<>();
        entries.forEach((k, v) -> out.put(k, Values.toRaw(v)));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PMap other)) return false;
        if (entries.size() != other.entries.size()) return false;
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            if (!other.entries.containsKey(e.getKey())) return false;
            if (!Values.deepEquals(e.getValue(), other.entries.get(e.getKey()))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            h += e.getKey().hashCode() ^ Values.deepHashCode(e.getValue());
        }
        return h;
    }

    @Override
    public String toString() {
        return toRaw().toString();
    }
}
