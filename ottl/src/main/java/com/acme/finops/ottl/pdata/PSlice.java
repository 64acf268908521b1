package com.acme.finops.ottl.pdata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Mutable ordered list of attribute values.
 */
public final class PSlice {
    private final ArrayList<Object> items;

    public PSlice() {
        this.items = new ArrayList<>();
    }

    public static PSlice of(Object... values) {
        PSlice out = new PSlice();
        for (Object v : values) {
            out.add(v);
        }
        return out;
    }

    public static PSlice fromRaw(List<?> raw) {
        PSlice out = new PSlice();
        raw.forEach(out::add);
        return out;
    }

    public Object get(int index) {
        return items.get(index);
    }

    public void set(int index, Object value) {
        items.set(index, Values.normalizeAttribute(value));
    }

    public void add(Object value) {
        items.add(Values.normalizeAttribute(value));
    }

    public Object remove(int index) {
        return items.remove(index);
    }

    public boolean removeIf(Predicate<Object> predicate) {
        return items.removeIf(predicate);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Read-only live view.
     */
    public List<Object> asList() {
        return Collections.unmodifiableList(items);
    }

    public PSlice copy() {
        PSlice out = new PSlice();
        for (Object v : items) {
            out.items.add(Values.deepCopy(v));
        }
        return out;
    }

    public List<Object> toRaw() {
        List<Object> out = new ArrayList<>(items.size());
        for (Object v : items) {
            out.add(Values.toRaw(v));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PSlice other)) return false;
        if (items.size() != other.items.size()) return false;
        for (int i = 0; i < items.size(); i++) {
            if (!Values.deepEquals(items.get(i), other.items.get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Object v : items) {
            h = 31 * h + Values.deepHashCode(v);
        }
        return h;
    }

    @Override
    public String toString() {
        return toRaw().toString();
    }
}
