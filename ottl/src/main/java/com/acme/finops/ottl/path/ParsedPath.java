package com.acme.finops.ottl.path;

import java.util.List;
import java.util.Objects;

public final class ParsedPath<K> implements Path<K> {
    private final String context;
    private final String name;
    private final List<Key<K>> keys;
    private final ParsedPath<K> next;
    private final String text;

    public ParsedPath(String context, String name, List<Key<K>> keys, ParsedPath<K> next, String text) {
        this.context = context == null ? "" : context;
        this.name = Objects.requireNonNull(name, "name");
        this.keys = List.copyOf(keys);
        this.next = next;
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public String context() {
        return context;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Key<K>> keys() {
        return keys;
    }

    @Override
    public Path<K> next() {
        return next;
    }

    @Override
    public String string() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
