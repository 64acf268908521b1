package com.acme.finops.ottl.path;

import java.util.List;

/**
 * A parsed path as seen by a {@link PathResolver}: one field at a time, linked to the rest.
 */
public interface Path<K> {
    /**
     * Context prefix the path was written with, or an empty string.
     */
    String context();

    String name();

    List<Key<K>> keys();

    /**
     * The next field, or {@code null} when this is the last one.
     */
    Path<K> next();

    /**
     * Source text of the whole path, for error messages.
     */
    String string();
}
