package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.path.Indexing;
import com.acme.finops.ottl.path.Key;
import com.acme.finops.ottl.path.Path;
import com.acme.finops.ottl.path.Paths;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.Values;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.ObjLongConsumer;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

/**
 * Path builders shared by every context: scalar fields, attribute maps, ids, times and the
 * enclosing resource and scope.
 *
 * <p>Setters ignore values of the wrong kind, so {@code set(name, 1)} leaves a string field
 * unchanged.</p>
 */
final class CommonPaths {
    static final List<String> RESOURCE_FIELDS = List.of("attributes", "dropped_attributes_count");
    static final List<String> SCOPE_FIELDS = List.of("name", "version", "attributes", "dropped_attributes_count");

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private CommonPaths() {
    }

    static List<String> known(List<String> own, String... shared) {
        List<String> out = new ArrayList<>(own);
        out.addAll(List.of(shared));
        return List.copyOf(out);
    }

    /**
     * The field after {@code path}, which must exist. The container itself may not be indexed.
     */
    static <K> Path<K> subField(Path<K> path, List<String> known) throws ConfigException {
        if (!path.keys().isEmpty()) {
            throw new ConfigException("field " + path.name() + " does not support indexing in path " + path.string());
        }
        if (path.next() == null) {
            throw Paths.missingField(path, known);
        }
        return path.next();
    }

    static <K> GetSetter<K> map(Path<K> path, Function<K, PMap> accessor) throws ConfigException {
        Paths.requireNoNext(path);
        List<Key<K>> keys = path.keys();
        if (keys.isEmpty()) {
            return GetSetter.of(
                (ctx, tCtx) -> accessor.apply(tCtx),
                (ctx, tCtx, value) -> {
                    if (value instanceof PMap m) {
                        accessor.apply(tCtx).replaceWith(m);
                    }
                });
        }
        return GetSetter.of(
            (ctx, tCtx) -> Indexing.get(ctx, tCtx, accessor.apply(tCtx), keys),
            (ctx, tCtx, value) -> Indexing.set(ctx, tCtx, accessor.apply(tCtx), keys, value));
    }

    static <K> GetSetter<K> string(Path<K> path, Function<K, String> getter, BiConsumer<K, String> setter)
        throws ConfigException {
        Paths.requireTerminal(path);
        return GetSetter.of(
            (ctx, tCtx) -> getter.apply(tCtx),
            (ctx, tCtx, value) -> {
                if (value instanceof String s) {
                    setter.accept(tCtx, s);
                }
            });
    }

    static <K> GetSetter<K> int64(Path<K> path, ToLongFunction<K> getter, ObjLongConsumer<K> setter)
        throws ConfigException {
        Paths.requireTerminal(path);
        return GetSetter.of(
            (ctx, tCtx) -> getter.applyAsLong(tCtx),
            (ctx, tCtx, value) -> {
                if (value instanceof Long l) {
                    setter.accept(tCtx, l);
                }
            });
    }

    static <K> GetSetter<K> bool(Path<K> path, Predicate<K> getter, BiConsumer<K, Boolean> setter)
        throws ConfigException {
        Paths.requireTerminal(path);
        return GetSetter.of(
            (ctx, tCtx) -> getter.test(tCtx),
            (ctx, tCtx, value) -> {
                if (value instanceof Boolean b) {
                    setter.accept(tCtx, b);
                }
            });
    }

    /**
     * A time view over a nanosecond timestamp field.
     */
    static <K> GetSetter<K> time(Path<K> path, ToLongFunction<K> nanos, ObjLongConsumer<K> setter)
        throws ConfigException {
        Paths.requireTerminal(path);
        return GetSetter.of(
            (ctx, tCtx) -> toInstant(nanos.applyAsLong(tCtx)),
            (ctx, tCtx, value) -> {
                if (value instanceof Instant t) {
                    setter.accept(tCtx, Values.unixNano(t));
                }
            });
    }

    static Instant toInstant(long unixNano) {
        return Instant.ofEpochSecond(Math.floorDiv(unixNano, NANOS_PER_SECOND), Math.floorMod(unixNano, NANOS_PER_SECOND));
    }

    /**
     * A fixed-length id as bytes, with a {@code .string} sub-field holding its lowercase hex form.
     */
    static <K> GetSetter<K> id(Path<K> path, Function<K, byte[]> getter, BiConsumer<K, byte[]> setter, int length)
        throws ConfigException {
        if (path.next() == null) {
            Paths.requireTerminal(path);
            return GetSetter.of(
                (ctx, tCtx) -> getter.apply(tCtx).clone(),
                (ctx, tCtx, value) -> {
                    if (value instanceof byte[] b) {
                        setter.accept(tCtx, requireIdLength(path, b, length));
                    }
                });
        }
        Path<K> next = subField(path, List.of("string"));
        if (!"string".equals(next.name())) {
            throw new ConfigException("field " + path.name() + " has no sub-field " + next.name()
                + " in path " + path.string());
        }
        Paths.requireTerminal(next);
        return GetSetter.of(
            (ctx, tCtx) -> HexFormat.of().formatHex(getter.apply(tCtx)),
            (ctx, tCtx, value) -> {
                if (value instanceof String s) {
                    byte[] parsed;
                    try {
                        parsed = HexFormat.of().parseHex(s);
                    } catch (IllegalArgumentException e) {
                        throw new EvaluationException("invalid hex string for " + path.string() + ": " + s, e);
                    }
                    setter.accept(tCtx, requireIdLength(path, parsed, length));
                }
            });
    }

    private static byte[] requireIdLength(Path<?> path, byte[] id, int length) throws EvaluationException {
        if (id.length != length) {
            throw new EvaluationException(path.string() + " must be " + length + " bytes but got " + id.length);
        }
        return id;
    }

    /**
     * Resolves {@code resource.<field>} from a record context.
     */
    static <K> GetSetter<K> resource(Path<K> path, Function<K, Resource> accessor) throws ConfigException {
        return resourceField(subField(path, RESOURCE_FIELDS), accessor, "resource");
    }

    static <K> GetSetter<K> resourceField(Path<K> path, Function<K, Resource> accessor, String contextName)
        throws ConfigException {
        return switch (path.name()) {
            case "attributes" -> map(path, tCtx -> accessor.apply(tCtx).attributes());
            case "dropped_attributes_count" -> int64(path,
                tCtx -> accessor.apply(tCtx).droppedAttributesCount(),
                (tCtx, v) -> accessor.apply(tCtx).setDroppedAttributesCount(v));
            default -> throw Paths.unknownField(path, contextName, RESOURCE_FIELDS);
        };
    }

    /**
     * Resolves {@code instrumentation_scope.<field>} from a record context.
     */
    static <K> GetSetter<K> scope(Path<K> path, Function<K, InstrumentationScope> accessor) throws ConfigException {
        return scopeField(subField(path, SCOPE_FIELDS), accessor, "instrumentation_scope");
    }

    static <K> GetSetter<K> scopeField(Path<K> path, Function<K, InstrumentationScope> accessor, String contextName)
        throws ConfigException {
        return switch (path.name()) {
            case "name" -> string(path, tCtx -> accessor.apply(tCtx).name(), (tCtx, v) -> accessor.apply(tCtx).setName(v));
            case "version" -> string(path,
                tCtx -> accessor.apply(tCtx).version(),
                (tCtx, v) -> accessor.apply(tCtx).setVersion(v));
            case "attributes" -> map(path, tCtx -> accessor.apply(tCtx).attributes());
            case "dropped_attributes_count" -> int64(path,
                tCtx -> accessor.apply(tCtx).droppedAttributesCount(),
                (tCtx, v) -> accessor.apply(tCtx).setDroppedAttributesCount(v));
            default -> throw Paths.unknownField(path, contextName, SCOPE_FIELDS);
        };
    }
}
