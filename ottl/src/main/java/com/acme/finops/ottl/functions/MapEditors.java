package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.expr.Getter;
import com.acme.finops.ottl.expr.TypedGetter;
import com.acme.finops.ottl.func.ArgSpec;
import com.acme.finops.ottl.func.ArgType;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.func.FunctionFactory;
import com.acme.finops.ottl.func.Signature;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.PSlice;
import com.acme.finops.ottl.pdata.Values;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Editors that write a path or reshape an attribute map in place.
 */
final class MapEditors {
    private MapEditors() {
    }

    /**
     * {@code set(target, value)}. A nil value leaves the target untouched.
     */
    static <K> Factory<K> set() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.GET_SETTER),
            ArgSpec.required("value", ArgType.GETTER));
        return FunctionFactory.of("set", signature, (fc, args) -> {
            GetSetter<K> target = args.get("target");
            Getter<K> value = args.get("value");
            return (ctx, tCtx) -> {
                Object v = value.get(ctx, tCtx);
                if (v != null) {
                    target.set(ctx, tCtx, v);
                }
                return null;
            };
        });
    }

    /**
     * {@code append(target, value, values)} turns the target into a slice holding its previous
     * content followed by the new elements. At least one of value and values is required.
     */
    static <K> Factory<K> append() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.GET_SETTER),
            ArgSpec.optional("value", ArgType.GETTER),
            ArgSpec.optional("values", ArgType.GETTER_LIST));
        return FunctionFactory.of("append", signature, (fc, args) -> {
            GetSetter<K> target = args.get("target");
            Getter<K> value = args.<Getter<K>>optional("value").orElse(null);
            List<Getter<K>> values = args.<List<Getter<K>>>optional("values").orElse(List.of());
            if (value == null && values.isEmpty()) {
                throw new ConfigException("at least one of the optional arguments ('value' or 'values') must be provided");
            }
            return (ctx, tCtx) -> {
                PSlice result = new PSlice();
                Object current = target.get(ctx, tCtx);
                if (current instanceof PSlice existing) {
                    for (Object item : existing.asList()) {
                        result.add(Values.deepCopy(item));
                    }
                } else if (current != null) {
                    result.add(Values.deepCopy(Values.toAttributeValue(current)));
                }
                if (value != null) {
                    result.add(Values.deepCopy(Values.toAttributeValue(value.get(ctx, tCtx))));
                }
                for (Getter<K> g : values) {
                    result.add(Values.deepCopy(Values.toAttributeValue(g.get(ctx, tCtx))));
                }
                target.set(ctx, tCtx, result);
                return null;
            };
        });
    }

    static <K> Factory<K> deleteKey() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.MAP),
            ArgSpec.required("key", ArgType.STRING_LITERAL));
        return FunctionFactory.of("delete_key", signature, (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            String key = args.get("key");
            return (ctx, tCtx) -> {
                target.get(ctx, tCtx).remove(key);
                return null;
            };
        });
    }

    static <K> Factory<K> deleteMatchingKeys() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.MAP),
            ArgSpec.required("pattern", ArgType.STRING_LITERAL));
        return FunctionFactory.of("delete_matching_keys", signature, (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            Pattern pattern = Patterns.regex("delete_matching_keys", args.<String>get("pattern"));
            return (ctx, tCtx) -> {
                target.get(ctx, tCtx).removeIf((k, v) -> pattern.matcher(k).find());
                return null;
            };
        });
    }

    static <K> Factory<K> keepKeys() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.MAP),
            ArgSpec.required("keys", ArgType.STRING_LITERAL_LIST));
        return FunctionFactory.of("keep_keys", signature, (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            Set<String> keep = Set.copyOf(args.<List<String>>get("keys"));
            return (ctx, tCtx) -> {
                target.get(ctx, tCtx).removeIf((k, v) -> !keep.contains(k));
                return null;
            };
        });
    }

    static <K> Factory<K> keepMatchingKeys() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.MAP),
            ArgSpec.required("pattern", ArgType.STRING_LITERAL));
        return FunctionFactory.of("keep_matching_keys", signature, (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            Pattern pattern = Patterns.regex("keep_matching_keys", args.<String>get("pattern"));
            return (ctx, tCtx) -> {
                target.get(ctx, tCtx).removeIf((k, v) -> !pattern.matcher(k).find());
                return null;
            };
        });
    }

    /**
     * {@code limit(target, limit, priority_keys)} keeps at most {@code limit} entries. Priority
     * keys that are present are kept first; the remaining room goes to other keys in map order.
     */
    static <K> Factory<K> limit() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.MAP),
            ArgSpec.required("limit", ArgType.INT_LITERAL),
            ArgSpec.optional("priority_keys", ArgType.STRING_LITERAL_LIST));
        return FunctionFactory.of("limit", signature, (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            long limit = args.<Long>get("limit");
            if (limit < 0) {
                throw new ConfigException("invalid limit for limit function, " + limit + " cannot be negative");
            }
            List<String> priorityKeys = args.<List<String>>optional("priority_keys").orElse(List.of());
            if (priorityKeys.size() > limit) {
                throw new ConfigException("invalid limit for limit function, " + limit
                    + " cannot be less than number of priority attributes " + priorityKeys.size());
            }
            Set<String> priority = new LinkedHashSet<>(priorityKeys);
            return (ctx, tCtx) -> {
                PMap map = target.get(ctx, tCtx);
                if (map.size() <= limit) {
                    return null;
                }
                long kept = 0;
                for (String key : priority) {
                    if (map.containsKey(key)) {
                        kept++;
                    }
                }
                long[] count = {kept};
                map.removeIf((k, v) -> {
                    if (priority.contains(k)) {
                        return false;
                    }
                    if (count[0] < limit) {
                        count[0]++;
                        return false;
                    }
                    return true;
                });
                return null;
            };
        });
    }

    /**
     * {@code truncate_all(target, limit)} shortens every string value to at most
     * {@code limit} characters.
     */
    static <K> Factory<K> truncateAll() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.MAP),
            ArgSpec.required("limit", ArgType.INT_LITERAL));
        return FunctionFactory.of("truncate_all", signature, (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            long limit = args.<Long>get("limit");
            if (limit < 0) {
                throw new ConfigException("invalid limit for truncate_all function, " + limit + " cannot be negative");
            }
            return (ctx, tCtx) -> {
                PMap map = target.get(ctx, tCtx);
                for (String key : map.keys()) {
                    if (map.get(key) instanceof String s && s.codePointCount(0, s.length()) > limit) {
                        map.put(key, s.substring(0, s.offsetByCodePoints(0, (int) limit)));
                    }
                }
                return null;
            };
        });
    }

    /**
     * {@code flatten(target, prefix, depth)} replaces nested maps with dotted keys. Slice
     * elements are keyed by index. Below {@code depth} levels values are kept as they are.
     */
    static <K> Factory<K> flatten() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.MAP),
            ArgSpec.optional("prefix", ArgType.STRING_LITERAL),
            ArgSpec.optional("depth", ArgType.INT_LITERAL));
        return FunctionFactory.of("flatten", signature, (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            String prefix = args.<String>optional("prefix").orElse("");
            long depth = args.<Long>optional("depth").orElse(Long.MAX_VALUE);
            if (depth < 0) {
                throw new ConfigException("invalid depth for flatten function, " + depth + " cannot be negative");
            }
            return (ctx, tCtx) -> {
                PMap map = target.get(ctx, tCtx);
                PMap result = new PMap();
                flattenInto(map, result, prefix, 0, depth);
                map.replaceWith(result);
                return null;
            };
        });
    }

    private static void flattenInto(PMap source, PMap result, String prefix, long currentDepth, long maxDepth) {
        String base = prefix.isEmpty() ? "" : prefix + ".";
        for (Map.Entry<String, Object> e : source.entrySet()) {
            String key = base + e.getKey();
            Object v = e.getValue();
            if (v instanceof PMap nested && currentDepth < maxDepth) {
                flattenInto(nested, result, key, currentDepth + 1, maxDepth);
            } else if (v instanceof PSlice slice && currentDepth < maxDepth) {
                for (int i = 0; i < slice.size(); i++) {
                    Object item = slice.get(i);
                    if (item instanceof PMap nested && currentDepth + 1 < maxDepth) {
                        flattenInto(nested, result, key + "." + i, currentDepth + 2, maxDepth);
                    } else {
                        result.put(key + "." + i, Values.deepCopy(item));
                    }
                }
            } else {
                result.put(key, Values.deepCopy(v));
            }
        }
    }

    /**
     * {@code merge_maps(target, source, strategy)} with strategy {@code insert} (only new
     * keys), {@code update} (only existing keys) or {@code upsert} (both).
     */
    static <K> Factory<K> mergeMaps() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.MAP),
            ArgSpec.required("source", ArgType.MAP),
            ArgSpec.required("strategy", ArgType.STRING_LITERAL));
        return FunctionFactory.of("merge_maps", signature, (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            TypedGetter<K, PMap> source = args.get("source");
            String strategy = args.get("strategy");
            if (!"insert".equals(strategy) && !"update".equals(strategy) && !"upsert".equals(strategy)) {
                throw new ConfigException("invalid value for strategy, " + strategy
                    + ", must be 'insert', 'update' or 'upsert'");
            }
            return (ctx, tCtx) -> {
                PMap into = target.get(ctx, tCtx);
                PMap from = source.get(ctx, tCtx).copy();
                for (Map.Entry<String, Object> e : from.entrySet()) {
                    boolean present = into.containsKey(e.getKey());
                    boolean write = switch (strategy) {
                        case "insert" -> !present;
                        case "update" -> present;
                        default -> true;
                    };
                    if (write) {
                        into.put(e.getKey(), e.getValue());
                    }
                }
                return null;
            };
        });
    }
}
