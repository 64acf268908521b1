package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.expr.TypedGetter;
import com.acme.finops.ottl.func.ArgSpec;
import com.acme.finops.ottl.func.ArgType;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.func.FunctionFactory;
import com.acme.finops.ottl.func.Signature;
import com.acme.finops.ottl.pdata.PMap;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Regex and glob replacement editors. Every variant accepts an optional converter (for
 * example {@code SHA256}) applied to the replacement and an optional format string wrapped
 * around the converter's result.
 */
final class ReplaceEditors {
    private static final String MODE_KEY = "key";
    private static final String MODE_VALUE = "value";

    private ReplaceEditors() {
    }

    private static Signature signature(ArgSpec target, ArgSpec... middle) {
        ArgSpec[] specs = new ArgSpec[middle.length + 4];
        specs[0] = target;
        System.arraycopy(middle, 0, specs, 1, middle.length);
        specs[middle.length + 1] = ArgSpec.required(Replacer.REPLACEMENT, ArgType.STRING);
        specs[middle.length + 2] = ArgSpec.optional(Replacer.FUNCTION, ArgType.FUNCTION);
        specs[middle.length + 3] = ArgSpec.optional(Replacer.REPLACEMENT_FORMAT, ArgType.STRING);
        return Signature.of(specs);
    }

    /**
     * {@code replace_pattern(target, regex, replacement)} replaces every regex match inside a
     * string target. Non-string targets are left alone.
     */
    static <K> Factory<K> replacePattern() {
        Signature signature = signature(
            ArgSpec.required("target", ArgType.GET_SETTER),
            ArgSpec.required("regex", ArgType.STRING_LITERAL));
        return FunctionFactory.of("replace_pattern", signature, (fc, args) -> {
            GetSetter<K> target = args.get("target");
            Pattern regex = Patterns.regex("replace_pattern", args.<String>get("regex"));
            Replacer<K> replacer = Replacer.from("replace_pattern", args);
            return (ctx, tCtx) -> {
                if (target.get(ctx, tCtx) instanceof String s) {
                    String updated = replacer.replaceAll(ctx, tCtx, regex, s);
                    if (!updated.equals(s)) {
                        target.set(ctx, tCtx, updated);
                    }
                }
                return null;
            };
        });
    }

    /**
     * {@code replace_all_patterns(target, mode, regex, replacement)} applies the regex to every
     * string value ({@code mode = "value"}) or to every key ({@code mode = "key"}) of a map.
     * An entry whose replacement fails is skipped and the rest of the map is still processed.
     */
    static <K> Factory<K> replaceAllPatterns() {
        Signature signature = signature(
            ArgSpec.required("target", ArgType.MAP),
            ArgSpec.required("mode", ArgType.STRING_LITERAL),
            ArgSpec.required("regex", ArgType.STRING_LITERAL));
        return FunctionFactory.of("replace_all_patterns", signature, (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            String mode = args.get("mode");
            if (!MODE_KEY.equals(mode) && !MODE_VALUE.equals(mode)) {
                throw new ConfigException("invalid mode " + mode + ", must be either 'key' or 'value'");
            }
            boolean keys = MODE_KEY.equals(mode);
            Pattern regex = Patterns.regex("replace_all_patterns", args.<String>get("regex"));
            Replacer<K> replacer = Replacer.from("replace_all_patterns", args);
            return (ctx, tCtx) -> {
                PMap map = target.get(ctx, tCtx);
                PMap updated = new PMap();
                for (Map.Entry<String, Object> e : map.entrySet()) {
                    String key = e.getKey();
                    Object value = e.getValue();
                    if (keys) {
                        if (regex.matcher(key).find()) {
                            key = replaceOrKeep(replacer, ctx, tCtx, regex, key);
                        }
                    } else if (value instanceof String s && regex.matcher(s).find()) {
                        value = replaceOrKeep(replacer, ctx, tCtx, regex, s);
                    }
                    updated.put(key, value);
                }
                map.replaceWith(updated);
                return null;
            };
        });
    }

    private static <K> String replaceOrKeep(Replacer<K> replacer, ExecContext ctx, K tCtx,
                                            Pattern regex, String input) {
        try {
            return replacer.replaceAll(ctx, tCtx, regex, input);
        } catch (EvaluationException e) {
            return input;
        }
    }

    /**
     * {@code replace_match(target, pattern, replacement)} replaces the whole string target
     * when it matches the glob.
     */
    static <K> Factory<K> replaceMatch() {
        Signature signature = signature(
            ArgSpec.required("target", ArgType.GET_SETTER),
            ArgSpec.required("pattern", ArgType.STRING_LITERAL));
        return FunctionFactory.of("replace_match", signature, (fc, args) -> {
            GetSetter<K> target = args.get("target");
            Pattern glob = Patterns.glob("replace_match", args.<String>get("pattern"));
            Replacer<K> replacer = Replacer.from("replace_match", args);
            return (ctx, tCtx) -> {
                if (target.get(ctx, tCtx) instanceof String s && glob.matcher(s).matches()) {
                    String replacement = replacer.whole(ctx, tCtx);
                    if (replacement != null) {
                        target.set(ctx, tCtx, replacement);
                    }
                }
                return null;
            };
        });
    }

    /**
     * {@code replace_all_matches(target, pattern, replacement)} replaces every string value of
     * a map that matches the glob.
     */
    static <K> Factory<K> replaceAllMatches() {
        Signature signature = signature(
            ArgSpec.required("target", ArgType.MAP),
            ArgSpec.required("pattern", ArgType.STRING_LITERAL));
        return FunctionFactory.of("replace_all_matches", signature, (fc, args) -> {
            TypedGetter<K, PMap> target = args.get("target");
            Pattern glob = Patterns.glob("replace_all_matches", args.<String>get("pattern"));
            Replacer<K> replacer = Replacer.from("replace_all_matches", args);
            return (ctx, tCtx) -> {
                PMap map = target.get(ctx, tCtx);
                for (String key : map.keys()) {
                    if (map.get(key) instanceof String s && glob.matcher(s).matches()) {
                        String replacement = replacer.whole(ctx, tCtx);
                        if (replacement != null) {
                            map.put(key, replacement);
                        }
                    }
                }
                return null;
            };
        });
    }
}
