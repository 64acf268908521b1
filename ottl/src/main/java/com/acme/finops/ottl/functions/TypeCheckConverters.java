package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.TypeError;
import com.acme.finops.ottl.expr.TypedGetter;
import com.acme.finops.ottl.func.ArgSpec;
import com.acme.finops.ottl.func.ArgType;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.func.FunctionFactory;
import com.acme.finops.ottl.func.Signature;

import java.util.regex.Pattern;

/**
 * {@code IsString}, {@code IsInt}, {@code IsDouble}, {@code IsBool}, {@code IsMap},
 * {@code IsList} and {@code IsMatch}.
 *
 * <p>The {@code Is*} checks read their argument through a strict getter and answer
 * {@code false} when it raises {@link TypeError}; any other failure propagates.</p>
 */
final class TypeCheckConverters {
    private TypeCheckConverters() {
    }

    static <K> Factory<K> isString() {
        return isType("IsString", ArgType.STRING);
    }

    static <K> Factory<K> isInt() {
        return isType("IsInt", ArgType.INT);
    }

    static <K> Factory<K> isDouble() {
        return isType("IsDouble", ArgType.FLOAT);
    }

    static <K> Factory<K> isBool() {
        return isType("IsBool", ArgType.BOOL);
    }

    static <K> Factory<K> isMap() {
        return isType("IsMap", ArgType.MAP);
    }

    static <K> Factory<K> isList() {
        return isType("IsList", ArgType.SLICE);
    }

    private static <K> Factory<K> isType(String name, ArgType strictType) {
        return FunctionFactory.of(name, Signature.of(ArgSpec.required("value", strictType)), (fc, args) -> {
            TypedGetter<K, ?> value = args.get("value");
            return (ctx, tCtx) -> {
                try {
                    value.get(ctx, tCtx);
                    return true;
                } catch (TypeError e) {
                    return false;
                }
            };
        });
    }

    /**
     * {@code IsMatch(target, pattern)}: whether the regex matches anywhere in the target's
     * string form. A nil target does not match.
     */
    static <K> Factory<K> isMatch() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.STRING_LIKE),
            ArgSpec.required("pattern", ArgType.STRING));
        return FunctionFactory.of("IsMatch", signature, (fc, args) -> {
            TypedGetter<K, String> target = args.get("target");
            Patterns.PatternSource<K> pattern = Patterns.regex("IsMatch", args.<TypedGetter<K, String>>get("pattern"));
            return (ctx, tCtx) -> {
                String value = target.get(ctx, tCtx);
                if (value == null) {
                    return false;
                }
                Pattern compiled = pattern.get(ctx, tCtx);
                return compiled.matcher(value).find();
            };
        });
    }
}
