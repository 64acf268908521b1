package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.TypeError;
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

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

final class StringConverters {
    private StringConverters() {
    }

    /**
     * {@code Concat(values, delimiter)}. Nil elements render as {@code <nil>}.
     */
    static <K> Factory<K> concat() {
        Signature signature = Signature.of(
            ArgSpec.required("vals", ArgType.STRING_LIKE_GETTER_LIST),
            ArgSpec.required("delimiter", ArgType.STRING_LITERAL));
        return FunctionFactory.of("Concat", signature, (fc, args) -> {
            List<TypedGetter<K, String>> values = args.get("vals");
            String delimiter = args.get("delimiter");
            return (ctx, tCtx) -> {
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < values.size(); i++) {
                    if (i > 0) {
                        sb.append(delimiter);
                    }
                    String v = values.get(i).get(ctx, tCtx);
                    sb.append(v == null ? "<nil>" : v);
                }
                return sb.toString();
            };
        });
    }

    /**
     * {@code Split(target, delimiter)}. Empty parts are kept; an empty delimiter splits into
     * single characters.
     */
    static <K> Factory<K> split() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.STRING),
            ArgSpec.required("delimiter", ArgType.STRING_LITERAL));
        return FunctionFactory.of("Split", signature, (fc, args) -> {
            TypedGetter<K, String> target = args.get("target");
            String delimiter = args.get("delimiter");
            Pattern separator = Pattern.compile(Pattern.quote(delimiter));
            return (ctx, tCtx) -> {
                String value = target.get(ctx, tCtx);
                PSlice out = new PSlice();
                if (delimiter.isEmpty()) {
                    value.codePoints().forEach(cp -> out.add(new String(Character.toChars(cp))));
                    return out;
                }
                for (String part : separator.split(value, -1)) {
                    out.add(part);
                }
                return out;
            };
        });
    }

    static <K> Factory<K> toLowerCase() {
        return FunctionFactory.of("ToLowerCase", Signature.of(ArgSpec.required("target", ArgType.STRING)), (fc, args) -> {
            TypedGetter<K, String> target = args.get("target");
            return (ctx, tCtx) -> target.get(ctx, tCtx).toLowerCase(Locale.ROOT);
        });
    }

    static <K> Factory<K> toUpperCase() {
        return FunctionFactory.of("ToUpperCase", Signature.of(ArgSpec.required("target", ArgType.STRING)), (fc, args) -> {
            TypedGetter<K, String> target = args.get("target");
            return (ctx, tCtx) -> target.get(ctx, tCtx).toUpperCase(Locale.ROOT);
        });
    }

    /**
     * {@code Substring(target, start, length)} over characters. The range must lie within
     * the string and the length must be positive.
     */
    static <K> Factory<K> substring() {
        Signature signature = Signature.of(
            ArgSpec.required("target", ArgType.STRING),
            ArgSpec.required("start", ArgType.INT),
            ArgSpec.required("length", ArgType.INT));
        return FunctionFactory.of("Substring", signature, (fc, args) -> {
            TypedGetter<K, String> target = args.get("target");
            TypedGetter<K, Long> start = args.get("start");
            TypedGetter<K, Long> length = args.get("length");
            return (ctx, tCtx) -> {
                String value = target.get(ctx, tCtx);
                long from = start.get(ctx, tCtx);
                long len = length.get(ctx, tCtx);
                if (from < 0) {
                    throw new EvaluationException("invalid start for Substring function, " + from + " cannot be negative");
                }
                if (len <= 0) {
                    throw new EvaluationException("invalid length for Substring function, " + len
                        + " cannot be negative or zero");
                }
                if (from > value.length() || len > value.length() - from) {
                    throw new EvaluationException("invalid range for Substring function, start " + from
                        + " and length " + len + " exceed the string length " + value.length());
                }
                return value.substring((int) from, (int) (from + len));
            };
        });
    }

    /**
     * {@code Len(target)}: characters of a string, entries of a map or slice, bytes of a byte
     * string.
     */
    static <K> Factory<K> len() {
        return FunctionFactory.of("Len", Signature.of(ArgSpec.required("target", ArgType.GETTER)), (fc, args) -> {
            Getter<K> target = args.get("target");
            return (ctx, tCtx) -> {
                Object v = target.get(ctx, tCtx);
                if (v instanceof String s) {
                    return (long) s.codePointCount(0, s.length());
                }
                if (v instanceof PSlice s) {
                    return (long) s.size();
                }
                if (v instanceof PMap m) {
                    return (long) m.size();
                }
                if (v instanceof byte[] b) {
                    return (long) b.length;
                }
                throw new TypeError("computing length of " + Values.typeName(v) + " is not supported");
            };
        });
    }
}
