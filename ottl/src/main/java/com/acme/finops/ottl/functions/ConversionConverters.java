package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.expr.TypedGetter;
import com.acme.finops.ottl.func.ArgSpec;
import com.acme.finops.ottl.func.ArgType;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.func.FunctionFactory;
import com.acme.finops.ottl.func.Signature;
import com.acme.finops.ottl.pdata.ValueType;
import com.acme.finops.ottl.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Type conversions, encodings and hashing.
 */
final class ConversionConverters {
    private ConversionConverters() {
    }

    /**
     * {@code Int(value)}: truncates doubles, parses base-10 strings, maps bools to 1/0. Nil
     * for nil and for strings that do not parse.
     */
    static <K> Factory<K> toInt() {
        return passThrough("Int", ArgType.INT_LIKE);
    }

    static <K> Factory<K> toDouble() {
        return passThrough("Double", ArgType.FLOAT_LIKE);
    }

    static <K> Factory<K> toStringValue() {
        return passThrough("String", ArgType.STRING_LIKE);
    }

    private static <K> Factory<K> passThrough(String name, ArgType type) {
        return FunctionFactory.of(name, Signature.of(ArgSpec.required("value", type)), (fc, args) -> {
            TypedGetter<K, ?> value = args.get("value");
            return value::get;
        });
    }

    static <K> Factory<K> hex() {
        return FunctionFactory.of("Hex", Signature.of(ArgSpec.required("value", ArgType.BYTES_LIKE)), (fc, args) -> {
            TypedGetter<K, byte[]> value = args.get("value");
            return (ctx, tCtx) -> {
                byte[] bytes = value.get(ctx, tCtx);
                return bytes == null ? "" : HexFormat.of().formatHex(bytes);
            };
        });
    }

    static <K> Factory<K> sha256() {
        return FunctionFactory.of("SHA256", Signature.of(ArgSpec.required("value", ArgType.STRING)), (fc, args) -> {
            TypedGetter<K, String> value = args.get("value");
            return (ctx, tCtx) -> {
                MessageDigest digest;
                try {
                    digest = MessageDigest.getInstance("SHA-256");
                } catch (NoSuchAlgorithmException e) {
                    throw new EvaluationException("SHA-256 is not available", e);
                }
                byte[] hash = digest.digest(value.get(ctx, tCtx).getBytes(StandardCharsets.UTF_8));
                return HexFormat.of().formatHex(hash);
            };
        });
    }

    static <K> Factory<K> base64Decode() {
        return FunctionFactory.of("Base64Decode", Signature.of(ArgSpec.required("value", ArgType.STRING)), (fc, args) -> {
            TypedGetter<K, String> value = args.get("value");
            return (ctx, tCtx) -> {
                String encoded = value.get(ctx, tCtx);
                try {
                    return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
                } catch (IllegalArgumentException e) {
                    throw new EvaluationException("invalid base64 input: " + e.getMessage(), e);
                }
            };
        });
    }

    /**
     * {@code ParseJSON(target)}: a JSON object becomes a map and a JSON array a slice. Any
     * other top-level value is an error.
     */
    static <K> Factory<K> parseJson() {
        return FunctionFactory.of("ParseJSON", Signature.of(ArgSpec.required("target", ArgType.STRING)), (fc, args) -> {
            TypedGetter<K, String> target = args.get("target");
            return (ctx, tCtx) -> {
                JsonNode node;
                try {
                    node = JsonCodec.readTree(target.get(ctx, tCtx));
                } catch (JsonProcessingException e) {
                    throw new EvaluationException("unable to parse JSON: " + e.getOriginalMessage(), e);
                }
                Object value = JsonCodec.toValue(node);
                ValueType type = ValueType.of(value);
                if (type != ValueType.MAP && type != ValueType.SLICE) {
                    throw new EvaluationException("could not convert parsed value of type "
                        + (type == null ? "unknown" : type.displayName()) + " to a JSON object or array");
                }
                return value;
            };
        });
    }
}
