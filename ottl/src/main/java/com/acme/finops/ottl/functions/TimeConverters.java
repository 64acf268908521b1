package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.expr.TypedGetter;
import com.acme.finops.ottl.func.ArgSpec;
import com.acme.finops.ottl.func.ArgType;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.func.FunctionFactory;
import com.acme.finops.ottl.func.Signature;
import com.acme.finops.ottl.pdata.Values;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * {@code Now}, {@code Duration}, {@code Time} and {@code UnixNano}. "Now" always comes from
 * the clock in the {@link com.acme.finops.ottl.ExecContext}.
 */
final class TimeConverters {
    private TimeConverters() {
    }

    static <K> Factory<K> now() {
        return FunctionFactory.of("Now", Signature.none(), (fc, args) -> (ctx, tCtx) -> Instant.now(ctx.clock()));
    }

    static <K> Factory<K> duration() {
        return FunctionFactory.of("Duration", Signature.of(ArgSpec.required("duration", ArgType.STRING)), (fc, args) -> {
            TypedGetter<K, String> duration = args.get("duration");
            return (ctx, tCtx) -> TimeFormats.parseDuration(duration.get(ctx, tCtx));
        });
    }

    /**
     * {@code Time(time, format, location)} parses with a strptime layout. Without a zone in
     * the text the optional location applies, UTC otherwise.
     */
    static <K> Factory<K> time() {
        Signature signature = Signature.of(
            ArgSpec.required("time", ArgType.STRING),
            ArgSpec.required("format", ArgType.STRING_LITERAL),
            ArgSpec.optional("location", ArgType.STRING_LITERAL));
        return FunctionFactory.of("Time", signature, (fc, args) -> {
            TypedGetter<K, String> time = args.get("time");
            String format = args.get("format");
            if (format.isEmpty()) {
                throw new ConfigException("format cannot be empty");
            }
            DateTimeFormatter formatter = TimeFormats.strptime(format);
            ZoneId zone = ZoneOffset.UTC;
            String location = args.<String>optional("location").orElse("");
            if (!location.isEmpty()) {
                try {
                    zone = ZoneId.of(location);
                } catch (DateTimeException e) {
                    throw new ConfigException("unknown location " + location, e);
                }
            }
            ZoneId defaultZone = zone;
            return (ctx, tCtx) -> TimeFormats.parseTime(formatter, time.get(ctx, tCtx), defaultZone);
        });
    }

    static <K> Factory<K> unixNano() {
        return FunctionFactory.of("UnixNano", Signature.of(ArgSpec.required("time", ArgType.TIME)), (fc, args) -> {
            TypedGetter<K, Instant> time = args.get("time");
            return (ctx, tCtx) -> Values.unixNano(time.get(ctx, tCtx));
        });
    }
}
