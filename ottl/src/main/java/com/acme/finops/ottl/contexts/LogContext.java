package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.TypeError;
import com.acme.finops.ottl.expr.Coercions;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.path.Indexing;
import com.acme.finops.ottl.path.Key;
import com.acme.finops.ottl.path.Path;
import com.acme.finops.ottl.path.Paths;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.LogRecord;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.SeverityNumber;
import com.acme.finops.ottl.pdata.Span;
import com.acme.finops.ottl.pdata.Values;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluation context for one log record.
 */
public record LogContext(LogRecord log, InstrumentationScope scope, Resource resource, PMap cache) {
    public static final String NAME = "log";
    static final List<String> OWN_FIELDS = List.of(
        "time_unix_nano", "observed_time_unix_nano", "time", "observed_time", "severity_number",
        "severity_text", "body", "attributes", "dropped_attributes_count", "flags", "trace_id", "span_id");
    static final List<String> FIELDS = CommonPaths.known(OWN_FIELDS, "resource", "instrumentation_scope", "cache");

    public LogContext {
        Objects.requireNonNull(log, "log");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(cache, "cache");
    }

    public LogContext(LogRecord log, InstrumentationScope scope, Resource resource) {
        this(log, scope, resource, new PMap());
    }

    public static Parser<LogContext> newParser(Map<String, Factory<LogContext>> functions) {
        return Parser.<LogContext>builder(NAME, LogContext::resolve).functions(functions).enumParser(Enums.LOG).build();
    }

    static GetSetter<LogContext> resolve(Path<LogContext> path) throws ConfigException {
        return switch (path.name()) {
            case "time_unix_nano" -> CommonPaths.int64(path,
                c -> c.log().timeUnixNano(), (c, v) -> c.log().setTimeUnixNano(v));
            case "observed_time_unix_nano" -> CommonPaths.int64(path,
                c -> c.log().observedTimeUnixNano(), (c, v) -> c.log().setObservedTimeUnixNano(v));
            case "time" -> CommonPaths.time(path, c -> c.log().timeUnixNano(), (c, v) -> c.log().setTimeUnixNano(v));
            case "observed_time" -> CommonPaths.time(path,
                c -> c.log().observedTimeUnixNano(), (c, v) -> c.log().setObservedTimeUnixNano(v));
            case "severity_number" -> severityNumber(path);
            case "severity_text" -> CommonPaths.string(path,
                c -> c.log().severityText(), (c, v) -> c.log().setSeverityText(v));
            case "body" -> body(path);
            case "attributes" -> CommonPaths.map(path, c -> c.log().attributes());
            case "dropped_attributes_count" -> CommonPaths.int64(path,
                c -> c.log().droppedAttributesCount(), (c, v) -> c.log().setDroppedAttributesCount(v));
            case "flags" -> CommonPaths.int64(path, c -> c.log().flags(), (c, v) -> c.log().setFlags(v));
            case "trace_id" -> CommonPaths.id(path,
                c -> c.log().traceId(), (c, v) -> c.log().setTraceId(v), Span.TRACE_ID_LENGTH);
            case "span_id" -> CommonPaths.id(path,
                c -> c.log().spanId(), (c, v) -> c.log().setSpanId(v), Span.SPAN_ID_LENGTH);
            case "resource" -> CommonPaths.resource(path, LogContext::resource);
            case "instrumentation_scope", "scope" -> CommonPaths.scope(path, LogContext::scope);
            case "cache" -> CommonPaths.map(path, LogContext::cache);
            default -> throw Paths.unknownField(path, NAME, FIELDS);
        };
    }

    private static GetSetter<LogContext> severityNumber(Path<LogContext> path) throws ConfigException {
        Paths.requireTerminal(path);
        return GetSetter.of(
            (ctx, c) -> {
                SeverityNumber severity = c.log().severityNumber();
                if (severity == null) {
                    throw new TypeError("severity_number is not set on this log record");
                }
                return (long) severity.code();
            },
            (ctx, c, value) -> {
                if (value instanceof Long code) {
                    SeverityNumber severity = SeverityNumber.fromCode(code);
                    if (severity == null) {
                        throw new TypeError("invalid severity number " + code);
                    }
                    c.log().setSeverityNumber(severity);
                }
            });
    }

    private static GetSetter<LogContext> body(Path<LogContext> path) throws ConfigException {
        if (path.next() != null) {
            Path<LogContext> next = CommonPaths.subField(path, List.of("string"));
            if (!"string".equals(next.name())) {
                throw Paths.unknownField(next, "log.body", List.of("string"));
            }
            Paths.requireTerminal(next);
            return GetSetter.of(
                (ctx, c) -> Coercions.STRING_LIKE.coerce(c.log().body()),
                (ctx, c, value) -> {
                    if (value instanceof String s) {
                        c.log().setBody(s);
                    }
                });
        }
        List<Key<LogContext>> keys = path.keys();
        if (keys.isEmpty()) {
            return GetSetter.of(
                (ctx, c) -> c.log().body(),
                (ctx, c, value) -> c.log().setBody(Values.deepCopy(Values.toAttributeValue(value))));
        }
        return GetSetter.of(
            (ctx, c) -> Indexing.get(ctx, c, c.log().body(), keys),
            (ctx, c, value) -> {
                Object body = c.log().body();
                if (!(body instanceof PMap map)) {
                    throw new TypeError("log body of type " + Values.typeName(body) + " cannot be written by key");
                }
                Indexing.set(ctx, c, map, keys, value);
            });
    }
}
