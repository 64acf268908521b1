package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.path.Path;
import com.acme.finops.ottl.path.Paths;
import com.acme.finops.ottl.pdata.PSlice;
import com.acme.finops.ottl.pdata.Span;
import com.acme.finops.ottl.pdata.SpanEvent;
import com.acme.finops.ottl.pdata.SpanKind;
import com.acme.finops.ottl.pdata.StatusCode;

import java.util.List;
import java.util.function.Function;

/**
 * Span fields, reachable from the span context and as {@code span.*} from span events.
 */
final class SpanPaths {
    static final List<String> FIELDS = List.of(
        "trace_id", "span_id", "parent_span_id", "trace_state", "name", "kind",
        "start_time_unix_nano", "end_time_unix_nano", "start_time", "end_time",
        "attributes", "dropped_attributes_count", "events", "dropped_events_count", "status");

    private static final List<String> KIND_FIELDS = List.of("string", "deprecated_string");
    private static final List<String> STATUS_FIELDS = List.of("code", "message");

    private SpanPaths() {
    }

    static <K> GetSetter<K> resolve(Path<K> path, Function<K, Span> span, String contextName, List<String> known)
        throws ConfigException {
        return switch (path.name()) {
            case "trace_id" -> CommonPaths.id(path,
                tCtx -> span.apply(tCtx).traceId(), (tCtx, v) -> span.apply(tCtx).setTraceId(v), Span.TRACE_ID_LENGTH);
            case "span_id" -> CommonPaths.id(path,
                tCtx -> span.apply(tCtx).spanId(), (tCtx, v) -> span.apply(tCtx).setSpanId(v), Span.SPAN_ID_LENGTH);
            case "parent_span_id" -> CommonPaths.id(path,
                tCtx -> span.apply(tCtx).parentSpanId(),
                (tCtx, v) -> span.apply(tCtx).setParentSpanId(v), Span.SPAN_ID_LENGTH);
            case "trace_state" -> CommonPaths.string(path,
                tCtx -> span.apply(tCtx).traceState(), (tCtx, v) -> span.apply(tCtx).setTraceState(v));
            case "name" -> CommonPaths.string(path,
                tCtx -> span.apply(tCtx).name(), (tCtx, v) -> span.apply(tCtx).setName(v));
            case "kind" -> kind(path, span);
            case "start_time_unix_nano" -> CommonPaths.int64(path,
                tCtx -> span.apply(tCtx).startTimeUnixNano(), (tCtx, v) -> span.apply(tCtx).setStartTimeUnixNano(v));
            case "end_time_unix_nano" -> CommonPaths.int64(path,
                tCtx -> span.apply(tCtx).endTimeUnixNano(), (tCtx, v) -> span.apply(tCtx).setEndTimeUnixNano(v));
            case "start_time" -> CommonPaths.time(path,
                tCtx -> span.apply(tCtx).startTimeUnixNano(), (tCtx, v) -> span.apply(tCtx).setStartTimeUnixNano(v));
            case "end_time" -> CommonPaths.time(path,
                tCtx -> span.apply(tCtx).endTimeUnixNano(), (tCtx, v) -> span.apply(tCtx).setEndTimeUnixNano(v));
            case "attributes" -> CommonPaths.map(path, tCtx -> span.apply(tCtx).attributes());
            case "dropped_attributes_count" -> CommonPaths.int64(path,
                tCtx -> span.apply(tCtx).droppedAttributesCount(),
                (tCtx, v) -> span.apply(tCtx).setDroppedAttributesCount(v));
            case "events" -> events(path, span);
            case "dropped_events_count" -> CommonPaths.int64(path,
                tCtx -> span.apply(tCtx).droppedEventsCount(), (tCtx, v) -> span.apply(tCtx).setDroppedEventsCount(v));
            case "status" -> status(path, span);
            default -> throw Paths.unknownField(path, contextName, known);
        };
    }

    private static <K> GetSetter<K> kind(Path<K> path, Function<K, Span> span) throws ConfigException {
        if (path.next() == null) {
            Paths.requireTerminal(path);
            return GetSetter.of(
                (ctx, tCtx) -> (long) span.apply(tCtx).kind().code(),
                (ctx, tCtx, value) -> {
                    if (value instanceof Long code) {
                        span.apply(tCtx).setKind(requireKind(SpanKind.fromCode(code), code));
                    }
                });
        }
        Path<K> next = CommonPaths.subField(path, KIND_FIELDS);
        Paths.requireTerminal(next);
        return switch (next.name()) {
            case "string" -> GetSetter.of(
                (ctx, tCtx) -> span.apply(tCtx).kind().displayName(),
                (ctx, tCtx, value) -> {
                    if (value instanceof String s) {
                        span.apply(tCtx).setKind(requireKind(SpanKind.fromDisplayName(s), s));
                    }
                });
            case "deprecated_string" -> GetSetter.of(
                (ctx, tCtx) -> span.apply(tCtx).kind().protoName(),
                (ctx, tCtx, value) -> {
                    if (value instanceof String s) {
                        span.apply(tCtx).setKind(requireKind(SpanKind.fromProtoName(s), s));
                    }
                });
            default -> throw Paths.unknownField(next, "span.kind", KIND_FIELDS);
        };
    }

    private static SpanKind requireKind(SpanKind kind, Object raw) throws EvaluationException {
        if (kind == null) {
            throw new EvaluationException("invalid span kind " + raw);
        }
        return kind;
    }

    private static <K> GetSetter<K> events(Path<K> path, Function<K, Span> span) throws ConfigException {
        Paths.requireTerminal(path);
        return GetSetter.readOnly(path.string(), (ctx, tCtx) -> {
            PSlice names = new PSlice();
            for (SpanEvent event : span.apply(tCtx).events()) {
                names.add(event.name());
            }
            return names;
        });
    }

    private static <K> GetSetter<K> status(Path<K> path, Function<K, Span> span) throws ConfigException {
        Path<K> next = CommonPaths.subField(path, STATUS_FIELDS);
        return switch (next.name()) {
            case "code" -> {
                Paths.requireTerminal(next);
                yield GetSetter.of(
                    (ctx, tCtx) -> (long) span.apply(tCtx).statusCode().code(),
                    (ctx, tCtx, value) -> {
                        if (value instanceof Long code) {
                            StatusCode status = StatusCode.fromCode(code);
                            if (status == null) {
                                throw new EvaluationException("invalid status code " + code);
                            }
                            span.apply(tCtx).setStatusCode(status);
                        }
                    });
            }
            case "message" -> CommonPaths.string(next,
                tCtx -> span.apply(tCtx).statusMessage(), (tCtx, v) -> span.apply(tCtx).setStatusMessage(v));
            default -> throw Paths.unknownField(next, "span.status", STATUS_FIELDS);
        };
    }
}
