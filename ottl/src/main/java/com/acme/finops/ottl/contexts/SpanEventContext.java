package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.path.Path;
import com.acme.finops.ottl.path.Paths;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.Span;
import com.acme.finops.ottl.pdata.SpanEvent;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluation context for one span event. The owning span is reachable as {@code span.*}.
 */
public record SpanEventContext(SpanEvent event, Span span, InstrumentationScope scope, Resource resource, PMap cache) {
    public static final String NAME = "spanevent";
    static final List<String> OWN_FIELDS = List.of("name", "time_unix_nano", "time", "attributes", "dropped_attributes_count");
    static final List<String> FIELDS = CommonPaths.known(OWN_FIELDS, "span", "resource", "instrumentation_scope", "cache");

    public SpanEventContext {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(cache, "cache");
    }

    public SpanEventContext(SpanEvent event, Span span, InstrumentationScope scope, Resource resource) {
        this(event, span, scope, resource, new PMap());
    }

    public static Parser<SpanEventContext> newParser(Map<String, Factory<SpanEventContext>> functions) {
        return Parser.<SpanEventContext>builder(NAME, SpanEventContext::resolve).functions(functions).enumParser(Enums.SPAN).build();
    }

    static GetSetter<SpanEventContext> resolve(Path<SpanEventContext> path) throws ConfigException {
        return switch (path.name()) {
            case "name" -> CommonPaths.string(path, c -> c.event().name(), (c, v) -> c.event().setName(v));
            case "time_unix_nano" -> CommonPaths.int64(path,
                c -> c.event().timeUnixNano(), (c, v) -> c.event().setTimeUnixNano(v));
            case "time" -> CommonPaths.time(path, c -> c.event().timeUnixNano(), (c, v) -> c.event().setTimeUnixNano(v));
            case "attributes" -> CommonPaths.map(path, c -> c.event().attributes());
            case "dropped_attributes_count" -> CommonPaths.int64(path,
                c -> c.event().droppedAttributesCount(), (c, v) -> c.event().setDroppedAttributesCount(v));
            case "span" -> SpanPaths.resolve(CommonPaths.subField(path, SpanPaths.FIELDS),
                SpanEventContext::span, SpanContext.NAME, SpanPaths.FIELDS);
            case "resource" -> CommonPaths.resource(path, SpanEventContext::resource);
            case "instrumentation_scope", "scope" -> CommonPaths.scope(path, SpanEventContext::scope);
            case "cache" -> CommonPaths.map(path, SpanEventContext::cache);
            default -> throw Paths.unknownField(path, NAME, FIELDS);
        };
    }
}
