package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.path.Path;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.Span;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluation context for one span together with its scope and resource.
 *
 * <p>{@code cache} is a scratch map that lives as long as this context; statements may use it
 * to pass values to each other.</p>
 */
public record SpanContext(Span span, InstrumentationScope scope, Resource resource, PMap cache) {
    public static final String NAME = "span";
    static final List<String> FIELDS = CommonPaths.known(SpanPaths.FIELDS, "resource", "instrumentation_scope", "cache");

    public SpanContext {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(cache, "cache");
    }

    public SpanContext(Span span, InstrumentationScope scope, Resource resource) {
        this(span, scope, resource, new PMap());
    }

    public static Parser<SpanContext> newParser(Map<String, Factory<SpanContext>> functions) {
        return Parser.<SpanContext>builder(NAME, SpanContext::resolve).functions(functions).enumParser(Enums.SPAN).build();
    }

    static GetSetter<SpanContext> resolve(Path<SpanContext> path) throws ConfigException {
        return switch (path.name()) {
            case "resource" -> CommonPaths.resource(path, SpanContext::resource);
            case "instrumentation_scope", "scope" -> CommonPaths.scope(path, SpanContext::scope);
            case "cache" -> CommonPaths.map(path, SpanContext::cache);
            default -> SpanPaths.resolve(path, SpanContext::span, NAME, FIELDS);
        };
    }
}
