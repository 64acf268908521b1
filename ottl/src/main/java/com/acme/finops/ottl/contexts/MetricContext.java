package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.path.Path;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.Metric;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.Resource;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record MetricContext(Metric metric, InstrumentationScope scope, Resource resource, PMap cache) {
    public static final String NAME = "metric";
    static final List<String> FIELDS = CommonPaths.known(MetricPaths.FIELDS, "resource", "instrumentation_scope", "cache");

    public MetricContext {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(cache, "cache");
    }

    public MetricContext(Metric metric, InstrumentationScope scope, Resource resource) {
        this(metric, scope, resource, new PMap());
    }

    public static Parser<MetricContext> newParser(Map<String, Factory<MetricContext>> functions) {
        return Parser.<MetricContext>builder(NAME, MetricContext::resolve).functions(functions).enumParser(Enums.METRIC).build();
    }

    static GetSetter<MetricContext> resolve(Path<MetricContext> path) throws ConfigException {
        return switch (path.name()) {
            case "resource" -> CommonPaths.resource(path, MetricContext::resource);
            case "instrumentation_scope", "scope" -> CommonPaths.scope(path, MetricContext::scope);
            case "cache" -> CommonPaths.map(path, MetricContext::cache);
            default -> MetricPaths.resolve(path, MetricContext::metric, NAME, FIELDS);
        };
    }
}
