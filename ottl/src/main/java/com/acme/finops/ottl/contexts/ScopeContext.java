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

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluation context for statements that run once per instrumentation scope.
 */
public record ScopeContext(InstrumentationScope scope, Resource resource, PMap cache) {
    public static final String NAME = "instrumentation_scope";
    static final List<String> FIELDS = CommonPaths.known(CommonPaths.SCOPE_FIELDS, "resource", "cache");

    public ScopeContext {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(cache, "cache");
    }

    public ScopeContext(InstrumentationScope scope, Resource resource) {
        this(scope, resource, new PMap());
    }

    public static Parser<ScopeContext> newParser(Map<String, Factory<ScopeContext>> functions) {
        return Parser.<ScopeContext>builder(NAME, ScopeContext::resolve).functions(functions).build();
    }

    static GetSetter<ScopeContext> resolve(Path<ScopeContext> path) throws ConfigException {
        return switch (path.name()) {
            case "resource" -> CommonPaths.resource(path, ScopeContext::resource);
            case "cache" -> CommonPaths.map(path, ScopeContext::cache);
            case "scope" -> CommonPaths.scope(path, ScopeContext::scope);
            default -> {
                if (!CommonPaths.SCOPE_FIELDS.contains(path.name())) {
                    throw Paths.unknownField(path, NAME, FIELDS);
                }
                yield CommonPaths.scopeField(path, ScopeContext::scope, NAME);
            }
        };
    }
}
