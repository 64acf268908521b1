package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.path.Path;
import com.acme.finops.ottl.path.Paths;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.Resource;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluation context for statements and conditions that run once per resource.
 */
public record ResourceContext(Resource resource, PMap cache) {
    public static final String NAME = "resource";
    static final List<String> FIELDS = CommonPaths.known(CommonPaths.RESOURCE_FIELDS, "cache");

    public ResourceContext {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(cache, "cache");
    }

    public ResourceContext(Resource resource) {
        this(resource, new PMap());
    }

    public static Parser<ResourceContext> newParser(Map<String, Factory<ResourceContext>> functions) {
        return Parser.<ResourceContext>builder(NAME, ResourceContext::resolve).functions(functions).build();
    }

    static GetSetter<ResourceContext> resolve(Path<ResourceContext> path) throws ConfigException {
        if ("cache".equals(path.name())) {
            return CommonPaths.map(path, ResourceContext::cache);
        }
        if (!CommonPaths.RESOURCE_FIELDS.contains(path.name())) {
            throw Paths.unknownField(path, NAME, FIELDS);
        }
        return CommonPaths.resourceField(path, ResourceContext::resource, NAME);
    }
}
