package com.acme.finops.ottl.pdata;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One resource and the scopes reporting under it.
 */
public final class ResourceRecords<T> {
    private final Resource resource;
    private String schemaUrl = "";
    private final List<ScopeRecords<T>> scopes = new ArrayList<>();

    public ResourceRecords(Resource resource) {
        this.resource = Objects.requireNonNull(resource, "resource");
    }

    public Resource resource() {
        return resource;
    }

    public String schemaUrl() {
        return schemaUrl;
    }

    public void setSchemaUrl(String schemaUrl) {
        this.schemaUrl = schemaUrl == null ? "" : schemaUrl;
    }

    public List<ScopeRecords<T>> scopes() {
        return scopes;
    }

    public ScopeRecords<T> addScope(InstrumentationScope scope) {
        ScopeRecords<T> out = new ScopeRecords<>(scope);
        scopes.add(out);
        return out;
    }
}
