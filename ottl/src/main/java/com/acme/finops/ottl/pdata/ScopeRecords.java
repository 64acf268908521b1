package com.acme.finops.ottl.pdata;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Records emitted by one instrumentation scope.
 */
public final class ScopeRecords<T> {
    private final InstrumentationScope scope;
    private String schemaUrl = "";
    private final List<T> records = new ArrayList<>();

    public ScopeRecords(InstrumentationScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public InstrumentationScope scope() {
        return scope;
    }

    public String schemaUrl() {
        return schemaUrl;
    }

    public void setSchemaUrl(String schemaUrl) {
        this.schemaUrl = schemaUrl == null ? "" : schemaUrl;
    }

    public List<T> records() {
        return records;
    }
}
