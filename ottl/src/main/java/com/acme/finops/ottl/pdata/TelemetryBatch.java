package com.acme.finops.ottl.pdata;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A resource → scope → record tree for one signal. Mutated in place by processing stages.
 *
 * @param <T> record type: {@link Span}, {@link LogRecord}, {@link Metric} or {@link Profile}
 */
public final class TelemetryBatch<T> {
    private final SignalKind signal;
    private final List<ResourceRecords<T>> resources = new ArrayList<>();

    public TelemetryBatch(SignalKind signal) {
        this.signal = Objects.requireNonNull(signal, "signal");
    }

    public static TelemetryBatch<Span> traces() {
        return new TelemetryBatch<>(SignalKind.TRACES);
    }

    public static TelemetryBatch<LogRecord> logs() {
        return new TelemetryBatch<>(SignalKind.LOGS);
    }

    public static TelemetryBatch<Metric> metrics() {
        return new TelemetryBatch<>(SignalKind.METRICS);
    }

    public static TelemetryBatch<Profile> profiles() {
        return new TelemetryBatch<>(SignalKind.PROFILES);
    }

    public SignalKind signal() {
        return signal;
    }

    public List<ResourceRecords<T>> resources() {
        return resources;
    }

    public ResourceRecords<T> addResource(Resource resource) {
        ResourceRecords<T> out = new ResourceRecords<>(resource);
        resources.add(out);
        return out;
    }

    public int recordCount() {
        int n = 0;
        for (ResourceRecords<T> rr : resources) {
            for (ScopeRecords<T> sr : rr.scopes()) {
                n += sr.records().size();
            }
        }
        return n;
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }
}
