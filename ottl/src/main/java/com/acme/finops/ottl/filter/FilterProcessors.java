package com.acme.finops.ottl.filter;

import java.util.Objects;

/**
 * One filter processor per signal, built from the same configuration.
 */
public record FilterProcessors(TracesFilterProcessor traces,
                               LogsFilterProcessor logs,
                               MetricsFilterProcessor metrics,
                               ProfilesFilterProcessor profiles) {
    public FilterProcessors {
        Objects.requireNonNull(traces, "traces");
        Objects.requireNonNull(logs, "logs");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(profiles, "profiles");
    }
}
