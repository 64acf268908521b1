package com.acme.finops.ottl.telemetry;

import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Logs a JSON snapshot of the filter counters at a fixed interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final AtomicFilterMetrics metrics;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(AtomicFilterMetrics metrics, long intervalSeconds) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ottl-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    private void emit() {
        try {
            LOG.info(render(metrics.snapshot()));
        } catch (RuntimeException e) {
            LOG.warning("Metrics reporter failure: " + e.getClass().getSimpleName());
        }
    }

    static String render(AtomicFilterMetrics.Snapshot s) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "ottl-filter");
        payload.put("type", "filter_metrics");
        payload.put("processor", s.processorId());
        payload.put("droppedTotal", s.droppedTotal());
        payload.put("droppedBySignal", byLabel(s.droppedBySignal()));
        payload.put("evaluationErrorsBySignal", byLabel(s.evaluationErrorsBySignal()));
        try {
            return JsonCodec.writeString(payload);
        } catch (JsonProcessingException e) {
            return payload.toString();
        }
    }

    private static Map<String, Long> byLabel(Map<SignalKind, Long> counts) {
        Map<String, Long> out = new LinkedHashMap<>();
        counts.forEach((k, v) -> out.put(k.label(), v));
        return out;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
