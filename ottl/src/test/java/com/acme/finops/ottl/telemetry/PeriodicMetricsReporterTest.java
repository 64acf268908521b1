package com.acme.finops.ottl.telemetry;

import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PeriodicMetricsReporterTest {

    @Test
    void shouldRenderSnapshotAsJson() throws Exception {
        AtomicFilterMetrics metrics = new AtomicFilterMetrics("edge");
        metrics.incDropped(SignalKind.LOGS, 4);
        metrics.incDropped(SignalKind.PROFILES, 1);
        metrics.incEvaluationErrors(SignalKind.TRACES, 2);

        JsonNode json = JsonCodec.readTree(PeriodicMetricsReporter.render(metrics.snapshot()));

        assertEquals("ottl-filter", json.path("component").asText());
        assertEquals("filter_metrics", json.path("type").asText());
        assertEquals("edge", json.path("processor").asText());
        assertEquals(5L, json.path("droppedTotal").asLong());
        assertEquals(4L, json.path("droppedBySignal").path("logs").asLong());
        assertEquals(2L, json.path("evaluationErrorsBySignal").path("traces").asLong());
    }
}
