package com.acme.finops.ottl.telemetry;

import com.acme.finops.ottl.pdata.SignalKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AtomicFilterMetricsTest {

    @Test
    void shouldStartAtZeroForEverySignal() {
        AtomicFilterMetrics.Snapshot s = new AtomicFilterMetrics("p").snapshot();
        for (SignalKind signal : SignalKind.values()) {
            assertEquals(0L, s.droppedBySignal().get(signal));
            assertEquals(0L, s.evaluationErrorsBySignal().get(signal));
        }
        assertEquals(0L, s.droppedTotal());
    }

    @Test
    void shouldAccumulatePerSignalAndIgnoreNonPositive() {
        AtomicFilterMetrics metrics = new AtomicFilterMetrics("edge");
        metrics.incDropped(SignalKind.TRACES, 3);
        metrics.incDropped(SignalKind.LOGS, 2);
        metrics.incDropped(SignalKind.LOGS, 0);
        metrics.incDropped(SignalKind.LOGS, -5);
        metrics.incEvaluationErrors(SignalKind.METRICS, 4);

        AtomicFilterMetrics.Snapshot s = metrics.snapshot();
        assertEquals("edge", s.processorId());
        assertEquals(3L, s.droppedBySignal().get(SignalKind.TRACES));
        assertEquals(2L, s.droppedBySignal().get(SignalKind.LOGS));
        assertEquals(5L, s.droppedTotal());
        assertEquals(4L, s.evaluationErrorsBySignal().get(SignalKind.METRICS));
    }
}
