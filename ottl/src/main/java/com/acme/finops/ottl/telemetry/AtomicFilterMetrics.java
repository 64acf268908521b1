package com.acme.finops.ottl.telemetry;

import com.acme.finops.ottl.pdata.SignalKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters per signal, tagged with the owning processor id.
 */
public final class AtomicFilterMetrics implements FilterMetrics {
    private final String processorId;
    private final EnumMap<SignalKind, LongAdder> dropped = new EnumMap<>(SignalKind.class);
    private final EnumMap<SignalKind, LongAdder> evaluationErrors = new EnumMap<>(SignalKind.class);

    public AtomicFilterMetrics(String processorId) {
        this.processorId = Objects.requireNonNull(processorId, "processorId");
        // populated up front, never structurally modified afterwards
        for (SignalKind signal : SignalKind.values()) {
            dropped.put(signal, new LongAdder());
            evaluationErrors.put(signal, new LongAdder());
        }
    }

    public String processorId() {
        return processorId;
    }

    @Override
    public void incDropped(SignalKind signal, long n) {
        if (n <= 0) return;
        dropped.get(signal).add(n);
    }

    @Override
    public void incEvaluationErrors(SignalKind signal, long n) {
        if (n <= 0) return;
        evaluationErrors.get(signal).add(n);
    }

    public Snapshot snapshot() {
        return new Snapshot(processorId, sums(dropped), sums(evaluationErrors));
    }

    private static Map<SignalKind, Long> sums(EnumMap<SignalKind, LongAdder> src) {
        EnumMap<SignalKind, Long> out = new EnumMap<>(SignalKind.class);
        src.forEach((k, v) -> out.put(k, v.sum()));
        return Collections.unmodifiableMap(out);
    }

    public record Snapshot(String processorId,
                           Map<SignalKind, Long> droppedBySignal,
                           Map<SignalKind, Long> evaluationErrorsBySignal) {

        public long droppedTotal() {
            long total = 0L;
            for (Long v : droppedBySignal.values()) {
                total += v;
            }
            return total;
        }
    }
}
