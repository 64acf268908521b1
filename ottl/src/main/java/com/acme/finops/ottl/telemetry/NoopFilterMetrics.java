package com.acme.finops.ottl.telemetry;

import com.acme.finops.ottl.pdata.SignalKind;

public final class NoopFilterMetrics implements FilterMetrics {
    public static final NoopFilterMetrics INSTANCE = new NoopFilterMetrics();

    private NoopFilterMetrics() {
    }

    @Override
    public void incDropped(SignalKind signal, long n) {
    }

    @Override
    public void incEvaluationErrors(SignalKind signal, long n) {
    }
}
