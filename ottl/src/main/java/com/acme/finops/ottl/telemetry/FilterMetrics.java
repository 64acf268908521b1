package com.acme.finops.ottl.telemetry;

import com.acme.finops.ottl.pdata.SignalKind;

/**
 * Side-channel counters of a processing stage.
 */
public interface FilterMetrics {
    void incDropped(SignalKind signal, long n);

    void incEvaluationErrors(SignalKind signal, long n);
}
