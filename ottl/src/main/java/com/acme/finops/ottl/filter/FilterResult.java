package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.pdata.TelemetryBatch;

import java.util.List;

/**
 * Outcome of filtering one batch. {@code dropped} counts the removed records (data points
 * for metrics).
 */
public sealed interface FilterResult<T> permits FilterResult.Forwarded, FilterResult.NothingToForward, FilterResult.Failed {
    long dropped();

    record Forwarded<T>(TelemetryBatch<T> batch, long dropped) implements FilterResult<T> {}

    /** Every resource was removed; downstream stages should not be called. */
    record NothingToForward<T>(long dropped) implements FilterResult<T> {}

    /** Conditions failed under {@code propagate}. Records whose evaluation failed are still in the batch. */
    record Failed<T>(TelemetryBatch<T> batch, List<EvaluationException> errors, long dropped) implements FilterResult<T> {
        public Failed {
            errors = List.copyOf(errors);
        }
    }
}
