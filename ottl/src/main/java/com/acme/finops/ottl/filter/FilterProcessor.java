package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.contexts.ResourceContext;
import com.acme.finops.ottl.expr.BoolExpr;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.ResourceRecords;
import com.acme.finops.ottl.pdata.ScopeRecords;
import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.pdata.TelemetryBatch;
import com.acme.finops.ottl.telemetry.FilterMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Removes the records of one signal that match the configured skip conditions.
 *
 * <p>The resource condition runs once per resource and removes the whole resource on a
 * match. Record-level conditions run below it. Scopes left without records are removed,
 * then resources left without scopes. Surviving elements keep their order.</p>
 *
 * <p>A condition that fails under {@code propagate} keeps its record; the error is
 * collected and reported through {@link FilterResult.Failed}.</p>
 */
public abstract class FilterProcessor<T> {
    private static final Logger LOG = Logger.getLogger(FilterProcessor.class.getName());

    private final SignalKind signal;
    private final String processorId;
    private final BoolExpr<ResourceContext> skipResource;
    private final FilterMetrics metrics;

    protected FilterProcessor(SignalKind signal, String processorId, BoolExpr<ResourceContext> skipResource,
                              FilterMetrics metrics) {
        this.signal = Objects.requireNonNull(signal, "signal");
        this.processorId = Objects.requireNonNull(processorId, "processorId");
        this.skipResource = skipResource;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public SignalKind signal() {
        return signal;
    }

    public String processorId() {
        return processorId;
    }

    /**
     * True when no condition is configured and batches pass through untouched.
     */
    public boolean isNoop() {
        return skipResource == null && !hasRecordConditions();
    }

    public final FilterResult<T> process(ExecContext ctx, TelemetryBatch<T> batch) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(batch, "batch");
        if (batch.signal() != signal) {
            throw new IllegalArgumentException("expected a " + signal.label() + " batch but got " + batch.signal().label());
        }
        if (isNoop()) {
            return new FilterResult.Forwarded<>(batch, 0L);
        }

        long before = countItems(batch);
        List<EvaluationException> errors = new ArrayList<>();
        boolean recordLevel = hasRecordConditions();
        batch.resources().removeIf(rr -> {
            if (skipResource != null && skip(skipResource, ctx, new ResourceContext(rr.resource()), errors)) {
                return true;
            }
            if (recordLevel) {
                filterResource(ctx, rr, errors);
            }
            return rr.scopes().isEmpty();
        });
        long dropped = before - countItems(batch);

        metrics.incDropped(signal, dropped);
        metrics.incEvaluationErrors(signal, errors.size());
        if (!errors.isEmpty()) {
            LOG.severe("failed processing " + signal.label() + " processor=" + processorId
                + " errors=" + errors.size() + " first=" + errors.get(0).getMessage());
            return new FilterResult.Failed<>(batch, errors, dropped);
        }
        if (batch.isEmpty()) {
            return new FilterResult.NothingToForward<>(dropped);
        }
        return new FilterResult.Forwarded<>(batch, dropped);
    }

    private void filterResource(ExecContext ctx, ResourceRecords<T> rr, List<EvaluationException> errors) {
        for (ScopeRecords<T> scope : rr.scopes()) {
            filterScope(ctx, rr.resource(), scope, errors);
        }
        rr.scopes().removeIf(scope -> scope.records().isEmpty());
    }

    protected abstract boolean hasRecordConditions();

    /**
     * Removes matching records of one scope, recording evaluation failures in {@code errors}.
     */
    protected abstract void filterScope(ExecContext ctx, Resource resource, ScopeRecords<T> scope,
                                        List<EvaluationException> errors);

    /**
     * Units counted as dropped: records, or data points for metrics.
     */
    protected abstract long countItems(TelemetryBatch<T> batch);

    /**
     * Evaluates a skip condition. A failure keeps the element and is added to {@code errors}.
     */
    protected static <C> boolean skip(BoolExpr<C> expr, ExecContext ctx, C tCtx, List<EvaluationException> errors) {
        try {
            return expr.eval(ctx, tCtx);
        } catch (EvaluationException e) {
            errors.add(e);
            return false;
        }
    }
}
