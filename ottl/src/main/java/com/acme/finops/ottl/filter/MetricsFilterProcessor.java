package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.contexts.DataPointContext;
import com.acme.finops.ottl.contexts.MetricContext;
import com.acme.finops.ottl.contexts.ResourceContext;
import com.acme.finops.ottl.expr.BoolExpr;
import com.acme.finops.ottl.pdata.Metric;
import com.acme.finops.ottl.pdata.MetricType;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.ResourceRecords;
import com.acme.finops.ottl.pdata.ScopeRecords;
import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.pdata.TelemetryBatch;
import com.acme.finops.ottl.telemetry.FilterMetrics;

import java.util.List;

/**
 * Drops resources, metrics and data points. When data point conditions are configured, a
 * metric left without data points is removed as well; metrics of type {@code EMPTY} are
 * never touched by data point conditions.
 */
public final class MetricsFilterProcessor extends FilterProcessor<Metric> {
    private final BoolExpr<MetricContext> skipMetric;
    private final BoolExpr<DataPointContext> skipDataPoint;

    public MetricsFilterProcessor(String processorId,
                                  BoolExpr<ResourceContext> skipResource,
                                  BoolExpr<MetricContext> skipMetric,
                                  BoolExpr<DataPointContext> skipDataPoint,
                                  FilterMetrics metrics) {
        super(SignalKind.METRICS, processorId, skipResource, metrics);
        this.skipMetric = skipMetric;
        this.skipDataPoint = skipDataPoint;
    }

    @Override
    protected boolean hasRecordConditions() {
        return skipMetric != null || skipDataPoint != null;
    }

    @Override
    protected void filterScope(ExecContext ctx, Resource resource, ScopeRecords<Metric> scope,
                               List<EvaluationException> errors) {
        scope.records().removeIf(metric -> {
            if (skipMetric != null && skip(skipMetric, ctx, new MetricContext(metric, scope.scope(), resource), errors)) {
                return true;
            }
            if (skipDataPoint == null || metric.type() == MetricType.EMPTY) {
                return false;
            }
            metric.dataPoints().removeIf(dp ->
                skip(skipDataPoint, ctx, new DataPointContext(dp, metric, scope.scope(), resource), errors));
            return metric.dataPoints().isEmpty();
        });
    }

    /**
     * Data points, the unit the dropped counter uses for metrics.
     */
    @Override
    protected long countItems(TelemetryBatch<Metric> batch) {
        long n = 0;
        for (ResourceRecords<Metric> rr : batch.resources()) {
            for (ScopeRecords<Metric> sr : rr.scopes()) {
                for (Metric m : sr.records()) {
                    n += m.dataPoints().size();
                }
            }
        }
        return n;
    }
}
