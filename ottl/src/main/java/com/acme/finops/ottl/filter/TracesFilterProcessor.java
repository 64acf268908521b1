package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.contexts.ResourceContext;
import com.acme.finops.ottl.contexts.SpanContext;
import com.acme.finops.ottl.contexts.SpanEventContext;
import com.acme.finops.ottl.expr.BoolExpr;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.ScopeRecords;
import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.pdata.Span;
import com.acme.finops.ottl.pdata.TelemetryBatch;
import com.acme.finops.ottl.telemetry.FilterMetrics;

import java.util.List;

/**
 * Drops resources, spans and span events. A span whose events are all removed is kept.
 */
public final class TracesFilterProcessor extends FilterProcessor<Span> {
    private final BoolExpr<SpanContext> skipSpan;
    private final BoolExpr<SpanEventContext> skipSpanEvent;

    public TracesFilterProcessor(String processorId,
                                 BoolExpr<ResourceContext> skipResource,
                                 BoolExpr<SpanContext> skipSpan,
                                 BoolExpr<SpanEventContext> skipSpanEvent,
                                 FilterMetrics metrics) {
        super(SignalKind.TRACES, processorId, skipResource, metrics);
        this.skipSpan = skipSpan;
        this.skipSpanEvent = skipSpanEvent;
    }

    @Override
    protected boolean hasRecordConditions() {
        return skipSpan != null || skipSpanEvent != null;
    }

    @Override
    protected void filterScope(ExecContext ctx, Resource resource, ScopeRecords<Span> scope,
                               List<EvaluationException> errors) {
        scope.records().removeIf(span -> {
            if (skipSpan != null && skip(skipSpan, ctx, new SpanContext(span, scope.scope(), resource), errors)) {
                return true;
            }
            if (skipSpanEvent != null) {
                span.events().removeIf(event ->
                    skip(skipSpanEvent, ctx, new SpanEventContext(event, span, scope.scope(), resource), errors));
            }
            return false;
        });
    }

    @Override
    protected long countItems(TelemetryBatch<Span> batch) {
        return batch.recordCount();
    }
}
