package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.contexts.LogContext;
import com.acme.finops.ottl.contexts.ResourceContext;
import com.acme.finops.ottl.expr.BoolExpr;
import com.acme.finops.ottl.pdata.LogRecord;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.ScopeRecords;
import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.pdata.TelemetryBatch;
import com.acme.finops.ottl.telemetry.FilterMetrics;

import java.util.List;

public final class LogsFilterProcessor extends FilterProcessor<LogRecord> {
    private final BoolExpr<LogContext> skipLog;

    public LogsFilterProcessor(String processorId,
                               BoolExpr<ResourceContext> skipResource,
                               BoolExpr<LogContext> skipLog,
                               FilterMetrics metrics) {
        super(SignalKind.LOGS, processorId, skipResource, metrics);
        this.skipLog = skipLog;
    }

    @Override
    protected boolean hasRecordConditions() {
        return skipLog != null;
    }

    @Override
    protected void filterScope(ExecContext ctx, Resource resource, ScopeRecords<LogRecord> scope,
                               List<EvaluationException> errors) {
        scope.records().removeIf(log -> skip(skipLog, ctx, new LogContext(log, scope.scope(), resource), errors));
    }

    @Override
    protected long countItems(TelemetryBatch<LogRecord> batch) {
        return batch.recordCount();
    }
}
