package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.contexts.ProfileContext;
import com.acme.finops.ottl.contexts.ResourceContext;
import com.acme.finops.ottl.expr.BoolExpr;
import com.acme.finops.ottl.pdata.Profile;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.ScopeRecords;
import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.pdata.TelemetryBatch;
import com.acme.finops.ottl.telemetry.FilterMetrics;

import java.util.List;

public final class ProfilesFilterProcessor extends FilterProcessor<Profile> {
    private final BoolExpr<ProfileContext> skipProfile;

    public ProfilesFilterProcessor(String processorId,
                                   BoolExpr<ResourceContext> skipResource,
                                   BoolExpr<ProfileContext> skipProfile,
                                   FilterMetrics metrics) {
        super(SignalKind.PROFILES, processorId, skipResource, metrics);
        this.skipProfile = skipProfile;
    }

    @Override
    protected boolean hasRecordConditions() {
        return skipProfile != null;
    }

    @Override
    protected void filterScope(ExecContext ctx, Resource resource, ScopeRecords<Profile> scope,
                               List<EvaluationException> errors) {
        scope.records().removeIf(profile ->
            skip(skipProfile, ctx, new ProfileContext(profile, scope.scope(), resource), errors));
    }

    @Override
    protected long countItems(TelemetryBatch<Profile> batch) {
        return batch.recordCount();
    }
}
