package com.acme.finops.ottl.transform;

import com.acme.finops.ottl.ConditionSequence;
import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.ErrorMode;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.StatementSequence;
import com.acme.finops.ottl.contexts.DataPointContext;
import com.acme.finops.ottl.contexts.LogContext;
import com.acme.finops.ottl.contexts.MetricContext;
import com.acme.finops.ottl.contexts.ProfileContext;
import com.acme.finops.ottl.contexts.ResourceContext;
import com.acme.finops.ottl.contexts.ScopeContext;
import com.acme.finops.ottl.contexts.SpanContext;
import com.acme.finops.ottl.contexts.SpanEventContext;
import com.acme.finops.ottl.functions.StandardFunctions;
import com.acme.finops.ottl.pdata.DataPoint;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.LogRecord;
import com.acme.finops.ottl.pdata.Metric;
import com.acme.finops.ottl.pdata.Profile;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.ResourceRecords;
import com.acme.finops.ottl.pdata.ScopeRecords;
import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.pdata.Span;
import com.acme.finops.ottl.pdata.SpanEvent;
import com.acme.finops.ottl.pdata.TelemetryBatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Applies statement groups to telemetry batches in place.
 *
 * <p>Groups run in configuration order, each over the whole batch at its own context level:
 * once per resource, per scope, per record, or per span event / data point. A group's
 * conditions gate its statements per element.</p>
 */
public final class TransformProcessor {
    private static final Logger LOG = Logger.getLogger(TransformProcessor.class.getName());

    private final List<BatchStep<Span>> traceSteps;
    private final List<BatchStep<LogRecord>> logSteps;
    private final List<BatchStep<Metric>> metricSteps;
    private final List<BatchStep<Profile>> profileSteps;

    private TransformProcessor(List<BatchStep<Span>> traceSteps,
                               List<BatchStep<LogRecord>> logSteps,
                               List<BatchStep<Metric>> metricSteps,
                               List<BatchStep<Profile>> profileSteps) {
        this.traceSteps = List.copyOf(traceSteps);
        this.logSteps = List.copyOf(logSteps);
        this.metricSteps = List.copyOf(metricSteps);
        this.profileSteps = List.copyOf(profileSteps);
    }

    public static TransformProcessor create(TransformConfig config) throws ConfigException {
        Objects.requireNonNull(config, "config");
        Parser<ResourceContext> resourceParser = ResourceContext.newParser(StandardFunctions.all());
        Parser<ScopeContext> scopeParser = ScopeContext.newParser(StandardFunctions.all());
        ErrorMode mode = config.errorMode();

        List<BatchStep<Span>> traces = new ArrayList<>();
        Parser<SpanContext> spanParser = SpanContext.newParser(StandardFunctions.all());
        Parser<SpanEventContext> spanEventParser = SpanEventContext.newParser(StandardFunctions.all());
        for (ContextStatements cs : config.statementsFor(SignalKind.TRACES)) {
            traces.add(switch (cs.context()) {
                case ResourceContext.NAME -> resourceStep(group(resourceParser, cs, mode));
                case ScopeContext.NAME -> scopeStep(group(scopeParser, cs, mode));
                case SpanEventContext.NAME -> {
                    Group<SpanEventContext> g = group(spanEventParser, cs, mode);
                    yield recordStep((ctx, resource, scope, span) -> {
                        for (SpanEvent event : span.events()) {
                            g.run(ctx, new SpanEventContext(event, span, scope, resource));
                        }
                    });
                }
                default -> {
                    Group<SpanContext> g = group(spanParser, cs, mode);
                    yield recordStep((ctx, resource, scope, span) -> g.run(ctx, new SpanContext(span, scope, resource)));
                }
            });
        }

        List<BatchStep<LogRecord>> logs = new ArrayList<>();
        Parser<LogContext> logParser = LogContext.newParser(StandardFunctions.all());
        for (ContextStatements cs : config.statementsFor(SignalKind.LOGS)) {
            logs.add(switch (cs.context()) {
                case ResourceContext.NAME -> resourceStep(group(resourceParser, cs, mode));
                case ScopeContext.NAME -> scopeStep(group(scopeParser, cs, mode));
                default -> {
                    Group<LogContext> g = group(logParser, cs, mode);
                    yield recordStep((ctx, resource, scope, log) -> g.run(ctx, new LogContext(log, scope, resource)));
                }
            });
        }

        List<BatchStep<Metric>> metrics = new ArrayList<>();
        Parser<MetricContext> metricParser = MetricContext.newParser(StandardFunctions.all());
        Parser<DataPointContext> dataPointParser = DataPointContext.newParser(StandardFunctions.all());
        for (ContextStatements cs : config.statementsFor(SignalKind.METRICS)) {
            metrics.add(switch (cs.context()) {
                case ResourceContext.NAME -> resourceStep(group(resourceParser, cs, mode));
                case ScopeContext.NAME -> scopeStep(group(scopeParser, cs, mode));
                case DataPointContext.NAME -> {
                    Group<DataPointContext> g = group(dataPointParser, cs, mode);
                    yield recordStep((ctx, resource, scope, metric) -> {
                        for (DataPoint dp : metric.dataPoints()) {
                            g.run(ctx, new DataPointContext(dp, metric, scope, resource));
                        }
                    });
                }
                default -> {
                    Group<MetricContext> g = group(metricParser, cs, mode);
                    yield recordStep((ctx, resource, scope, metric) -> g.run(ctx, new MetricContext(metric, scope, resource)));
                }
            });
        }

        List<BatchStep<Profile>> profiles = new ArrayList<>();
        Parser<ProfileContext> profileParser = ProfileContext.newParser(StandardFunctions.all());
        for (ContextStatements cs : config.statementsFor(SignalKind.PROFILES)) {
            profiles.add(switch (cs.context()) {
                case ResourceContext.NAME -> resourceStep(group(resourceParser, cs, mode));
                case ScopeContext.NAME -> scopeStep(group(scopeParser, cs, mode));
                default -> {
                    Group<ProfileContext> g = group(profileParser, cs, mode);
                    yield recordStep((ctx, resource, scope, profile) ->
                        g.run(ctx, new ProfileContext(profile, scope, resource)));
                }
            });
        }

        LOG.info("Transform configured errorMode=" + mode.configName()
            + " traceGroups=" + traces.size() + " logGroups=" + logs.size()
            + " metricGroups=" + metrics.size() + " profileGroups=" + profiles.size());
        return new TransformProcessor(traces, logs, metrics, profiles);
    }

    public void processTraces(ExecContext ctx, TelemetryBatch<Span> batch) throws EvaluationException {
        run(traceSteps, ctx, batch);
    }

    public void processLogs(ExecContext ctx, TelemetryBatch<LogRecord> batch) throws EvaluationException {
        run(logSteps, ctx, batch);
    }

    public void processMetrics(ExecContext ctx, TelemetryBatch<Metric> batch) throws EvaluationException {
        run(metricSteps, ctx, batch);
    }

    public void processProfiles(ExecContext ctx, TelemetryBatch<Profile> batch) throws EvaluationException {
        run(profileSteps, ctx, batch);
    }

    private static <T> void run(List<BatchStep<T>> steps, ExecContext ctx, TelemetryBatch<T> batch)
        throws EvaluationException {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(batch, "batch");
        for (BatchStep<T> step : steps) {
            step.apply(ctx, batch);
        }
    }

    private static <K> Group<K> group(Parser<K> parser, ContextStatements cs, ErrorMode fallback) throws ConfigException {
        ErrorMode mode = cs.errorModeOr(fallback);
        ConditionSequence<K> conditions = cs.conditions().isEmpty()
            ? null
            : new ConditionSequence<>(parser.parseConditions(cs.conditions()), mode);
        return new Group<>(conditions, new StatementSequence<>(parser.parseStatements(cs.statements()), mode));
    }

    private static <T> BatchStep<T> resourceStep(Group<ResourceContext> g) {
        return (ctx, batch) -> {
            for (ResourceRecords<T> rr : batch.resources()) {
                g.run(ctx, new ResourceContext(rr.resource()));
            }
        };
    }

    private static <T> BatchStep<T> scopeStep(Group<ScopeContext> g) {
        return (ctx, batch) -> {
            for (ResourceRecords<T> rr : batch.resources()) {
                for (ScopeRecords<T> sr : rr.scopes()) {
                    g.run(ctx, new ScopeContext(sr.scope(), rr.resource()));
                }
            }
        };
    }

    private static <T> BatchStep<T> recordStep(RecordStep<T> step) {
        return (ctx, batch) -> {
            for (ResourceRecords<T> rr : batch.resources()) {
                for (ScopeRecords<T> sr : rr.scopes()) {
                    for (T record : sr.records()) {
                        step.apply(ctx, rr.resource(), sr.scope(), record);
                    }
                }
            }
        };
    }

    @FunctionalInterface
    private interface BatchStep<T> {
        void apply(ExecContext ctx, TelemetryBatch<T> batch) throws EvaluationException;
    }

    @FunctionalInterface
    private interface RecordStep<T> {
        void apply(ExecContext ctx, Resource resource, InstrumentationScope scope, T record) throws EvaluationException;
    }

    private record Group<K>(ConditionSequence<K> conditions, StatementSequence<K> statements) {
        void run(ExecContext ctx, K tCtx) throws EvaluationException {
            if (conditions != null && !conditions.eval(ctx, tCtx)) {
                return;
            }
            statements.execute(ctx, tCtx);
        }
    }
}
