package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.ConditionSequence;
import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.ErrorMode;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.contexts.DataPointContext;
import com.acme.finops.ottl.contexts.LogContext;
import com.acme.finops.ottl.contexts.MetricContext;
import com.acme.finops.ottl.contexts.ProfileContext;
import com.acme.finops.ottl.contexts.ResourceContext;
import com.acme.finops.ottl.contexts.SpanContext;
import com.acme.finops.ottl.contexts.SpanEventContext;
import com.acme.finops.ottl.expr.BoolExpr;
import com.acme.finops.ottl.expr.BoolExprs;
import com.acme.finops.ottl.functions.StandardFunctions;
import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.telemetry.FilterMetrics;
import com.acme.finops.ottl.util.EnvVars;
import com.acme.finops.ottl.util.OttlEnvKeys;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Compiles a {@link FilterConfig} into per-signal processors using the standard converters.
 */
public final class FilterProcessorFactory {
    private static final Logger LOG = Logger.getLogger(FilterProcessorFactory.class.getName());

    private final String processorId;
    private final FilterMetrics metrics;

    private final Parser<ResourceContext> resourceParser = ResourceContext.newParser(StandardFunctions.converters());
    private final Parser<SpanContext> spanParser = SpanContext.newParser(StandardFunctions.converters());
    private final Parser<SpanEventContext> spanEventParser = SpanEventContext.newParser(StandardFunctions.converters());
    private final Parser<LogContext> logParser = LogContext.newParser(StandardFunctions.converters());
    private final Parser<MetricContext> metricParser = MetricContext.newParser(StandardFunctions.converters());
    private final Parser<DataPointContext> dataPointParser = DataPointContext.newParser(StandardFunctions.converters());
    private final Parser<ProfileContext> profileParser = ProfileContext.newParser(StandardFunctions.converters());

    public FilterProcessorFactory(String processorId, FilterMetrics metrics) {
        this.processorId = Objects.requireNonNull(processorId, "processorId");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public FilterProcessors create(FilterConfig config) throws ConfigException {
        return new FilterProcessors(createTraces(config), createLogs(config), createMetrics(config), createProfiles(config));
    }

    public TracesFilterProcessor createTraces(FilterConfig config) throws ConfigException {
        SignalKind signal = SignalKind.TRACES;
        TracesFilterProcessor p = new TracesFilterProcessor(processorId,
            compile(resourceParser, config, signal),
            compile(spanParser, config, signal),
            compile(spanEventParser, config, signal),
            metrics);
        logConfigured(config, signal);
        return p;
    }

    public LogsFilterProcessor createLogs(FilterConfig config) throws ConfigException {
        SignalKind signal = SignalKind.LOGS;
        LogsFilterProcessor p = new LogsFilterProcessor(processorId,
            compile(resourceParser, config, signal),
            compile(logParser, config, signal),
            metrics);
        logConfigured(config, signal);
        return p;
    }

    public MetricsFilterProcessor createMetrics(FilterConfig config) throws ConfigException {
        SignalKind signal = SignalKind.METRICS;
        MetricsFilterProcessor p = new MetricsFilterProcessor(processorId,
            compile(resourceParser, config, signal),
            compile(metricParser, config, signal),
            compile(dataPointParser, config, signal),
            metrics);
        logConfigured(config, signal);
        return p;
    }

    public ProfilesFilterProcessor createProfiles(FilterConfig config) throws ConfigException {
        SignalKind signal = SignalKind.PROFILES;
        ProfilesFilterProcessor p = new ProfilesFilterProcessor(processorId,
            compile(resourceParser, config, signal),
            compile(profileParser, config, signal),
            metrics);
        logConfigured(config, signal);
        return p;
    }

    /**
     * One {@link ConditionSequence} per configured group of the parser's context, OR-ed
     * together. {@code null} when the context has no conditions.
     */
    private static <K> BoolExpr<K> compile(Parser<K> parser, FilterConfig config, SignalKind signal)
        throws ConfigException {
        List<ContextConditions> groups = config.conditionsFor(signal, parser.contextName());
        if (groups.isEmpty()) {
            return null;
        }
        List<BoolExpr<K>> sequences = new ArrayList<>(groups.size());
        for (ContextConditions group : groups) {
            ErrorMode mode = group.errorModeOr(config.errorMode());
            sequences.add(new ConditionSequence<>(parser.parseConditions(group.conditions()), mode));
        }
        return BoolExprs.or(sequences);
    }

    private void logConfigured(FilterConfig config, SignalKind signal) {
        List<ContextConditions> groups = config.conditionsFor(signal);
        if (groups.isEmpty()) {
            return;
        }
        StringBuilder contexts = new StringBuilder();
        for (ContextConditions cc : groups) {
            if (contexts.length() > 0) {
                contexts.append(',');
            }
            contexts.append(cc.context()).append('=').append(cc.conditions().size());
        }
        LOG.info("Filter configured processor=" + processorId + " signal=" + signal.label()
            + " errorMode=" + config.errorMode().configName() + " conditions=[" + contexts + "]");
    }

    /**
     * Reads the configuration file named by {@code OTTL_FILTER_CONFIG_FILE} and applies the
     * {@code OTTL_FILTER_ERROR_MODE} override. Without a file the configuration is empty and
     * every processor passes batches through.
     */
    public static FilterConfig loadConfig(Map<String, String> env) throws ConfigException {
        Objects.requireNonNull(env, "env");
        Optional<Path> file = EnvVars.getPath(env, OttlEnvKeys.OTTL_FILTER_CONFIG_FILE);
        FilterConfig config;
        if (file.isPresent()) {
            String raw;
            try {
                raw = Files.readString(file.get(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ConfigException("unable to read filter configuration " + file.get() + ": " + e.getMessage(), e);
            }
            config = FilterConfig.parse(raw);
        } else {
            config = new FilterConfig(ErrorMode.PROPAGATE, Map.of());
        }
        String override = EnvVars.getOrDefault(env, OttlEnvKeys.OTTL_FILTER_ERROR_MODE, "");
        if (!override.isEmpty()) {
            try {
                config = config.withErrorMode(ErrorMode.parse(override));
            } catch (IllegalArgumentException e) {
                throw new ConfigException(OttlEnvKeys.OTTL_FILTER_ERROR_MODE + ": " + e.getMessage(), e);
            }
        }
        return config;
    }
}
