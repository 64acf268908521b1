package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.telemetry.AtomicFilterMetrics;
import com.acme.finops.ottl.telemetry.FilterMetrics;
import com.acme.finops.ottl.telemetry.MetricsHttpEndpoint;
import com.acme.finops.ottl.telemetry.NoopFilterMetrics;
import com.acme.finops.ottl.telemetry.PeriodicMetricsReporter;
import com.acme.finops.ottl.util.EnvVars;
import com.acme.finops.ottl.util.OttlDefaults;
import com.acme.finops.ottl.util.OttlEnvKeys;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Filter processors plus their metrics side channel, wired from environment variables.
 *
 * <p>{@code OTTL_METRICS_ENABLED} switches between {@link AtomicFilterMetrics} and
 * {@link NoopFilterMetrics}. With metrics on, {@code OTTL_METRICS_HTTP_ENABLED} starts the
 * Prometheus endpoint and a positive {@code OTTL_METRICS_LOG_INTERVAL_SEC} the periodic
 * reporter.</p>
 */
public final class FilterRuntime implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(FilterRuntime.class.getName());

    private final FilterProcessors processors;
    private final FilterMetrics metrics;
    private final MetricsHttpEndpoint endpoint;
    private final PeriodicMetricsReporter reporter;

    private FilterRuntime(FilterProcessors processors, FilterMetrics metrics,
                          MetricsHttpEndpoint endpoint, PeriodicMetricsReporter reporter) {
        this.processors = processors;
        this.metrics = metrics;
        this.endpoint = endpoint;
        this.reporter = reporter;
    }

    public static FilterRuntime fromEnvironment() throws ConfigException {
        return fromEnvironment(System.getenv());
    }

    public static FilterRuntime fromEnvironment(Map<String, String> env) throws ConfigException {
        Objects.requireNonNull(env, "env");
        String processorId = EnvVars.getOrDefault(env, OttlEnvKeys.OTTL_PROCESSOR_ID, OttlDefaults.DEFAULT_PROCESSOR_ID);
        FilterConfig config = FilterProcessorFactory.loadConfig(env);

        boolean metricsEnabled = EnvVars.getBoolean(env, OttlEnvKeys.OTTL_METRICS_ENABLED, false);
        AtomicFilterMetrics atomic = metricsEnabled ? new AtomicFilterMetrics(processorId) : null;
        FilterMetrics metrics = atomic != null ? atomic : NoopFilterMetrics.INSTANCE;

        FilterProcessors processors = new FilterProcessorFactory(processorId, metrics).create(config);

        MetricsHttpEndpoint endpoint = null;
        PeriodicMetricsReporter reporter = null;
        if (atomic != null) {
            if (EnvVars.getBoolean(env, OttlEnvKeys.OTTL_METRICS_HTTP_ENABLED, false)) {
                int port = EnvVars.getIntClamped(env, OttlEnvKeys.OTTL_METRICS_HTTP_PORT,
                    OttlDefaults.DEFAULT_METRICS_HTTP_PORT, 0, 65_535);
                String path = EnvVars.getOrDefault(env, OttlEnvKeys.OTTL_METRICS_HTTP_PATH,
                    OttlDefaults.DEFAULT_METRICS_HTTP_PATH);
                try {
                    endpoint = new MetricsHttpEndpoint(atomic, port, path);
                } catch (IOException e) {
                    throw new UncheckedIOException("unable to bind metrics endpoint on port " + port, e);
                }
                endpoint.start();
            }
            long interval = EnvVars.getLongClamped(env, OttlEnvKeys.OTTL_METRICS_LOG_INTERVAL_SEC,
                OttlDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 0L, OttlDefaults.MAX_METRICS_LOG_INTERVAL_SEC);
            if (interval > 0) {
                reporter = new PeriodicMetricsReporter(atomic, interval);
                reporter.start();
            }
        }
        LOG.info("Filter runtime ready processor=" + processorId + " metrics=" + metricsEnabled
            + " endpoint=" + (endpoint != null) + " reporter=" + (reporter != null));
        return new FilterRuntime(processors, metrics, endpoint, reporter);
    }

    public FilterProcessors processors() {
        return processors;
    }

    public FilterMetrics metrics() {
        return metrics;
    }

    /**
     * Bound port of the metrics endpoint, or -1 when it is not running.
     */
    public int metricsPort() {
        return endpoint == null ? -1 : endpoint.port();
    }

    @Override
    public void close() {
        if (reporter != null) {
            reporter.close();
        }
        if (endpoint != null) {
            endpoint.close();
        }
    }
}
