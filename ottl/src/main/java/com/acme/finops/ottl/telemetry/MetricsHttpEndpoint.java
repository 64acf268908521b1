package com.acme.finops.ottl.telemetry;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.util.OttlDefaults;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Prometheus text endpoint for the filter counters.
 */
public final class MetricsHttpEndpoint implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(MetricsHttpEndpoint.class.getName());

    static final String DROPPED_METRIC = "ottl_filter_dropped_records_total";
    static final String ERRORS_METRIC = "ottl_filter_evaluation_errors_total";

    private final AtomicFilterMetrics metrics;
    private final String path;
    private final HttpServer server;
    private final ExecutorService executor;

    public MetricsHttpEndpoint(AtomicFilterMetrics metrics, int port, String path) throws IOException {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.path = normalizePath(path);
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.server.createContext(this.path, this::handle);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ottl-metrics-http-endpoint");
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOG.info("Metrics endpoint started on :" + port() + path);
    }

    /**
     * Bound port; differs from the requested one when 0 was passed.
     */
    public int port() {
        return server.getAddress().getPort();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, OttlDefaults.HTTP_METHOD_NOT_ALLOWED, "method not allowed\n");
                return;
            }
            write(exchange, OttlDefaults.HTTP_OK, renderPrometheus(metrics.snapshot()));
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Metrics endpoint failure", e);
            write(exchange, OttlDefaults.HTTP_INTERNAL_ERROR, "internal error\n");
        }
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return OttlDefaults.DEFAULT_METRICS_HTTP_PATH;
        }
        return rawPath.startsWith("/") ? rawPath : "/" + rawPath;
    }

    static String renderPrometheus(AtomicFilterMetrics.Snapshot snapshot) {
        StringBuilder sb = new StringBuilder(OttlDefaults.DEFAULT_METRICS_RENDER_BUFFER);

        appendHelpType(sb, DROPPED_METRIC, "Records removed by the filter processor", "counter");
        for (Map.Entry<SignalKind, Long> e : snapshot.droppedBySignal().entrySet()) {
            appendMetric(sb, DROPPED_METRIC, labels(e.getKey(), snapshot.processorId()), e.getValue());
        }

        appendHelpType(sb, ERRORS_METRIC, "Condition evaluation errors surfaced by the filter processor", "counter");
        for (Map.Entry<SignalKind, Long> e : snapshot.evaluationErrorsBySignal().entrySet()) {
            appendMetric(sb, ERRORS_METRIC, labels(e.getKey(), snapshot.processorId()), e.getValue());
        }
        return sb.toString();
    }

    private static Map<String, String> labels(SignalKind signal, String processorId) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("signal", signal.label());
        labels.put("processor", processorId);
        return labels;
    }

    private static void appendHelpType(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static void appendMetric(StringBuilder sb, String name, Map<String, String> labels, long value) {
        sb.append(name);
        if (!labels.isEmpty()) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, String> e : labels.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(e.getKey()).append("=\"").append(escapeLabelValue(e.getValue())).append('"');
            }
            sb.append('}');
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabelValue(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
