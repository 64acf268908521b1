package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.LogRecord;
import com.acme.finops.ottl.pdata.Metric;
import com.acme.finops.ottl.pdata.MetricType;
import com.acme.finops.ottl.pdata.NumberDataPoint;
import com.acme.finops.ottl.pdata.Profile;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.ScopeRecords;
import com.acme.finops.ottl.pdata.SeverityNumber;
import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.pdata.Span;
import com.acme.finops.ottl.pdata.SpanEvent;
import com.acme.finops.ottl.pdata.TelemetryBatch;
import com.acme.finops.ottl.telemetry.AtomicFilterMetrics;
import com.acme.finops.ottl.telemetry.NoopFilterMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilterProcessorTest {
    private static final ExecContext CTX = ExecContext.background();

    private static FilterProcessors processors(String json) throws Exception {
        return new FilterProcessorFactory("test", NoopFilterMetrics.INSTANCE).create(FilterConfig.parse(json));
    }

    private static Resource resource(String service) {
        Resource r = new Resource();
        r.attributes().put("service.name", service);
        return r;
    }

    private static Span span(String name, String route) {
        Span s = new Span(name);
        s.attributes().put("http.route", route);
        return s;
    }

    private static LogRecord log(String body, SeverityNumber severity) {
        LogRecord r = new LogRecord(body);
        r.setSeverityNumber(severity);
        return r;
    }

    private static TelemetryBatch<LogRecord> logs(LogRecord... records) {
        TelemetryBatch<LogRecord> batch = TelemetryBatch.logs();
        ScopeRecords<LogRecord> scope = batch.addResource(resource("checkout")).addScope(new InstrumentationScope());
        scope.records().addAll(List.of(records));
        return batch;
    }

    @Test
    void shouldDropMatchingSpansAndKeepOrder() throws Exception {
        FilterProcessors p = processors("{\"traces\": {\"span\": [\"attributes[\\\"http.route\\\"] == \\\"/healthz\\\"\"]}}");
        TelemetryBatch<Span> batch = TelemetryBatch.traces();
        ScopeRecords<Span> scope = batch.addResource(resource("checkout")).addScope(new InstrumentationScope());
        scope.records().addAll(List.of(span("a", "/cart"), span("b", "/healthz"), span("c", "/pay")));

        FilterResult<Span> result = p.traces().process(CTX, batch);

        FilterResult.Forwarded<Span> forwarded = assertInstanceOf(FilterResult.Forwarded.class, result);
        assertEquals(1L, forwarded.dropped());
        List<Span> kept = forwarded.batch().resources().get(0).scopes().get(0).records();
        assertEquals(List.of("a", "c"), kept.stream().map(Span::name).toList());
    }

    @Test
    void shouldDropWholeResourceAndEmptyContainers() throws Exception {
        FilterProcessors p = processors("""
            {"traces": {
              "resource": ["attributes[\\"service.name\\"] == \\"noisy\\""],
              "span": ["name == \\"ping\\""]
            }}
            """);
        TelemetryBatch<Span> batch = TelemetryBatch.traces();
        batch.addResource(resource("noisy")).addScope(new InstrumentationScope()).records().add(span("x", "/"));
        ScopeRecords<Span> pingOnly = batch.addResource(resource("api")).addScope(new InstrumentationScope("ping", ""));
        pingOnly.records().add(span("ping", "/"));
        batch.addResource(resource("web")).addScope(new InstrumentationScope()).records().add(span("GET", "/"));

        FilterResult<Span> result = p.traces().process(CTX, batch);

        assertEquals(2L, result.dropped());
        assertEquals(1, batch.resources().size());
        assertEquals("web", batch.resources().get(0).resource().attributes().get("service.name"));
    }

    @Test
    void shouldDropSpanEventsWithoutDroppingSpan() throws Exception {
        FilterProcessors p = processors("{\"traces\": {\"spanevent\": [\"name == \\\"debug\\\" and span.name == \\\"a\\\"\"]}}");
        Span a = span("a", "/");
        a.events().add(new SpanEvent("debug"));
        a.events().add(new SpanEvent("exception"));
        Span b = span("b", "/");
        b.events().add(new SpanEvent("debug"));
        TelemetryBatch<Span> batch = TelemetryBatch.traces();
        batch.addResource(resource("svc")).addScope(new InstrumentationScope()).records().addAll(List.of(a, b));

        FilterResult<Span> result = p.traces().process(CTX, batch);

        assertEquals(0L, result.dropped());
        assertEquals(1, a.events().size());
        assertEquals("exception", a.events().get(0).name());
        assertEquals(1, b.events().size());
    }

    @Test
    void shouldKeepLogWithUnsetSeverityUnderIgnore() throws Exception {
        FilterProcessors p = processors("""
            {"error_mode": "ignore", "logs": {"log": ["severity_number < SEVERITY_NUMBER_WARN"]}}
            """);
        LogRecord unset = new LogRecord("no severity");
        TelemetryBatch<LogRecord> batch = logs(log("debug", SeverityNumber.DEBUG), unset, log("boom", SeverityNumber.ERROR));

        FilterResult<LogRecord> result = p.logs().process(CTX, batch);

        FilterResult.Forwarded<LogRecord> forwarded = assertInstanceOf(FilterResult.Forwarded.class, result);
        assertEquals(1L, forwarded.dropped());
        List<LogRecord> kept = batch.resources().get(0).scopes().get(0).records();
        assertEquals(2, kept.size());
        assertSame(unset, kept.get(0));
    }

    @Test
    void shouldReportFailureUnderPropagateAndKeepRecord() throws Exception {
        FilterProcessors p = processors("{\"logs\": {\"log\": [\"severity_number < SEVERITY_NUMBER_WARN\"]}}");
        LogRecord unset = new LogRecord("no severity");
        TelemetryBatch<LogRecord> batch = logs(log("debug", SeverityNumber.DEBUG), unset);

        FilterResult<LogRecord> result = p.logs().process(CTX, batch);

        FilterResult.Failed<LogRecord> failed = assertInstanceOf(FilterResult.Failed.class, result);
        assertEquals(1, failed.errors().size());
        assertTrue(failed.errors().get(0).getMessage().startsWith("failed to eval condition: severity_number < SEVERITY_NUMBER_WARN"));
        assertEquals(1L, failed.dropped());
        assertEquals(List.of(unset), failed.batch().resources().get(0).scopes().get(0).records());
    }

    @Test
    void shouldReturnNothingToForwardWhenEverythingIsDropped() throws Exception {
        FilterProcessors p = processors("{\"logs\": {\"log\": [\"IsMatch(body, \\\"^debug\\\")\"]}}");
        TelemetryBatch<LogRecord> batch = logs(log("debug 1", SeverityNumber.DEBUG), log("debug 2", SeverityNumber.DEBUG));

        FilterResult<LogRecord> result = p.logs().process(CTX, batch);

        FilterResult.NothingToForward<LogRecord> nothing = assertInstanceOf(FilterResult.NothingToForward.class, result);
        assertEquals(2L, nothing.dropped());
        assertTrue(batch.isEmpty());
    }

    @Test
    void shouldBeIdempotent() throws Exception {
        FilterProcessors p = processors("{\"logs\": {\"log\": [\"body == \\\"drop\\\"\"]}}");
        TelemetryBatch<LogRecord> batch = logs(log("keep", SeverityNumber.INFO), log("drop", SeverityNumber.INFO));

        assertEquals(1L, p.logs().process(CTX, batch).dropped());
        FilterResult<LogRecord> second = p.logs().process(CTX, batch);

        assertEquals(0L, second.dropped());
        assertEquals(1, batch.recordCount());
    }

    @Test
    void shouldOrGroupsTogether() throws Exception {
        FilterProcessors p = processors("""
            {"log_conditions": [
              {"conditions": ["body == \\"a\\""]},
              {"conditions": ["body == \\"b\\""]}
            ]}
            """);
        TelemetryBatch<LogRecord> batch = logs(log("a", null), log("b", null), log("c", null));

        assertEquals(2L, p.logs().process(CTX, batch).dropped());
    }

    @Test
    void shouldDropDataPointsAndEmptiedMetrics() throws Exception {
        AtomicFilterMetrics metrics = new AtomicFilterMetrics("edge");
        FilterProcessors p = new FilterProcessorFactory("edge", metrics).create(FilterConfig.parse("""
            {"metrics": {
              "metric": ["name == \\"internal\\""],
              "datapoint": ["value_int == 0"]
            }}
            """));
        Metric requests = new Metric("requests", MetricType.SUM);
        requests.dataPoints().add(NumberDataPoint.ofInt(0L));
        requests.dataPoints().add(NumberDataPoint.ofInt(5L));
        Metric zeros = new Metric("zeros", MetricType.GAUGE);
        zeros.dataPoints().add(NumberDataPoint.ofInt(0L));
        Metric internal = new Metric("internal", MetricType.GAUGE);
        internal.dataPoints().add(NumberDataPoint.ofInt(1L));
        internal.dataPoints().add(NumberDataPoint.ofInt(2L));
        Metric empty = new Metric("empty", MetricType.EMPTY);
        TelemetryBatch<Metric> batch = TelemetryBatch.metrics();
        batch.addResource(resource("svc")).addScope(new InstrumentationScope()).records()
            .addAll(List.of(requests, zeros, internal, empty));

        FilterResult<Metric> result = p.metrics().process(CTX, batch);

        assertEquals(4L, result.dropped());
        List<Metric> kept = batch.resources().get(0).scopes().get(0).records();
        assertEquals(List.of("requests", "empty"), kept.stream().map(Metric::name).toList());
        assertEquals(1, requests.dataPoints().size());
        assertEquals(4L, metrics.snapshot().droppedBySignal().get(SignalKind.METRICS));
    }

    @Test
    void shouldDropProfiles() throws Exception {
        FilterProcessors p = processors("{\"profiles\": {\"profile\": [\"attributes[\\\"sampled\\\"] == false\"]}}");
        Profile sampled = new Profile();
        sampled.attributes().put("sampled", true);
        Profile unsampled = new Profile();
        unsampled.attributes().put("sampled", false);
        TelemetryBatch<Profile> batch = TelemetryBatch.profiles();
        batch.addResource(resource("svc")).addScope(new InstrumentationScope()).records().addAll(List.of(sampled, unsampled));

        assertEquals(1L, p.profiles().process(CTX, batch).dropped());
        assertEquals(List.of(sampled), batch.resources().get(0).scopes().get(0).records());
    }

    @Test
    void shouldPassThroughWithoutConditions() throws Exception {
        FilterProcessors p = processors("{}");
        TelemetryBatch<LogRecord> batch = logs(log("x", null));

        assertTrue(p.logs().isNoop());
        FilterResult.Forwarded<LogRecord> forwarded = assertInstanceOf(FilterResult.Forwarded.class, p.logs().process(CTX, batch));
        assertSame(batch, forwarded.batch());
    }

    @Test
    void shouldRejectBatchOfOtherSignal() throws Exception {
        FilterProcessors p = processors("{}");

        assertThrows(IllegalArgumentException.class, () -> p.traces().process(CTX, (TelemetryBatch) TelemetryBatch.logs()));
    }

    @Test
    void shouldRejectEditorsInConditions() {
        assertThrows(ConfigException.class, () -> processors("{\"logs\": {\"log\": [\"set(body, \\\"x\\\")\"]}}"));
    }

    @Test
    void shouldCountEvaluationErrors() throws Exception {
        AtomicFilterMetrics metrics = new AtomicFilterMetrics("edge");
        FilterProcessors p = new FilterProcessorFactory("edge", metrics)
            .create(FilterConfig.parse("{\"logs\": {\"log\": [\"severity_number < SEVERITY_NUMBER_WARN\"]}}"));

        p.logs().process(CTX, logs(new LogRecord("a"), new LogRecord("b")));

        assertEquals(2L, metrics.snapshot().evaluationErrorsBySignal().get(SignalKind.LOGS));
    }
}
