package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.functions.StandardFunctions;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.Span;
import com.acme.finops.ottl.pdata.SpanEvent;
import com.acme.finops.ottl.pdata.SpanKind;
import com.acme.finops.ottl.pdata.StatusCode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpanContextTest {
    private final Parser<SpanContext> parser = SpanContext.newParser(StandardFunctions.all());

    private SpanContext ctx() {
        Resource resource = new Resource();
        resource.attributes().put("service.name", "checkout");
        InstrumentationScope scope = new InstrumentationScope("io.acme.http", "2.1.0");
        return new SpanContext(new Span("GET /cart"), scope, resource);
    }

    private void run(SpanContext ctx, String statement) throws Exception {
        parser.parseStatement(statement).execute(ExecContext.background(), ctx);
    }

    private Object eval(SpanContext ctx, String expression) throws Exception {
        return parser.parseValueExpression(expression).eval(ExecContext.background(), ctx);
    }

    @Test
    void shouldReadAndWriteSpanFields() throws Exception {
        SpanContext ctx = ctx();

        run(ctx, "set(name, \"POST /cart\")");
        run(ctx, "set(kind, SPAN_KIND_CLIENT)");
        run(ctx, "set(status.code, STATUS_CODE_ERROR)");
        run(ctx, "set(status.message, \"boom\")");

        assertEquals("POST /cart", ctx.span().name());
        assertEquals(SpanKind.CLIENT, ctx.span().kind());
        assertEquals(StatusCode.ERROR, ctx.span().statusCode());
        assertEquals("boom", ctx.span().statusMessage());
        assertEquals("Client", eval(ctx, "kind.string"));
        assertEquals("SPAN_KIND_CLIENT", eval(ctx, "kind.deprecated_string"));
    }

    @Test
    void shouldIgnoreValuesOfTheWrongKind() throws Exception {
        SpanContext ctx = ctx();

        run(ctx, "set(name, 42)");

        assertEquals("GET /cart", ctx.span().name());
    }

    @Test
    void shouldExposeIdsAsBytesAndHex() throws Exception {
        SpanContext ctx = ctx();

        run(ctx, "set(trace_id.string, \"0102030405060708090a0b0c0d0e0f10\")");

        assertEquals(16, ctx.span().traceId().length);
        assertEquals(16, ctx.span().traceId()[15]);
        assertEquals("0102030405060708090a0b0c0d0e0f10", eval(ctx, "trace_id.string"));
        EvaluationException e = assertThrows(EvaluationException.class, () -> run(ctx, "set(span_id.string, \"ab\")"));
        assertTrue(e.getMessage().contains("must be 8 bytes"));
    }

    @Test
    void shouldViewTimestampsAsTimes() throws Exception {
        SpanContext ctx = ctx();
        ctx.span().setStartTimeUnixNano(1_000_000_001L);

        assertEquals(Instant.ofEpochSecond(1, 1), eval(ctx, "start_time"));
        run(ctx, "set(end_time, start_time + Duration(\"1s\"))");
        assertEquals(2_000_000_001L, ctx.span().endTimeUnixNano());
    }

    @Test
    void shouldReachResourceScopeAndCache() throws Exception {
        SpanContext ctx = ctx();

        run(ctx, "set(cache[\"svc\"], resource.attributes[\"service.name\"])");
        run(ctx, "set(attributes[\"lib\"], Concat([instrumentation_scope.name, scope.version], \"@\"))");

        assertEquals("checkout", ctx.cache().get("svc"));
        assertEquals("io.acme.http@2.1.0", ctx.span().attributes().get("lib"));
    }

    @Test
    void shouldListEventNames() throws Exception {
        SpanContext ctx = ctx();
        ctx.span().events().add(new SpanEvent("retry"));
        ctx.span().events().add(new SpanEvent("timeout"));

        assertEquals(2L, eval(ctx, "Len(events)"));
    }

    @Test
    void shouldRejectUnknownAndMalformedPaths() {
        ConfigException unknown = assertThrows(ConfigException.class, () -> parser.parseCondition("spanname == \"x\""));
        assertTrue(unknown.getMessage().contains("unknown field 'spanname' for context span"));

        assertThrows(ConfigException.class, () -> parser.parseCondition("name[\"x\"] == \"y\""));
        assertThrows(ConfigException.class, () -> parser.parseCondition("status == 1"));
        assertThrows(ConfigException.class, () -> parser.parseCondition("resource.name == \"x\""));
    }
}
