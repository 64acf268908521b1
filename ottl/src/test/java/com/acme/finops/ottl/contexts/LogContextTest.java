package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ErrorMode;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.StatementSequence;
import com.acme.finops.ottl.TypeError;
import com.acme.finops.ottl.functions.StandardFunctions;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.LogRecord;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.SeverityNumber;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogContextTest {
    private final Parser<LogContext> parser = LogContext.newParser(StandardFunctions.all());

    private static LogContext log(Object body) {
        return new LogContext(new LogRecord(body), new InstrumentationScope(), new Resource());
    }

    @Test
    void shouldCompareSeverityAgainstEnum() throws Exception {
        LogContext ctx = log("msg");
        ctx.log().setSeverityNumber(SeverityNumber.DEBUG);

        assertTrue(parser.parseCondition("severity_number < SEVERITY_NUMBER_WARN").eval(ExecContext.background(), ctx));
        ctx.log().setSeverityNumber(SeverityNumber.ERROR);
        assertFalse(parser.parseCondition("severity_number < SEVERITY_NUMBER_WARN").eval(ExecContext.background(), ctx));
    }

    @Test
    void shouldFailToReadUnsetSeverity() {
        LogContext ctx = log("msg");

        assertThrows(TypeError.class, () -> parser.parseCondition("severity_number < SEVERITY_NUMBER_WARN")
            .eval(ExecContext.background(), ctx));
    }

    @Test
    void shouldSetSeverityFromEnum() throws Exception {
        LogContext ctx = log("msg");

        parser.parseStatement("set(severity_number, SEVERITY_NUMBER_INFO)").execute(ExecContext.background(), ctx);

        assertEquals(SeverityNumber.INFO, ctx.log().severityNumber());
    }

    @Test
    void shouldIndexIntoStructuredBody() throws Exception {
        LogContext ctx = log(PMap.of("user", PMap.of("id", 7L)));

        assertEquals(7L, parser.parseValueExpression("body[\"user\"][\"id\"]").eval(ExecContext.background(), ctx));
        parser.parseStatement("set(body[\"user\"][\"name\"], \"ann\")").execute(ExecContext.background(), ctx);

        PMap user = assertInstanceOf(PMap.class, ((PMap) ctx.log().body()).get("user"));
        assertEquals("ann", user.get("name"));
    }

    @Test
    void shouldRenderBodyAsString() throws Exception {
        LogContext ctx = log(12L);

        assertEquals("12", parser.parseValueExpression("body.string").eval(ExecContext.background(), ctx));
    }

    @Test
    void shouldReplaceWholeBody() throws Exception {
        LogContext ctx = log("raw");

        parser.parseStatement("set(body, ParseJSON(\"{\\\"a\\\":1}\"))").execute(ExecContext.background(), ctx);

        assertEquals(PMap.of("a", 1L), ctx.log().body());
    }

    @Test
    void shouldSkipTimeOutsideUnixNanoRangeUnderIgnore() throws Exception {
        LogContext ctx = log("msg");
        ctx.log().setTimeUnixNano(42L);
        StatementSequence<LogContext> seq = new StatementSequence<>(parser.parseStatements(List.of(
            "set(time, Time(\"3000-01-01\", \"%Y-%m-%d\"))",
            "set(attributes[\"after\"], true)")), ErrorMode.IGNORE);

        seq.execute(ExecContext.background(), ctx);

        assertEquals(42L, ctx.log().timeUnixNano());
        assertEquals(true, ctx.log().attributes().get("after"));
    }

    @Test
    void shouldReportTimeOutsideUnixNanoRangeUnderPropagate() throws Exception {
        LogContext ctx = log("msg");
        StatementSequence<LogContext> seq = new StatementSequence<>(parser.parseStatements(List.of(
            "set(observed_time, Time(\"3000-01-01\", \"%Y-%m-%d\"))")), ErrorMode.PROPAGATE);

        EvaluationException e = assertThrows(EvaluationException.class, () -> seq.execute(ExecContext.background(), ctx));

        assertTrue(e.getMessage().contains("out of range for unix nanoseconds"));
    }
}
