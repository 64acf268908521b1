package com.acme.finops.ottl;

import com.acme.finops.ottl.contexts.LogContext;
import com.acme.finops.ottl.functions.StandardFunctions;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.LogRecord;
import com.acme.finops.ottl.pdata.Resource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatementSequenceTest {
    private final Parser<LogContext> parser = LogContext.newParser(StandardFunctions.all());

    private StatementSequence<LogContext> sequence(ErrorMode mode) throws ConfigException {
        return new StatementSequence<>(parser.parseStatements(List.of(
            "set(attributes[\"first\"], true)",
            "set(attributes[\"parsed\"], ParseJSON(body))",
            "set(attributes[\"last\"], true)")), mode);
    }

    private static LogContext log(Object body) {
        return new LogContext(new LogRecord(body), new InstrumentationScope(), new Resource());
    }

    @Test
    void shouldRunStatementsInOrder() throws Exception {
        LogContext ctx = log("{\"a\":1}");

        sequence(ErrorMode.PROPAGATE).execute(ExecContext.background(), ctx);

        assertEquals(List.of("first", "parsed", "last"), ctx.log().attributes().keys());
    }

    @Test
    void shouldAbortOnFirstErrorUnderPropagate() throws Exception {
        LogContext ctx = log("not json");
        StatementSequence<LogContext> seq = sequence(ErrorMode.PROPAGATE);

        EvaluationException e = assertThrows(EvaluationException.class, () -> seq.execute(ExecContext.background(), ctx));

        assertTrue(e.getMessage().startsWith("failed to execute statement: set(attributes[\"parsed\"], ParseJSON(body)), "));
        assertTrue(ctx.log().attributes().containsKey("first"));
        assertFalse(ctx.log().attributes().containsKey("last"));
    }

    @Test
    void shouldContinueAfterErrorUnderIgnoreAndSilent() throws Exception {
        for (ErrorMode mode : List.of(ErrorMode.IGNORE, ErrorMode.SILENT)) {
            LogContext ctx = log("not json");

            sequence(mode).execute(ExecContext.background(), ctx);

            assertEquals(List.of("first", "last"), ctx.log().attributes().keys());
        }
    }
}
