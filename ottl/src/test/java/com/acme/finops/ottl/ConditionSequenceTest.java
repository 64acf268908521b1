package com.acme.finops.ottl;

import com.acme.finops.ottl.contexts.SpanContext;
import com.acme.finops.ottl.functions.StandardFunctions;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.Span;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionSequenceTest {
    private static final String FAILING = "1 / 0 == 1";

    private final Parser<SpanContext> parser = SpanContext.newParser(StandardFunctions.converters());
    private final Logger logger = Logger.getLogger(ConditionSequence.class.getName());
    private final List<LogRecord> logged = new ArrayList<>();
    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            logged.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void attachHandler() {
        logger.addHandler(capture);
    }

    @AfterEach
    void detachHandler() {
        logger.removeHandler(capture);
    }

    private ConditionSequence<SpanContext> sequence(ErrorMode mode, LogicOperation op, String... conditions)
        throws ConfigException {
        return new ConditionSequence<>(parser.parseConditions(List.of(conditions)), mode, op);
    }

    private static SpanContext span(String name) {
        return new SpanContext(new Span(name), new InstrumentationScope(), new Resource());
    }

    @Test
    void shouldMatchWhenAnyConditionHoldsUnderOr() throws Exception {
        ConditionSequence<SpanContext> seq = sequence(ErrorMode.PROPAGATE, LogicOperation.OR,
            "name == \"a\"", "name == \"b\"");

        assertTrue(seq.eval(ExecContext.background(), span("b")));
        assertFalse(seq.eval(ExecContext.background(), span("c")));
    }

    @Test
    void shouldStopAtFirstMatchUnderOr() throws Exception {
        ConditionSequence<SpanContext> seq = sequence(ErrorMode.PROPAGATE, LogicOperation.OR,
            "name == \"a\"", FAILING);

        assertTrue(seq.eval(ExecContext.background(), span("a")));
    }

    @Test
    void shouldRequireEveryConditionUnderAnd() throws Exception {
        ConditionSequence<SpanContext> seq = sequence(ErrorMode.PROPAGATE, LogicOperation.AND,
            "name != \"\"", "IsMatch(name, \"^a\")");

        assertTrue(seq.eval(ExecContext.background(), span("abc")));
        assertFalse(seq.eval(ExecContext.background(), span("xyz")));
    }

    @Test
    void shouldStopAtFirstMismatchUnderAnd() throws Exception {
        ConditionSequence<SpanContext> seq = sequence(ErrorMode.PROPAGATE, LogicOperation.AND,
            "name == \"a\"", FAILING);

        assertFalse(seq.eval(ExecContext.background(), span("b")));
    }

    @Test
    void shouldEvaluateEmptySequenceToFalse() throws Exception {
        assertFalse(sequence(ErrorMode.PROPAGATE, LogicOperation.OR).eval(ExecContext.background(), span("a")));
        assertFalse(sequence(ErrorMode.PROPAGATE, LogicOperation.AND).eval(ExecContext.background(), span("a")));
    }

    @Test
    void shouldWrapErrorUnderPropagate() throws Exception {
        ConditionSequence<SpanContext> seq = sequence(ErrorMode.PROPAGATE, LogicOperation.OR, FAILING);

        EvaluationException e = assertThrows(EvaluationException.class,
            () -> seq.eval(ExecContext.background(), span("a")));

        assertEquals("failed to eval condition: 1 / 0 == 1, attempted to divide by 0", e.getMessage());
    }

    @Test
    void shouldTreatFailureAsFalseAndLogUnderIgnore() throws Exception {
        ConditionSequence<SpanContext> seq = sequence(ErrorMode.IGNORE, LogicOperation.OR, FAILING, "name == \"a\"");

        assertTrue(seq.eval(ExecContext.background(), span("a")));
        assertFalse(seq.eval(ExecContext.background(), span("b")));
        assertEquals(2, logged.size());
        assertEquals(Level.SEVERE, logged.get(0).getLevel());
        assertTrue(logged.get(0).getMessage().contains("condition=" + FAILING));
    }

    @Test
    void shouldStayQuietUnderSilent() throws Exception {
        ConditionSequence<SpanContext> seq = sequence(ErrorMode.SILENT, LogicOperation.OR, FAILING);

        assertFalse(seq.eval(ExecContext.background(), span("a")));
        assertTrue(logged.isEmpty());
    }

    @Test
    void shouldNotCountErroredConditionsAsMatchesUnderAnd() throws Exception {
        ConditionSequence<SpanContext> allFailing = sequence(ErrorMode.SILENT, LogicOperation.AND, FAILING, FAILING);
        ConditionSequence<SpanContext> oneMatch = sequence(ErrorMode.SILENT, LogicOperation.AND, FAILING, "name == \"a\"");

        assertFalse(allFailing.eval(ExecContext.background(), span("a")));
        assertTrue(oneMatch.eval(ExecContext.background(), span("a")));
    }
}
