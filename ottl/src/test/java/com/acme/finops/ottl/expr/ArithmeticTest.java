package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.lang.MathOp;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArithmeticTest {

    @Test
    void shouldKeepIntArithmeticInLongAndWrap() throws Exception {
        assertEquals(7L, Arithmetic.apply(3L, MathOp.ADD, 4L));
        assertEquals(2L, Arithmetic.apply(7L, MathOp.DIV, 3L));
        assertEquals(Long.MIN_VALUE, Arithmetic.apply(Long.MAX_VALUE, MathOp.ADD, 1L));
    }

    @Test
    void shouldPromoteToDoubleWhenEitherSideIsDouble() throws Exception {
        assertEquals(3.5d, Arithmetic.apply(3L, MathOp.ADD, 0.5d));
        assertEquals(1.5d, Arithmetic.apply(3.0d, MathOp.DIV, 2L));
    }

    @Test
    void shouldFailOnDivisionByZero() {
        EvaluationException ints = assertThrows(EvaluationException.class, () -> Arithmetic.apply(1L, MathOp.DIV, 0L));
        EvaluationException doubles = assertThrows(EvaluationException.class,
            () -> Arithmetic.apply(1.0d, MathOp.DIV, 0.0d));

        assertEquals("attempted to divide by 0", ints.getMessage());
        assertEquals("attempted to divide by 0", doubles.getMessage());
    }

    @Test
    void shouldCombineTimesAndDurations() throws Exception {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-01-01T00:01:30Z");

        assertEquals(Duration.ofSeconds(90), Arithmetic.apply(end, MathOp.SUB, start));
        assertEquals(end, Arithmetic.apply(start, MathOp.ADD, Duration.ofSeconds(90)));
        assertEquals(start, Arithmetic.apply(end, MathOp.SUB, Duration.ofSeconds(90)));
        assertEquals(Duration.ofMinutes(3), Arithmetic.apply(Duration.ofMinutes(1), MathOp.ADD, Duration.ofMinutes(2)));
    }

    @Test
    void shouldNameBothTypesWhenUnsupported() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> Arithmetic.apply("a", MathOp.ADD, 1L));

        assertTrue(e.getMessage().startsWith("unsupported math operation: string + int"));
    }

    @Test
    void shouldNegateNumbersAndDurations() throws Exception {
        assertEquals(-3L, Arithmetic.negate(3L));
        assertEquals(-1.5d, Arithmetic.negate(1.5d));
        assertEquals(Duration.ofSeconds(-1), Arithmetic.negate(Duration.ofSeconds(1)));
        assertThrows(EvaluationException.class, () -> Arithmetic.negate("x"));
    }
}
