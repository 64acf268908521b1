package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.lang.MathOp;
import com.acme.finops.ottl.pdata.Values;

import java.time.Duration;
import java.time.Instant;

/**
 * Binary math over engine values.
 *
 * <ul>
 *   <li>int with int stays int and wraps on overflow</li>
 *   <li>any double operand makes the result double</li>
 *   <li>time - time is a duration, time ± duration a time, duration ± duration a duration</li>
 * </ul>
 */
public final class Arithmetic {
    private Arithmetic() {
    }

    public static Object apply(Object left, MathOp op, Object right) throws EvaluationException {
        if (left instanceof Long l && right instanceof Long r) {
            return longOp(l, op, r);
        }
        if (isNumber(left) && isNumber(right)) {
            return doubleOp(((Number) left).doubleValue(), op, ((Number) right).doubleValue());
        }
        if (left instanceof Instant t) {
            if (right instanceof Instant other && op == MathOp.SUB) {
                return Duration.between(other, t);
            }
            if (right instanceof Duration d) {
                if (op == MathOp.ADD) return t.plus(d);
                if (op == MathOp.SUB) return t.minus(d);
            }
        }
        if (left instanceof Duration d && right instanceof Duration other) {
            if (op == MathOp.ADD) return d.plus(other);
            if (op == MathOp.SUB) return d.minus(other);
        }
        throw unsupported(left, op, right);
    }

    public static Object negate(Object value) throws EvaluationException {
        if (value instanceof Long l) return -l;
        if (value instanceof Double d) return -d;
        if (value instanceof Duration d) return d.negated();
        throw new EvaluationException("unsupported type for negation: " + Values.typeName(value));
    }

    private static long longOp(long l, MathOp op, long r) throws EvaluationException {
        return switch (op) {
            case ADD -> l + r;
            case SUB -> l - r;
            case MUL -> l * r;
            case DIV -> {
                if (r == 0L) {
                    throw new EvaluationException("attempted to divide by 0");
                }
                yield l / r;
            }
        };
    }

    private static double doubleOp(double l, MathOp op, double r) throws EvaluationException {
        return switch (op) {
            case ADD -> l + r;
            case SUB -> l - r;
            case MUL -> l * r;
            case DIV -> {
                if (r == 0d) {
                    throw new EvaluationException("attempted to divide by 0");
                }
                yield l / r;
            }
        };
    }

    private static boolean isNumber(Object v) {
        return v instanceof Long || v instanceof Double;
    }

    private static EvaluationException unsupported(Object left, MathOp op, Object right) {
        return new EvaluationException("unsupported math operation: " + Values.typeName(left)
            + " " + op.symbol() + " " + Values.typeName(right));
    }
}
