package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.lang.CompareOp;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.PSlice;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Comparison semantics. Never fails: comparing unrelated kinds is simply not equal.
 */
public final class Comparisons {
    private Comparisons() {
    }

    public static boolean compare(Object a, Object b, CompareOp op) {
        if (a == null && b == null) {
            return op == CompareOp.EQ || op == CompareOp.LTE || op == CompareOp.GTE;
        }
        if (a == null || b == null) {
            return op == CompareOp.NE;
        }
        if (a instanceof Long x && b instanceof Long y) {
            return ordered(Long.compare(x, y), op);
        }
        if ((a instanceof Long || a instanceof Double) && (b instanceof Long || b instanceof Double)) {
            double x = ((Number) a).doubleValue();
            double y = ((Number) b).doubleValue();
            if (Double.isNaN(x) || Double.isNaN(y)) {
                return op == CompareOp.NE;
            }
            return ordered(x < y ? -1 : (x > y ? 1 : 0), op);
        }
        if (a instanceof String x && b instanceof String y) {
            return ordered(x.compareTo(y), op);
        }
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return equalityOnly(x.equals(y), op);
        }
        if (a instanceof byte[] x && b instanceof byte[] y) {
            return ordered(Arrays.compareUnsigned(x, y), op);
        }
        if (a instanceof Instant x && b instanceof Instant y) {
            return ordered(x.compareTo(y), op);
        }
        if (a instanceof Duration x && b instanceof Duration y) {
            return ordered(x.compareTo(y), op);
        }
        if ((a instanceof PMap && b instanceof PMap) || (a instanceof PSlice && b instanceof PSlice)) {
            return equalityOnly(a.equals(b), op);
        }
        return op == CompareOp.NE;
    }

    private static boolean ordered(int cmp, CompareOp op) {
        return switch (op) {
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
            case LT -> cmp < 0;
            case LTE -> cmp <= 0;
            case GT -> cmp > 0;
            case GTE -> cmp >= 0;
        };
    }

    private static boolean equalityOnly(boolean equal, CompareOp op) {
        return switch (op) {
            case EQ -> equal;
            case NE -> !equal;
            default -> false;
        };
    }
}
