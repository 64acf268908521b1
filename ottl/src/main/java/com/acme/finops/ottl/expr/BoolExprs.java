package com.acme.finops.ottl.expr;

import java.util.List;

/**
 * Combinators over {@link BoolExpr}. Both {@link #or(List)} and {@link #and(List)} short-circuit.
 */
public final class BoolExprs {
    private BoolExprs() {
    }

    public static <K> BoolExpr<K> alwaysTrue() {
        return (ctx, tCtx) -> true;
    }

    public static <K> BoolExpr<K> alwaysFalse() {
        return (ctx, tCtx) -> false;
    }

    public static <K> BoolExpr<K> not(BoolExpr<K> expr) {
        return (ctx, tCtx) -> !expr.eval(ctx, tCtx);
    }

    public static <K> BoolExpr<K> or(List<BoolExpr<K>> exprs) {
        List<BoolExpr<K>> all = List.copyOf(exprs);
        if (all.size() == 1) {
            return all.get(0);
        }
        return (ctx, tCtx) -> {
            for (BoolExpr<K> e : all) {
                if (e.eval(ctx, tCtx)) {
                    return true;
                }
            }
            return false;
        };
    }

    public static <K> BoolExpr<K> and(List<BoolExpr<K>> exprs) {
        List<BoolExpr<K>> all = List.copyOf(exprs);
        if (all.size() == 1) {
            return all.get(0);
        }
        return (ctx, tCtx) -> {
            for (BoolExpr<K> e : all) {
                if (!e.eval(ctx, tCtx)) {
                    return false;
                }
            }
            return true;
        };
    }
}
