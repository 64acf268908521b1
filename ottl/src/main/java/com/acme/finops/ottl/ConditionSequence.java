package com.acme.finops.ottl;

import com.acme.finops.ottl.expr.BoolExpr;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates several conditions as one predicate under an {@link ErrorMode}.
 *
 * <p>With {@link LogicOperation#OR} evaluation stops at the first match; with
 * {@link LogicOperation#AND} at the first non-match. A condition that fails under
 * {@code IGNORE} or {@code SILENT} counts as not matching, so an AND over conditions that
 * all failed is false, as is an empty sequence.</p>
 */
public final class ConditionSequence<K> implements BoolExpr<K> {
    private static final Logger LOG = Logger.getLogger(ConditionSequence.class.getName());

    private final List<Condition<K>> conditions;
    private final ErrorMode errorMode;
    private final LogicOperation logicOperation;

    public ConditionSequence(List<Condition<K>> conditions, ErrorMode errorMode) {
        this(conditions, errorMode, LogicOperation.OR);
    }

    public ConditionSequence(List<Condition<K>> conditions, ErrorMode errorMode, LogicOperation logicOperation) {
        this.conditions = List.copyOf(conditions);
        this.errorMode = Objects.requireNonNull(errorMode, "errorMode");
        this.logicOperation = Objects.requireNonNull(logicOperation, "logicOperation");
    }

    @Override
    public boolean eval(ExecContext ctx, K tCtx) throws EvaluationException {
        boolean atLeastOneMatch = false;
        for (Condition<K> condition : conditions) {
            boolean match;
            try {
                match = condition.eval(ctx, tCtx);
            } catch (EvaluationException e) {
                if (errorMode == ErrorMode.PROPAGATE) {
                    throw new EvaluationException("failed to eval condition: " + condition.source()
                        + ", " + e.getMessage(), e);
                }
                if (errorMode == ErrorMode.IGNORE) {
                    LOG.log(Level.SEVERE, "failed to eval condition, treating as false requestId="
                        + ctx.requestId() + " condition=" + condition.source(), e);
                }
                continue;
            }
            if (match) {
                if (logicOperation == LogicOperation.OR) {
                    return true;
                }
                atLeastOneMatch = true;
            } else if (logicOperation == LogicOperation.AND) {
                return false;
            }
        }
        return logicOperation == LogicOperation.AND && atLeastOneMatch;
    }

    public List<Condition<K>> conditions() {
        return conditions;
    }

    public ErrorMode errorMode() {
        return errorMode;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }
}
