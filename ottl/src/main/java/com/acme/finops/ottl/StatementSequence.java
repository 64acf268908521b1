package com.acme.finops.ottl;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs statements in order. There is no transaction across statements: under
 * {@link ErrorMode#PROPAGATE} the first failure stops the sequence, and the effects of
 * the statements before it stay applied.
 */
public final class StatementSequence<K> {
    private static final Logger LOG = Logger.getLogger(StatementSequence.class.getName());

    private final List<Statement<K>> statements;
    private final ErrorMode errorMode;

    public StatementSequence(List<Statement<K>> statements, ErrorMode errorMode) {
        this.statements = List.copyOf(statements);
        this.errorMode = Objects.requireNonNull(errorMode, "errorMode");
    }

    public void execute(ExecContext ctx, K tCtx) throws EvaluationException {
        for (Statement<K> statement : statements) {
            try {
                statement.execute(ctx, tCtx);
            } catch (EvaluationException e) {
                if (errorMode == ErrorMode.PROPAGATE) {
                    throw new EvaluationException("failed to execute statement: " + statement.source()
                        + ", " + e.getMessage(), e);
                }
                if (errorMode == ErrorMode.IGNORE) {
                    LOG.log(Level.SEVERE, "failed to execute statement requestId=" + ctx.requestId()
                        + " statement=" + statement.source(), e);
                }
            }
        }
    }

    public List<Statement<K>> statements() {
        return statements;
    }
}
