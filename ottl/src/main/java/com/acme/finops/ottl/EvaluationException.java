package com.acme.finops.ottl;

/**
 * Per-record failure. How it surfaces is decided by the caller's {@link ErrorMode}.
 */
public class EvaluationException extends OttlException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
