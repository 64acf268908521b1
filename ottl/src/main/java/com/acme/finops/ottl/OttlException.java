package com.acme.finops.ottl;

/**
 * Base of every checked failure raised while compiling or evaluating OTTL.
 */
public abstract class OttlException extends Exception {
    protected OttlException(String message) {
        super(message);
    }

    protected OttlException(String message, Throwable cause) {
        super(message, cause);
    }
}
