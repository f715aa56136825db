package com.maturityplatform.common.exception;

/**
 * Base type for every failure raised by the maturity decision engine.
 * Subclasses propagate unmodified to the calling layer, which owns the mapping
 * to user-facing responses.
 */
public abstract class MaturityException extends RuntimeException {

    protected MaturityException(String message) {
        super(message);
    }

    protected MaturityException(String message, Throwable cause) {
        super(message, cause);
    }
}
