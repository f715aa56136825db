package com.maturityplatform.common.exception;

/**
 * Lost update or stale version on a guarded write. The only failure a caller
 * may retry.
 */
public class ConcurrencyException extends MaturityException {

    public ConcurrencyException(String message) {
        super(message);
    }

    public ConcurrencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
