package com.maturityplatform.common.exception;

import java.util.List;

/**
 * Malformed or incomplete input: missing dimensions, out-of-range values,
 * pilot gate failures, bad week ordering.
 *
 * <p>Carries every violation found, not only the first one.
 */
public class ValidationException extends MaturityException {

    private final List<String> violations;

    public ValidationException(String message) {
        this(message, List.of(message));
    }

    public ValidationException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
