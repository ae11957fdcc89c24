package com.delta.opportunities.pipeline.error;

import java.util.List;

/**
 * Malformed ingestion or request input. Rejected and logged, never retried.
 */
public class ValidationException extends RuntimeException {
    private final List<String> violations;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> violations) {
        super(message);
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
