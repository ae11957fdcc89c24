package com.delta.opportunities.pipeline.error;

/**
 * Recoverable failure of an external collaborator (generator timeout, platform hiccup).
 * The owning component retries it under its {@link com.delta.opportunities.pipeline.retry.RetryPolicy}.
 */
public class TransientException extends RuntimeException {
    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
