package com.delta.opportunities.pipeline.error;

/**
 * Failure of an external collaborator that repeating the call cannot fix, such as a 4xx
 * rejection of the request. The owning component gives up without consulting its retry policy.
 */
public class PermanentFailureException extends RuntimeException {
    public PermanentFailureException(String message) {
        super(message);
    }
}
