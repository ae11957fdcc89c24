package com.delta.opportunities.pipeline.error;

/**
 * Optimistic concurrency mismatch on an application record. Retried by the orchestrator
 * against freshly read state.
 */
public class ConflictException extends RuntimeException {
    private final long applicationId;
    private final long expectedVersion;

    public ConflictException(long applicationId, long expectedVersion) {
        super("Version conflict on application " + applicationId + " (expected version " + expectedVersion + ")");
        this.applicationId = applicationId;
        this.expectedVersion = expectedVersion;
    }

    public long getApplicationId() {
        return applicationId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
