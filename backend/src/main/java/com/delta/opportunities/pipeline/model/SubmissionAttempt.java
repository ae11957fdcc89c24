package com.delta.opportunities.pipeline.model;

import java.time.Instant;

public record SubmissionAttempt(
    long id,
    long applicationId,
    String platform,
    String idempotencyKey,
    SubmissionStatus status,
    int attemptNumber,
    Instant nextRetryAt,
    String lastError,
    String deliveryId,
    ApplicationPackage applicationPackage,
    Instant createdAt,
    Instant updatedAt
) {
}
