package com.delta.opportunities.pipeline.model;

public record SubmissionResult(
    long applicationId,
    long attemptId,
    String platform,
    SubmissionStatus status,
    String deliveryId,
    String lastError,
    int attemptNumber
) {
    public boolean delivered() {
        return status == SubmissionStatus.DELIVERED;
    }
}
