package com.delta.opportunities.pipeline.model;

import java.time.Instant;

public record FollowUpTask(
    long id,
    long applicationId,
    Instant dueAt,
    FollowUpKind kind,
    boolean completed,
    Instant completedAt
) {
}
