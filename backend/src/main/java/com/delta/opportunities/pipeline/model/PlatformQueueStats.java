package com.delta.opportunities.pipeline.model;

public record PlatformQueueStats(
    String platform,
    int queued,
    int capacity,
    int workers,
    double availableTokens
) {
}
