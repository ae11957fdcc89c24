package com.delta.opportunities.pipeline.model;

public record FunnelCounts(
    String userId,
    long discovered,
    long scored,
    long admitted,
    long generated,
    long approved,
    long submitted,
    long closed,
    long accepted,
    long skipped,
    long submissionFailed,
    long abandoned,
    double submissionRate,
    double closeRate,
    double acceptanceRate
) {
}
