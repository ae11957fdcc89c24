package com.delta.opportunities.pipeline.submission;

import java.time.Instant;
import java.util.Comparator;

/**
 * Queue entry for one submission attempt. {@code sequence} preserves arrival order among
 * otherwise equal entries.
 */
public record QueuedSubmission(
    long attemptId,
    long applicationId,
    int tier,
    Instant deadline,
    long sequence
) {
    public static final Comparator<QueuedSubmission> PRIORITY = Comparator
        .comparingInt(QueuedSubmission::tier)
        .thenComparing(QueuedSubmission::deadline, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparingLong(QueuedSubmission::sequence);
}
