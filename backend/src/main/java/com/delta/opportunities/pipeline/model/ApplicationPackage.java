package com.delta.opportunities.pipeline.model;

import java.time.Instant;

/**
 * Everything a platform adapter needs to deliver one approved application.
 */
public record ApplicationPackage(
    long applicationId,
    long opportunityId,
    String userId,
    int tier,
    Instant deadline,
    String opportunityTitle,
    String organization,
    String applicationUrl,
    String draftContent,
    Double qualityScore
) {
}
