package com.delta.opportunities.pipeline.model;

import java.util.List;

public record DiscoverySummary(
    String userId,
    int received,
    int opportunitiesCreated,
    int opportunitiesMerged,
    int rejected,
    int applicationsCreated,
    List<Long> applicationIds,
    List<String> errorSamples
) {
}
