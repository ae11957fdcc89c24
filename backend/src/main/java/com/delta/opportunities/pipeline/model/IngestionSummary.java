package com.delta.opportunities.pipeline.model;

import java.util.List;

public record IngestionSummary(
    int received,
    int created,
    int merged,
    int rejected,
    List<String> errorSamples
) {
}
