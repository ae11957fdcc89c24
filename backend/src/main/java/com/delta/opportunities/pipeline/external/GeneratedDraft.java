package com.delta.opportunities.pipeline.external;

public record GeneratedDraft(
    String content,
    double qualityScore
) {
}
