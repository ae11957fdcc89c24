package com.delta.opportunities.pipeline.model;

public record IngestResult(
    Opportunity opportunity,
    boolean isNew
) {
}
