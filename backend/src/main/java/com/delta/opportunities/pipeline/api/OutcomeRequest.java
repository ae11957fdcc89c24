package com.delta.opportunities.pipeline.api;

import com.delta.opportunities.pipeline.model.Outcome;

import java.time.Instant;

public record OutcomeRequest(
    Outcome outcome,
    Instant observedAt
) {
}
