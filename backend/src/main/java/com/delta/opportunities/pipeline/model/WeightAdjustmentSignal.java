package com.delta.opportunities.pipeline.model;

import java.time.Instant;
import java.util.Map;

public record WeightAdjustmentSignal(
    long applicationId,
    long weightsVersion,
    Outcome outcome,
    double predictedScore,
    double error,
    Map<ScoringFeature, Double> featureDeltas,
    Instant emittedAt
) {
}
