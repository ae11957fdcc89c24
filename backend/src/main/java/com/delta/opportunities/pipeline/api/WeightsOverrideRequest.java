package com.delta.opportunities.pipeline.api;

import com.delta.opportunities.pipeline.model.ScoringFeature;

import java.util.Map;

public record WeightsOverrideRequest(
    Map<ScoringFeature, Double> weights,
    Double tier1Threshold,
    Double tier2Threshold
) {
}
