package com.delta.opportunities.pipeline.model;

import java.util.Map;

public record FitScore(
    double score,
    int tier,
    long weightsVersion,
    Map<ScoringFeature, Double> featureValues
) {
    public boolean admissibleTier() {
        return tier == 1 || tier == 2;
    }
}
