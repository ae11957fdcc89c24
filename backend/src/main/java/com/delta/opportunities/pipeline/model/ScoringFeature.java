package com.delta.opportunities.pipeline.model;

public enum ScoringFeature {
    SKILL_MATCH(0.25),
    EXPERIENCE_MATCH(0.15),
    SEMANTIC_SIMILARITY(0.20),
    PRESTIGE(0.10),
    DEADLINE_URGENCY(0.10),
    COMPENSATION(0.05),
    HISTORICAL_SUCCESS_RATE(0.15);

    private final double defaultWeight;

    ScoringFeature(double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public double defaultWeight() {
        return defaultWeight;
    }
}
