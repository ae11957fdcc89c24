package com.delta.opportunities.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One immutable version of the scoring configuration. A change is always a new version.
 */
public record ScoringWeights(
    long version,
    Map<ScoringFeature, Double> weights,
    double tier1Threshold,
    double tier2Threshold,
    Instant updatedAt
) {
    public static final double DEFAULT_TIER1_THRESHOLD = 0.85;
    public static final double DEFAULT_TIER2_THRESHOLD = 0.5;

    public ScoringWeights {
        if (version < 1) {
            throw new IllegalArgumentException("weights version must be >= 1");
        }
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("weights must not be empty");
        }
        Map<ScoringFeature, Double> copy = new EnumMap<>(ScoringFeature.class);
        double total = 0.0;
        for (Map.Entry<ScoringFeature, Double> entry : weights.entrySet()) {
            Double value = entry.getValue();
            if (entry.getKey() == null || value == null || value.isNaN() || value < 0.0) {
                throw new IllegalArgumentException("invalid weight for " + entry.getKey() + ": " + value);
            }
            copy.put(entry.getKey(), value);
            total += value;
        }
        if (total <= 0.0) {
            throw new IllegalArgumentException("weights must not all be zero");
        }
        if (tier2Threshold < 0.0 || tier1Threshold > 1.0 || tier2Threshold > tier1Threshold) {
            throw new IllegalArgumentException(
                "tier thresholds must satisfy 0 <= tier2 <= tier1 <= 1 (tier1=" + tier1Threshold + ", tier2=" + tier2Threshold + ")"
            );
        }
        weights = Collections.unmodifiableMap(copy);
    }

    public static ScoringWeights defaults(Instant at) {
        Map<ScoringFeature, Double> weights = new EnumMap<>(ScoringFeature.class);
        for (ScoringFeature feature : ScoringFeature.values()) {
            weights.put(feature, feature.defaultWeight());
        }
        return new ScoringWeights(1, weights, DEFAULT_TIER1_THRESHOLD, DEFAULT_TIER2_THRESHOLD, at);
    }

    public double weight(ScoringFeature feature) {
        Double value = weights.get(feature);
        return value == null ? 0.0 : value;
    }

    public ScoringWeights nextVersion(Map<ScoringFeature, Double> newWeights, double newTier1, double newTier2, Instant at) {
        return new ScoringWeights(version + 1, newWeights, newTier1, newTier2, at);
    }
}
