package com.delta.opportunities.pipeline.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

public record ApplicationRecord(
    long id,
    long opportunityId,
    String userId,
    ApplicationState state,
    Double score,
    Integer tier,
    Long weightsVersion,
    Map<ScoringFeature, Double> featureValues,
    String generatedContentRef,
    Double qualityScore,
    ApprovalDecision approvalDecision,
    String reviewer,
    int generationAttempts,
    String platform,
    Outcome outcome,
    String lastError,
    Instant deferredUntil,
    Instant stateEnteredAt,
    Instant createdAt,
    Instant updatedAt,
    Instant archivedAt,
    long version
) {
    public ApplicationRecord {
        Map<ScoringFeature, Double> values = new EnumMap<>(ScoringFeature.class);
        if (featureValues != null) {
            values.putAll(featureValues);
        }
        featureValues = Map.copyOf(values);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Copy-and-modify helper for computing the next state of a record before a guarded write.
     */
    public static final class Builder {
        private final ApplicationRecord source;
        private ApplicationState state;
        private Double score;
        private Integer tier;
        private Long weightsVersion;
        private Map<ScoringFeature, Double> featureValues;
        private String generatedContentRef;
        private Double qualityScore;
        private ApprovalDecision approvalDecision;
        private String reviewer;
        private int generationAttempts;
        private String platform;
        private Outcome outcome;
        private String lastError;
        private Instant deferredUntil;

        private Builder(ApplicationRecord source) {
            this.source = source;
            this.state = source.state();
            this.score = source.score();
            this.tier = source.tier();
            this.weightsVersion = source.weightsVersion();
            this.featureValues = source.featureValues();
            this.generatedContentRef = source.generatedContentRef();
            this.qualityScore = source.qualityScore();
            this.approvalDecision = source.approvalDecision();
            this.reviewer = source.reviewer();
            this.generationAttempts = source.generationAttempts();
            this.platform = source.platform();
            this.outcome = source.outcome();
            this.lastError = source.lastError();
            this.deferredUntil = source.deferredUntil();
        }

        public Builder state(ApplicationState value) {
            this.state = value;
            return this;
        }

        public Builder fitScore(FitScore value) {
            this.score = value.score();
            this.tier = value.tier();
            this.weightsVersion = value.weightsVersion();
            this.featureValues = value.featureValues();
            return this;
        }

        public Builder generatedContentRef(String value) {
            this.generatedContentRef = value;
            return this;
        }

        public Builder qualityScore(Double value) {
            this.qualityScore = value;
            return this;
        }

        public Builder approval(ApprovalDecision decision, String reviewerName) {
            this.approvalDecision = decision;
            this.reviewer = reviewerName;
            return this;
        }

        public Builder generationAttempts(int value) {
            this.generationAttempts = value;
            return this;
        }

        public Builder platform(String value) {
            this.platform = value;
            return this;
        }

        public Builder outcome(Outcome value) {
            this.outcome = value;
            return this;
        }

        public Builder lastError(String value) {
            this.lastError = value;
            return this;
        }

        public Builder deferredUntil(Instant value) {
            this.deferredUntil = value;
            return this;
        }

        public ApplicationRecord build() {
            return new ApplicationRecord(
                source.id(),
                source.opportunityId(),
                source.userId(),
                state,
                score,
                tier,
                weightsVersion,
                featureValues,
                generatedContentRef,
                qualityScore,
                approvalDecision,
                reviewer,
                generationAttempts,
                platform,
                outcome,
                lastError,
                deferredUntil,
                source.stateEnteredAt(),
                source.createdAt(),
                source.updatedAt(),
                source.archivedAt(),
                source.version()
            );
        }
    }
}
