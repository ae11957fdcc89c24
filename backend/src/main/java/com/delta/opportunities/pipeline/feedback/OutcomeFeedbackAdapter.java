package com.delta.opportunities.pipeline.feedback;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.external.LearningSink;
import com.delta.opportunities.pipeline.model.ApplicationRecord;
import com.delta.opportunities.pipeline.model.Outcome;
import com.delta.opportunities.pipeline.model.ScoringFeature;
import com.delta.opportunities.pipeline.model.WeightAdjustmentSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a terminal outcome into a weight-adjustment signal for the learning collaborator.
 * The signal is computed against the weights version that produced the original score;
 * active weights are never touched here.
 */
@Component
public class OutcomeFeedbackAdapter {
    private static final Logger log = LoggerFactory.getLogger(OutcomeFeedbackAdapter.class);

    private final LearningSink learningSink;
    private final PipelineProperties properties;
    private final Clock clock;

    public OutcomeFeedbackAdapter(LearningSink learningSink, PipelineProperties properties, Clock clock) {
        this.learningSink = learningSink;
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<WeightAdjustmentSignal> recordOutcome(ApplicationRecord application, Outcome outcome) {
        if (application.score() == null || application.weightsVersion() == null) {
            log.warn("Application {} closed with {} but was never scored; no signal emitted", application.id(), outcome);
            return Optional.empty();
        }
        WeightAdjustmentSignal signal = computeSignal(application, outcome);
        learningSink.publish(signal);
        return Optional.of(signal);
    }

    WeightAdjustmentSignal computeSignal(ApplicationRecord application, Outcome outcome) {
        double predicted = application.score();
        double error = round(outcome.target() - predicted);
        double learningRate = properties.getFeedback().getLearningRate();
        Map<ScoringFeature, Double> deltas = new EnumMap<>(ScoringFeature.class);
        for (Map.Entry<ScoringFeature, Double> entry : application.featureValues().entrySet()) {
            deltas.put(entry.getKey(), round(learningRate * error * entry.getValue()));
        }
        return new WeightAdjustmentSignal(
            application.id(),
            application.weightsVersion(),
            outcome,
            predicted,
            error,
            deltas,
            clock.instant()
        );
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_UP).doubleValue();
    }
}
