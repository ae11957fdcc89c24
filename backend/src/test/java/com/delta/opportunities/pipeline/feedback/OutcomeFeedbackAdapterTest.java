package com.delta.opportunities.pipeline.feedback;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.external.LearningSink;
import com.delta.opportunities.pipeline.model.ApplicationRecord;
import com.delta.opportunities.pipeline.model.ApplicationState;
import com.delta.opportunities.pipeline.model.Outcome;
import com.delta.opportunities.pipeline.model.ScoringFeature;
import com.delta.opportunities.pipeline.model.WeightAdjustmentSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OutcomeFeedbackAdapterTest {
    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    @Mock
    private LearningSink learningSink;

    private OutcomeFeedbackAdapter adapter;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.getFeedback().setLearningRate(0.1);
        adapter = new OutcomeFeedbackAdapter(learningSink, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void acceptedOutcomePushesWeightsTowardContributingFeatures() {
        ApplicationRecord application = closed(0.6, 3L);

        Optional<WeightAdjustmentSignal> signal = adapter.recordOutcome(application, Outcome.ACCEPTED);

        assertThat(signal).isPresent();
        assertThat(signal.get().error()).isEqualTo(0.4);
        assertThat(signal.get().weightsVersion()).isEqualTo(3L);
        assertThat(signal.get().featureDeltas())
            .containsEntry(ScoringFeature.SKILL_MATCH, 0.032)
            .containsEntry(ScoringFeature.PRESTIGE, 0.02);
        assertThat(signal.get().emittedAt()).isEqualTo(NOW);

        ArgumentCaptor<WeightAdjustmentSignal> published = ArgumentCaptor.forClass(WeightAdjustmentSignal.class);
        verify(learningSink).publish(published.capture());
        assertThat(published.getValue()).isEqualTo(signal.get());
    }

    @Test
    void noResponseIsANegativeSignal() {
        WeightAdjustmentSignal signal = adapter.recordOutcome(closed(0.7, 1L), Outcome.NO_RESPONSE).orElseThrow();

        assertThat(signal.error()).isEqualTo(-0.7);
        assertThat(signal.featureDeltas().get(ScoringFeature.SKILL_MATCH)).isEqualTo(-0.056);
    }

    @Test
    void unscoredApplicationsEmitNothing() {
        ApplicationRecord unscored = new ApplicationRecord(
            9L, 1L, "user", ApplicationState.CLOSED, null, null, null, Map.of(), null, null, null, null,
            0, null, Outcome.REJECTED, null, null, NOW, NOW, NOW, NOW, 4L
        );

        assertThat(adapter.recordOutcome(unscored, Outcome.REJECTED)).isEmpty();
        verify(learningSink, never()).publish(any());
    }

    private static ApplicationRecord closed(double score, long weightsVersion) {
        return new ApplicationRecord(
            7L,
            1L,
            "user",
            ApplicationState.CLOSED,
            score,
            2,
            weightsVersion,
            Map.of(ScoringFeature.SKILL_MATCH, 0.8, ScoringFeature.PRESTIGE, 0.5),
            "draft:1",
            0.9,
            null,
            null,
            1,
            "email",
            null,
            null,
            null,
            NOW,
            NOW,
            NOW,
            null,
            9L
        );
    }
}
