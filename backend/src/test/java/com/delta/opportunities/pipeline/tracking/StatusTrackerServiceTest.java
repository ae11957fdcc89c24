package com.delta.opportunities.pipeline.tracking;

import com.delta.opportunities.pipeline.ingest.OpportunityIngestionService;
import com.delta.opportunities.pipeline.model.ApplicationEvent;
import com.delta.opportunities.pipeline.model.ApplicationEventKind;
import com.delta.opportunities.pipeline.model.ApplicationRecord;
import com.delta.opportunities.pipeline.model.ApplicationState;
import com.delta.opportunities.pipeline.model.FollowUpTask;
import com.delta.opportunities.pipeline.model.FunnelCounts;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import com.delta.opportunities.pipeline.persistence.ApplicationJdbcRepository;
import com.delta.opportunities.support.PipelineTestConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(PipelineTestConfiguration.class)
class StatusTrackerServiceTest {

    @Autowired
    private StatusTrackerService tracker;

    @Autowired
    private ApplicationJdbcRepository applications;

    @Autowired
    private OpportunityIngestionService ingestionService;

    @Test
    void trackingSchedulesStatusChecksAtConfiguredOffsets() {
        String userId = "tracker-" + UUID.randomUUID();
        ApplicationRecord application = parkedApplication(userId);
        Instant started = Instant.parse("2026-03-01T09:00:00Z");

        List<Long> ids = tracker.scheduleTrackingFollowUps(application.id(), started);

        assertThat(ids).hasSize(2);
        List<FollowUpTask> pending = tracker.pendingFollowUps(userId);
        assertThat(pending)
            .extracting(FollowUpTask::dueAt)
            .containsExactly(started.plus(7, ChronoUnit.DAYS), started.plus(14, ChronoUnit.DAYS));
        assertThat(tracker.timeline(application.id()))
            .filteredOn(event -> event.kind() == ApplicationEventKind.FOLLOW_UP_SCHEDULED)
            .hasSize(2);
    }

    @Test
    void completedFollowUpIsNoLongerPending() {
        String userId = "tracker-" + UUID.randomUUID();
        ApplicationRecord application = parkedApplication(userId);
        List<Long> ids = tracker.scheduleTrackingFollowUps(application.id(), Instant.parse("2026-03-01T09:00:00Z"));

        assertThat(tracker.completeFollowUp(ids.get(0))).isTrue();
        assertThat(tracker.completeFollowUp(ids.get(0))).isFalse();
        assertThat(tracker.pendingFollowUps(userId)).extracting(FollowUpTask::id).containsExactly(ids.get(1));

        assertThat(tracker.cancelFollowUps(application.id())).isEqualTo(1);
        assertThat(tracker.pendingFollowUps(userId)).isEmpty();
    }

    @Test
    void timelineKeepsTransitionsInOrder() {
        ApplicationRecord application = parkedApplication("tracker-" + UUID.randomUUID());

        tracker.recordTransition(application.id(), ApplicationState.DISCOVERED, ApplicationState.SCORED, Map.of("score", 0.7));
        tracker.recordTransition(application.id(), ApplicationState.SCORED, ApplicationState.ADMITTED, Map.of());

        List<ApplicationEvent> events = tracker.timeline(application.id());
        assertThat(events).extracting(ApplicationEvent::toState)
            .containsExactly(ApplicationState.SCORED, ApplicationState.ADMITTED);
        assertThat(events.get(0).payload()).containsEntry("score", 0.7);
        assertThat(events.get(0).fromState()).isEqualTo(ApplicationState.DISCOVERED);
    }

    @Test
    void funnelCountsEachStageOnceAndDerivesRates() {
        String userId = "tracker-" + UUID.randomUUID();
        ApplicationRecord submitted = parkedApplication(userId);
        ApplicationRecord skipped = parkedApplication(userId);
        ApplicationRecord untouched = parkedApplication(userId);

        walk(submitted.id(), ApplicationState.DISCOVERED, ApplicationState.SCORED, ApplicationState.ADMITTED,
            ApplicationState.GENERATION_REQUESTED, ApplicationState.GENERATED, ApplicationState.PENDING_APPROVAL,
            ApplicationState.APPROVED, ApplicationState.SUBMITTING, ApplicationState.SUBMITTED);
        walk(skipped.id(), ApplicationState.DISCOVERED, ApplicationState.SCORED, ApplicationState.SKIPPED);

        FunnelCounts funnel = tracker.funnel(userId);

        assertThat(funnel.discovered()).isEqualTo(3);
        assertThat(funnel.scored()).isEqualTo(2);
        assertThat(funnel.admitted()).isEqualTo(1);
        assertThat(funnel.submitted()).isEqualTo(1);
        assertThat(funnel.skipped()).isEqualTo(1);
        assertThat(funnel.submissionRate()).isEqualTo(1.0);
        assertThat(funnel.closeRate()).isZero();
        assertThat(untouched.state()).isEqualTo(ApplicationState.DISCOVERED);
    }

    private void walk(long applicationId, ApplicationState... states) {
        for (int i = 1; i < states.length; i++) {
            tracker.recordTransition(applicationId, states[i - 1], states[i], Map.of());
        }
    }

    private ApplicationRecord parkedApplication(String userId) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        long opportunityId = ingestionService.ingest(RawOpportunity.of(
            "tracker-test",
            "Analyst " + suffix,
            "Ledger " + suffix,
            "https://ledger.example/jobs/" + suffix,
            "Numbers"
        )).opportunity().id();
        return applications.createIfAbsent(userId, opportunityId, Instant.now()).application();
    }
}
