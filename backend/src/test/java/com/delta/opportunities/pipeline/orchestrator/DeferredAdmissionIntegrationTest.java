package com.delta.opportunities.pipeline.orchestrator;

import com.delta.opportunities.pipeline.model.ApplicationEvent;
import com.delta.opportunities.pipeline.model.ApplicationEventKind;
import com.delta.opportunities.pipeline.model.ApplicationRecord;
import com.delta.opportunities.pipeline.model.ApplicationState;
import com.delta.opportunities.pipeline.model.AutomationLevel;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import com.delta.opportunities.pipeline.model.SweepSummary;
import com.delta.opportunities.pipeline.model.UserProfile;
import com.delta.opportunities.pipeline.persistence.ProfileJdbcRepository;
import com.delta.opportunities.pipeline.tracking.StatusSweepService;
import com.delta.opportunities.pipeline.tracking.StatusTrackerService;
import com.delta.opportunities.support.Await;
import com.delta.opportunities.support.PipelineTestConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "pipeline.admission.daily-quota=1",
    "pipeline.admission.quota-exhausted-policy=DEFER"
})
@ActiveProfiles("test")
@Import(PipelineTestConfiguration.class)
class DeferredAdmissionIntegrationTest {
    private static final Duration WAIT = Duration.ofSeconds(15);

    @Autowired
    private WorkflowOrchestrator orchestrator;

    @Autowired
    private ProfileJdbcRepository profiles;

    @Autowired
    private StatusTrackerService tracker;

    @Autowired
    private StatusSweepService sweep;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void exhaustedQuotaDefersUntilTheSweepReleasesIt() throws InterruptedException {
        String userId = "user-" + UUID.randomUUID();
        profiles.save(
            new UserProfile(userId, List.of("java", "sql"), List.of(), 5, List.of("infrastructure"), null, null, Map.of(), AutomationLevel.SEMI_AUTO),
            Instant.now()
        );
        ApplicationRecord first = orchestrator.discover(userId, job("Queue Engineer " + suffix()));
        awaitState(first.id(), ApplicationState.PENDING_APPROVAL);

        ApplicationRecord second = orchestrator.discover(userId, job("Cache Engineer " + suffix()));

        boolean deferred = Await.until(() -> !eventsOfKind(second.id(), ApplicationEventKind.ADMISSION_DEFERRED).isEmpty(), WAIT);
        assertThat(deferred).as("second application deferred").isTrue();
        ApplicationRecord waiting = orchestrator.getApplication(second.id());
        assertThat(waiting.state()).isEqualTo(ApplicationState.SCORED);
        Instant nextMidnight = Instant.now().atZone(ZoneOffset.UTC).toLocalDate().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        assertThat(waiting.deferredUntil()).isEqualTo(nextMidnight);
        ApplicationEvent event = eventsOfKind(second.id(), ApplicationEventKind.ADMISSION_DEFERRED).get(0);
        assertThat(event.payload()).containsEntry("deferredUntil", nextMidnight.toString());

        // a new quota day
        jdbc.update("DELETE FROM admission_quota WHERE user_id = :userId", new MapSqlParameterSource("userId", userId));
        SweepSummary summary = sweep.sweepOnce(Instant.now().plus(2, ChronoUnit.DAYS));

        assertThat(summary.deferredReleased()).isGreaterThanOrEqualTo(1);
        awaitState(second.id(), ApplicationState.PENDING_APPROVAL);
        ApplicationRecord admitted = orchestrator.getApplication(second.id());
        assertThat(admitted.deferredUntil()).isNull();
        assertThat(tracker.timeline(second.id()))
            .filteredOn(timelineEvent -> timelineEvent.kind() == ApplicationEventKind.STATE_CHANGED)
            .extracting(ApplicationEvent::toState)
            .contains(ApplicationState.ADMITTED, ApplicationState.GENERATED);
    }

    private void awaitState(long applicationId, ApplicationState expected) throws InterruptedException {
        boolean reached = Await.until(() -> orchestrator.getApplication(applicationId).state() == expected, WAIT);
        assertThat(reached)
            .as("application %d reaches %s (currently %s)", applicationId, expected, orchestrator.getApplication(applicationId).state())
            .isTrue();
    }

    private List<ApplicationEvent> eventsOfKind(long applicationId, ApplicationEventKind kind) {
        return tracker.timeline(applicationId).stream().filter(event -> event.kind() == kind).toList();
    }

    private static RawOpportunity job(String title) {
        return RawOpportunity.of(
            "source-a",
            title,
            "Acme Robotics",
            "https://acme.example/jobs/" + title.toLowerCase().replace(' ', '-'),
            "Build and run infrastructure services in java and sql"
        );
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
