package com.delta.opportunities.pipeline.tracking;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.error.IllegalStateTransitionException;
import com.delta.opportunities.pipeline.external.FollowUpNotifier;
import com.delta.opportunities.pipeline.ingest.OpportunityIngestionService;
import com.delta.opportunities.pipeline.model.ApplicationEventKind;
import com.delta.opportunities.pipeline.model.ApplicationState;
import com.delta.opportunities.pipeline.model.FollowUpKind;
import com.delta.opportunities.pipeline.model.FollowUpTask;
import com.delta.opportunities.pipeline.model.Outcome;
import com.delta.opportunities.pipeline.model.SweepSummary;
import com.delta.opportunities.pipeline.orchestrator.WorkflowOrchestrator;
import com.delta.opportunities.pipeline.persistence.ApplicationJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatusSweepServiceTest {
    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    @Mock
    private StatusTrackerService tracker;

    @Mock
    private ApplicationJdbcRepository applications;

    @Mock
    private WorkflowOrchestrator orchestrator;

    @Mock
    private OpportunityIngestionService ingestionService;

    @Mock
    private FollowUpNotifier notifier;

    private StatusSweepService sweep;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.getTracker().setSweepEnabled(false);
        sweep = new StatusSweepService(
            tracker,
            applications,
            orchestrator,
            ingestionService,
            notifier,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void dueFollowUpIsNotifiedOnce() {
        FollowUpTask due = new FollowUpTask(5L, 11L, NOW.minusSeconds(60), FollowUpKind.STATUS_CHECK, false, null);
        FollowUpTask raced = new FollowUpTask(6L, 12L, NOW.minusSeconds(60), FollowUpKind.STATUS_CHECK, false, null);
        when(tracker.dueFollowUps(NOW, 200)).thenReturn(List.of(due, raced));
        when(tracker.completeFollowUp(5L)).thenReturn(true);
        when(tracker.completeFollowUp(6L)).thenReturn(false);

        SweepSummary summary = sweep.sweepOnce(NOW);

        assertThat(summary.followUpsDispatched()).isEqualTo(1);
        verify(notifier).notify(due);
        verify(notifier, never()).notify(raced);
        verify(tracker).recordEvent(eq(11L), eq(ApplicationEventKind.FOLLOW_UP_DUE), any());
    }

    @Test
    void silentApplicationsAreClosedAfterNoResponseWindow() {
        Instant cutoff = NOW.minus(30, ChronoUnit.DAYS);
        when(applications.findTrackingEnteredBefore(cutoff, 200)).thenReturn(List.of(21L, 22L));
        lenient().when(orchestrator.recordOutcome(22L, Outcome.NO_RESPONSE, NOW))
            .thenThrow(new IllegalStateTransitionException(22L, ApplicationState.CLOSED, "record an outcome"));

        SweepSummary summary = sweep.sweepOnce(NOW);

        assertThat(summary.noResponseClosed()).isEqualTo(1);
        verify(orchestrator).recordOutcome(21L, Outcome.NO_RESPONSE, NOW);
    }

    @Test
    void expiredDeferralsAreReleasedAndOldOpportunitiesArchived() {
        when(applications.findDeferredDue(NOW, 200)).thenReturn(List.of(31L, 32L));
        when(orchestrator.releaseDeferred(31L)).thenReturn(true);
        when(orchestrator.releaseDeferred(32L)).thenReturn(false);
        when(ingestionService.archiveOlderThan(NOW.minus(180, ChronoUnit.DAYS))).thenReturn(4);

        SweepSummary summary = sweep.sweepOnce(NOW);

        assertThat(summary.deferredReleased()).isEqualTo(1);
        assertThat(summary.opportunitiesArchived()).isEqualTo(4);
        assertThat(summary.sweptAt()).isEqualTo(NOW);
    }

    @Test
    void failingFollowUpDoesNotStopTheSweep() {
        FollowUpTask broken = new FollowUpTask(7L, 13L, NOW.minusSeconds(5), FollowUpKind.STATUS_CHECK, false, null);
        when(tracker.dueFollowUps(any(), anyInt())).thenReturn(List.of(broken));
        when(tracker.completeFollowUp(7L)).thenThrow(new IllegalStateException("db down"));
        when(applications.findTrackingEnteredBefore(any(), anyInt())).thenReturn(List.of(41L));

        SweepSummary summary = sweep.sweepOnce(NOW);

        assertThat(summary.followUpsDispatched()).isZero();
        assertThat(summary.noResponseClosed()).isEqualTo(1);
    }
}
