package com.delta.opportunities.pipeline.tracking;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.model.ApplicationEvent;
import com.delta.opportunities.pipeline.model.ApplicationEventKind;
import com.delta.opportunities.pipeline.model.ApplicationState;
import com.delta.opportunities.pipeline.model.FollowUpKind;
import com.delta.opportunities.pipeline.model.FollowUpTask;
import com.delta.opportunities.pipeline.model.FunnelCounts;
import com.delta.opportunities.pipeline.model.Outcome;
import com.delta.opportunities.pipeline.persistence.TrackingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only application timeline, follow-up scheduling and funnel reporting.
 */
@Service
public class StatusTrackerService {
    private static final Logger log = LoggerFactory.getLogger(StatusTrackerService.class);

    private final TrackingJdbcRepository repository;
    private final PipelineProperties properties;
    private final Clock clock;

    public StatusTrackerService(TrackingJdbcRepository repository, PipelineProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public long recordEvent(long applicationId, ApplicationEventKind kind, Map<String, Object> payload) {
        return repository.insertEvent(applicationId, kind, null, null, payload, clock.instant());
    }

    public long recordTransition(
        long applicationId,
        ApplicationState from,
        ApplicationState to,
        Map<String, Object> payload
    ) {
        log.info("Application {} {} -> {}", applicationId, from, to);
        return repository.insertEvent(applicationId, ApplicationEventKind.STATE_CHANGED, from, to, payload, clock.instant());
    }

    public long scheduleFollowUp(long applicationId, Instant dueAt, FollowUpKind kind) {
        long taskId = repository.insertFollowUp(applicationId, dueAt, kind, clock.instant());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", taskId);
        payload.put("kind", kind.name());
        payload.put("dueAt", dueAt.toString());
        recordEvent(applicationId, ApplicationEventKind.FOLLOW_UP_SCHEDULED, payload);
        return taskId;
    }

    /**
     * Status checks at each configured offset from the moment tracking began.
     */
    public List<Long> scheduleTrackingFollowUps(long applicationId, Instant trackingStartedAt) {
        List<Long> ids = new ArrayList<>();
        for (Integer days : properties.getTracker().getFollowUpDays()) {
            if (days == null || days <= 0) {
                continue;
            }
            ids.add(scheduleFollowUp(applicationId, trackingStartedAt.plus(Duration.ofDays(days)), FollowUpKind.STATUS_CHECK));
        }
        return ids;
    }

    public boolean completeFollowUp(long taskId) {
        return repository.completeFollowUp(taskId, clock.instant());
    }

    public int cancelFollowUps(long applicationId) {
        return repository.completeFollowUpsForApplication(applicationId, clock.instant());
    }

    public List<FollowUpTask> dueFollowUps(Instant now, int limit) {
        return repository.findDueFollowUps(now, limit);
    }

    public List<ApplicationEvent> timeline(long applicationId) {
        return repository.findEvents(applicationId);
    }

    public List<FollowUpTask> pendingFollowUps(String userId) {
        return repository.findPendingFollowUps(userId);
    }

    public FunnelCounts funnel(String userId) {
        Map<ApplicationState, Long> reached = repository.countApplicationsReachingStates(userId);
        long discovered = repository.countApplications(userId);
        long scored = reached.getOrDefault(ApplicationState.SCORED, 0L);
        long admitted = reached.getOrDefault(ApplicationState.ADMITTED, 0L);
        long generated = reached.getOrDefault(ApplicationState.GENERATED, 0L);
        long approved = reached.getOrDefault(ApplicationState.APPROVED, 0L);
        long submitted = reached.getOrDefault(ApplicationState.SUBMITTED, 0L);
        long closed = reached.getOrDefault(ApplicationState.CLOSED, 0L);
        long accepted = repository.countApplicationsWithOutcome(userId, Outcome.ACCEPTED.name());
        return new FunnelCounts(
            userId,
            discovered,
            scored,
            admitted,
            generated,
            approved,
            submitted,
            closed,
            accepted,
            reached.getOrDefault(ApplicationState.SKIPPED, 0L),
            reached.getOrDefault(ApplicationState.SUBMISSION_FAILED, 0L),
            reached.getOrDefault(ApplicationState.ABANDONED, 0L),
            ratio(submitted, admitted),
            ratio(closed, submitted),
            ratio(accepted, submitted)
        );
    }

    private static double ratio(long numerator, long denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return Math.round(numerator * 10_000.0 / denominator) / 10_000.0;
    }
}
