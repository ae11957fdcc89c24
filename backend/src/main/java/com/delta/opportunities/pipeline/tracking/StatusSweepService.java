package com.delta.opportunities.pipeline.tracking;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.error.IllegalStateTransitionException;
import com.delta.opportunities.pipeline.external.FollowUpNotifier;
import com.delta.opportunities.pipeline.ingest.OpportunityIngestionService;
import com.delta.opportunities.pipeline.model.ApplicationEventKind;
import com.delta.opportunities.pipeline.model.FollowUpTask;
import com.delta.opportunities.pipeline.model.Outcome;
import com.delta.opportunities.pipeline.model.SweepSummary;
import com.delta.opportunities.pipeline.orchestrator.WorkflowOrchestrator;
import com.delta.opportunities.pipeline.persistence.ApplicationJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic housekeeping: due follow-ups, silent applications, expired admission deferrals and
 * opportunity retention.
 */
@Service
public class StatusSweepService {
    private static final Logger log = LoggerFactory.getLogger(StatusSweepService.class);

    private final StatusTrackerService tracker;
    private final ApplicationJdbcRepository applications;
    private final WorkflowOrchestrator orchestrator;
    private final OpportunityIngestionService ingestionService;
    private final FollowUpNotifier notifier;
    private final PipelineProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;

    public StatusSweepService(
        StatusTrackerService tracker,
        ApplicationJdbcRepository applications,
        WorkflowOrchestrator orchestrator,
        OpportunityIngestionService ingestionService,
        FollowUpNotifier notifier,
        PipelineProperties properties,
        Clock clock
    ) {
        this.tracker = tracker;
        this.applications = applications;
        this.orchestrator = orchestrator;
        this.ingestionService = ingestionService;
        this.notifier = notifier;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getTracker().isSweepEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int intervalSeconds = properties.getTracker().getSweepIntervalSeconds();
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("status-sweep");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.submit(() -> sweepLoop(intervalSeconds));
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
        }
    }

    private void sweepLoop(int intervalSeconds) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                sweepOnce(clock.instant());
            } catch (Exception e) {
                log.warn("Status sweep failed", e);
            }
            sleep(intervalSeconds);
        }
    }

    public SweepSummary sweepOnce(Instant now) {
        int batch = properties.getTracker().getSweepBatchSize();
        int followUps = dispatchDueFollowUps(now, batch);
        int closed = closeSilentApplications(now, batch);
        int released = releaseDeferredAdmissions(now, batch);
        Instant retentionCutoff = now.minus(Duration.ofDays(properties.getTracker().getOpportunityRetentionDays()));
        int archived = ingestionService.archiveOlderThan(retentionCutoff);
        SweepSummary summary = new SweepSummary(now, followUps, closed, released, archived);
        if (followUps + closed + released + archived > 0) {
            log.info(
                "Status sweep: followUps={} noResponseClosed={} deferredReleased={} archived={}",
                followUps,
                closed,
                released,
                archived
            );
        }
        return summary;
    }

    private int dispatchDueFollowUps(Instant now, int batch) {
        int dispatched = 0;
        List<FollowUpTask> due = tracker.dueFollowUps(now, batch);
        for (FollowUpTask task : due) {
            try {
                if (!tracker.completeFollowUp(task.id())) {
                    continue;
                }
                notifier.notify(task);
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("taskId", task.id());
                payload.put("kind", task.kind().name());
                payload.put("dueAt", task.dueAt().toString());
                tracker.recordEvent(task.applicationId(), ApplicationEventKind.FOLLOW_UP_DUE, payload);
                dispatched++;
            } catch (Exception e) {
                log.warn("Failed to dispatch follow-up {} for application {}", task.id(), task.applicationId(), e);
            }
        }
        return dispatched;
    }

    private int closeSilentApplications(Instant now, int batch) {
        Instant cutoff = now.minus(Duration.ofDays(properties.getTracker().getNoResponseDays()));
        int closed = 0;
        for (Long applicationId : applications.findTrackingEnteredBefore(cutoff, batch)) {
            try {
                orchestrator.recordOutcome(applicationId, Outcome.NO_RESPONSE, now);
                closed++;
            } catch (IllegalStateTransitionException e) {
                log.debug("Application {} left tracking before the no-response sweep reached it", applicationId);
            } catch (Exception e) {
                log.warn("Failed to close silent application {}", applicationId, e);
            }
        }
        return closed;
    }

    private int releaseDeferredAdmissions(Instant now, int batch) {
        int released = 0;
        for (Long applicationId : applications.findDeferredDue(now, batch)) {
            try {
                if (orchestrator.releaseDeferred(applicationId)) {
                    released++;
                }
            } catch (Exception e) {
                log.warn("Failed to release deferred application {}", applicationId, e);
            }
        }
        return released;
    }

    private void sleep(int intervalSeconds) {
        try {
            TimeUnit.SECONDS.sleep(Math.max(1, intervalSeconds));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
