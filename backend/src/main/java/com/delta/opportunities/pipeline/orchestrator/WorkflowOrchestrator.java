package com.delta.opportunities.pipeline.orchestrator;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.error.ConflictException;
import com.delta.opportunities.pipeline.error.IllegalStateTransitionException;
import com.delta.opportunities.pipeline.error.NotFoundException;
import com.delta.opportunities.pipeline.error.TransientException;
import com.delta.opportunities.pipeline.error.ValidationException;
import com.delta.opportunities.pipeline.external.GeneratedDraft;
import com.delta.opportunities.pipeline.external.GenerationRequest;
import com.delta.opportunities.pipeline.external.Generator;
import com.delta.opportunities.pipeline.feedback.OutcomeFeedbackAdapter;
import com.delta.opportunities.pipeline.ingest.OpportunityIngestionService;
import com.delta.opportunities.pipeline.model.ApplicationEventKind;
import com.delta.opportunities.pipeline.model.ApplicationPackage;
import com.delta.opportunities.pipeline.model.ApplicationRecord;
import com.delta.opportunities.pipeline.model.ApplicationState;
import com.delta.opportunities.pipeline.model.ApprovalDecision;
import com.delta.opportunities.pipeline.model.AutomationLevel;
import com.delta.opportunities.pipeline.model.DiscoverySummary;
import com.delta.opportunities.pipeline.model.FitScore;
import com.delta.opportunities.pipeline.model.IngestResult;
import com.delta.opportunities.pipeline.model.IngestionSummary;
import com.delta.opportunities.pipeline.model.Opportunity;
import com.delta.opportunities.pipeline.model.Outcome;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import com.delta.opportunities.pipeline.model.ScoringWeights;
import com.delta.opportunities.pipeline.model.SubmissionAttempt;
import com.delta.opportunities.pipeline.model.SubmissionResult;
import com.delta.opportunities.pipeline.model.SubmissionStatus;
import com.delta.opportunities.pipeline.model.UserProfile;
import com.delta.opportunities.pipeline.persistence.ApplicationJdbcRepository;
import com.delta.opportunities.pipeline.persistence.ProfileJdbcRepository;
import com.delta.opportunities.pipeline.retry.RetryPolicy;
import com.delta.opportunities.pipeline.scoring.FitScoringEngine;
import com.delta.opportunities.pipeline.scoring.ScoringWeightsRegistry;
import com.delta.opportunities.pipeline.submission.SubmissionEngine;
import com.delta.opportunities.pipeline.submission.SubmissionListener;
import com.delta.opportunities.pipeline.tracking.StatusTrackerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Drives each application through its lifecycle. Every write is a version-guarded
 * compare-and-set; a lost race re-reads the record and re-evaluates, and side effects run only
 * after the write that justifies them has won.
 */
@Service
public class WorkflowOrchestrator implements SubmissionListener {
    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);
    private static final String DRAFT_REF_PREFIX = "draft:";
    private static final int RESUME_BATCH = 10_000;
    private static final Duration CONFLICT_REDISPATCH_DELAY = Duration.ofMillis(200);
    private static final Set<ApplicationState> RESUMABLE = EnumSet.of(
        ApplicationState.DISCOVERED,
        ApplicationState.SCORED,
        ApplicationState.ADMITTED,
        ApplicationState.GENERATION_REQUESTED,
        ApplicationState.GENERATED,
        ApplicationState.AUTO_APPROVED,
        ApplicationState.APPROVED,
        ApplicationState.SUBMITTING,
        ApplicationState.SUBMITTED
    );

    private final OpportunityIngestionService ingestionService;
    private final ApplicationJdbcRepository applications;
    private final ProfileJdbcRepository profiles;
    private final FitScoringEngine scoringEngine;
    private final ScoringWeightsRegistry weightsRegistry;
    private final AdmissionController admissionController;
    private final Generator generator;
    private final SubmissionEngine submissionEngine;
    private final StatusTrackerService tracker;
    private final OutcomeFeedbackAdapter feedbackAdapter;
    private final PipelineProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final ExecutorService orchestratorExecutor;
    private final ExecutorService generatorExecutor;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ApplicationDispatcher dispatcher;
    private final Set<Long> generationsInFlight = ConcurrentHashMap.newKeySet();

    public WorkflowOrchestrator(
        OpportunityIngestionService ingestionService,
        ApplicationJdbcRepository applications,
        ProfileJdbcRepository profiles,
        FitScoringEngine scoringEngine,
        ScoringWeightsRegistry weightsRegistry,
        AdmissionController admissionController,
        Generator generator,
        SubmissionEngine submissionEngine,
        StatusTrackerService tracker,
        OutcomeFeedbackAdapter feedbackAdapter,
        PipelineProperties properties,
        TransactionTemplate transactionTemplate,
        @Qualifier("orchestratorExecutor") ExecutorService orchestratorExecutor,
        @Qualifier("generatorExecutor") ExecutorService generatorExecutor,
        @Qualifier("pipelineScheduler") ScheduledExecutorService scheduler,
        Clock clock
    ) {
        this.ingestionService = ingestionService;
        this.applications = applications;
        this.profiles = profiles;
        this.scoringEngine = scoringEngine;
        this.weightsRegistry = weightsRegistry;
        this.admissionController = admissionController;
        this.generator = generator;
        this.submissionEngine = submissionEngine;
        this.tracker = tracker;
        this.feedbackAdapter = feedbackAdapter;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.orchestratorExecutor = orchestratorExecutor;
        this.generatorExecutor = generatorExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
        this.dispatcher = new ApplicationDispatcher(orchestratorExecutor, this::advance);
    }

    @PostConstruct
    public void registerSubmissionListener() {
        submissionEngine.registerListener(this);
    }

    // ---------------------------------------------------------------- discovery

    public ApplicationRecord discover(String userId, RawOpportunity raw) {
        return discoverOne(requireUserId(userId), raw).application();
    }

    public DiscoverySummary discoverBatch(String userId, List<RawOpportunity> batch) {
        String user = requireUserId(userId);
        List<Long> applicationIds = new ArrayList<>();
        int[] applicationsCreated = new int[1];
        IngestionSummary ingestion = ingestionService.ingestBatch(batch, (raw, ingest) -> {
            DiscoveredApplication discovered = attach(user, raw, ingest);
            if (discovered.created()) {
                applicationsCreated[0]++;
            }
            applicationIds.add(discovered.application().id());
        });
        log.info(
            "Discovery for {}: received={} created={} merged={} rejected={} applications={}",
            user,
            ingestion.received(),
            ingestion.created(),
            ingestion.merged(),
            ingestion.rejected(),
            applicationsCreated[0]
        );
        return new DiscoverySummary(
            user,
            ingestion.received(),
            ingestion.created(),
            ingestion.merged(),
            ingestion.rejected(),
            applicationsCreated[0],
            applicationIds,
            ingestion.errorSamples()
        );
    }

    private DiscoveredApplication discoverOne(String userId, RawOpportunity raw) {
        return attach(userId, raw, ingestionService.ingest(raw));
    }

    private DiscoveredApplication attach(String userId, RawOpportunity raw, IngestResult ingest) {
        ApplicationJdbcRepository.CreateResult result = applications.createIfAbsent(
            userId,
            ingest.opportunity().id(),
            clock.instant()
        );
        ApplicationRecord application = result.application();
        if (result.created()) {
            tracker.recordTransition(
                application.id(),
                null,
                ApplicationState.DISCOVERED,
                payload("opportunityId", ingest.opportunity().id(), "source", raw.source())
            );
            dispatcher.dispatch(application.id());
        }
        return new DiscoveredApplication(ingest, application, result.created());
    }

    private record DiscoveredApplication(IngestResult ingest, ApplicationRecord application, boolean created) {
    }

    // ---------------------------------------------------------------- automatic progression

    public void dispatch(long applicationId) {
        dispatcher.dispatch(applicationId);
    }

    /**
     * Runs automatic transitions for the application until it reaches a state that waits for
     * an external event, an asynchronous call, or a terminal state.
     */
    public void advance(long applicationId) {
        try {
            boolean more = true;
            while (more) {
                more = withConflictRetry(applicationId, this::step);
            }
        } catch (NotFoundException e) {
            log.warn("Cannot advance application {}: {}", applicationId, e.getMessage());
        } catch (TransientException e) {
            log.warn("Advancing application {} deferred: {}", applicationId, e.getMessage());
            scheduleDispatch(applicationId, CONFLICT_REDISPATCH_DELAY);
        }
    }

    /**
     * Performs one transition. Returns true when another automatic step may follow.
     */
    private boolean step(ApplicationRecord application) {
        return switch (application.state()) {
            case DISCOVERED -> score(application);
            case SCORED -> admit(application);
            case ADMITTED -> requestGeneration(application);
            case GENERATION_REQUESTED -> startGeneration(application);
            case GENERATED -> routeForApproval(application);
            case AUTO_APPROVED -> approveAutomatically(application);
            case APPROVED -> beginSubmission(application);
            case SUBMITTING -> ensureSubmitted(application);
            case SUBMITTED -> beginTracking(application);
            default -> false;
        };
    }

    private boolean score(ApplicationRecord application) {
        Opportunity opportunity = ingestionService.findById(application.opportunityId());
        UserProfile profile = profileFor(application.userId());
        ScoringWeights weights = weightsRegistry.current();
        FitScore fit = scoringEngine.score(profile, opportunity, weights);
        transition(
            application,
            application.toBuilder().state(ApplicationState.SCORED).fitScore(fit).build(),
            payload("score", fit.score(), "tier", fit.tier(), "weightsVersion", fit.weightsVersion())
        );
        ingestionService.recordScore(opportunity.id(), fit.tier(), fit.score());
        return true;
    }

    private boolean admit(ApplicationRecord application) {
        Instant now = clock.instant();
        if (application.deferredUntil() != null && application.deferredUntil().isAfter(now)) {
            return false;
        }
        AdmissionDecision decision = admissionController.decide(application, now);
        switch (decision.verdict()) {
            case ADMIT -> {
                try {
                    transition(
                        application,
                        application.toBuilder().state(ApplicationState.ADMITTED).deferredUntil(null).build(),
                        payload("tier", application.tier(), "quotaDay", decision.quotaDay().toString())
                    );
                } catch (ConflictException e) {
                    admissionController.release(application.userId(), decision);
                    throw e;
                }
                return true;
            }
            case DEFER -> {
                if (decision.deferredUntil().equals(application.deferredUntil())) {
                    return false;
                }
                transactionTemplate.executeWithoutResult(status -> {
                    applications.compareAndSet(
                        application,
                        application.toBuilder().deferredUntil(decision.deferredUntil()).build(),
                        now
                    );
                    tracker.recordEvent(
                        application.id(),
                        ApplicationEventKind.ADMISSION_DEFERRED,
                        payload("reason", decision.reason(), "deferredUntil", decision.deferredUntil().toString())
                    );
                });
                log.info("Admission of application {} deferred until {}", application.id(), decision.deferredUntil());
                return false;
            }
            default -> {
                transition(
                    application,
                    application.toBuilder().state(ApplicationState.SKIPPED).deferredUntil(null).build(),
                    payload("reason", decision.reason(), "tier", application.tier())
                );
                return false;
            }
        }
    }

    private boolean requestGeneration(ApplicationRecord application) {
        transition(
            application,
            application.toBuilder().state(ApplicationState.GENERATION_REQUESTED).generationAttempts(0).build(),
            payload()
        );
        return true;
    }

    /**
     * Starts the generator call off the worker pool. The application stays in
     * {@code GENERATION_REQUESTED} until the call completes.
     */
    private boolean startGeneration(ApplicationRecord application) {
        long applicationId = application.id();
        if (!generationsInFlight.add(applicationId)) {
            return false;
        }
        try {
            int attempt = application.generationAttempts() + 1;
            Opportunity opportunity = ingestionService.findById(application.opportunityId());
            GenerationRequest request = new GenerationRequest(
                applicationId,
                profileFor(application.userId()),
                opportunity,
                payload("tier", application.tier(), "attempt", attempt, "opportunityType", opportunity.fields().opportunityType().name())
            );
            long timeoutSeconds = properties.getGenerator().getTimeoutSeconds();
            log.info("Requesting generation for application {} (attempt {})", applicationId, attempt);
            CompletableFuture
                .supplyAsync(() -> generator.generate(request), generatorExecutor)
                .orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .whenCompleteAsync(
                    (draft, error) -> onGenerationFinished(applicationId, attempt, draft, error),
                    orchestratorExecutor
                );
        } catch (RuntimeException e) {
            generationsInFlight.remove(applicationId);
            throw e;
        }
        return false;
    }

    private void onGenerationFinished(long applicationId, int attempt, GeneratedDraft draft, Throwable error) {
        boolean dispatchNext = false;
        try {
            if (error == null && draft != null) {
                dispatchNext = completeGeneration(applicationId, attempt, draft);
            } else {
                Throwable cause = unwrap(error);
                failGeneration(applicationId, attempt, describe(cause), isRetryable(cause));
            }
        } catch (Exception e) {
            log.warn("Failed to record generation result for application {}", applicationId, e);
            generationsInFlight.remove(applicationId);
        }
        if (dispatchNext) {
            dispatcher.dispatch(applicationId);
        }
    }

    private boolean completeGeneration(long applicationId, int attempt, GeneratedDraft draft) {
        Long[] draftId = {null};
        try {
            return withConflictRetry(applicationId, application -> {
                if (application.state() != ApplicationState.GENERATION_REQUESTED) {
                    discardResult(application, "generation", attempt);
                    return false;
                }
                if (draftId[0] == null) {
                    draftId[0] = applications.insertDraft(applicationId, draft.content(), draft.qualityScore(), clock.instant());
                }
                transition(
                    application,
                    application.toBuilder()
                        .state(ApplicationState.GENERATED)
                        .generatedContentRef(DRAFT_REF_PREFIX + draftId[0])
                        .qualityScore(draft.qualityScore())
                        .generationAttempts(attempt)
                        .lastError(null)
                        .build(),
                    payload("attempt", attempt, "qualityScore", draft.qualityScore(), "draftId", draftId[0])
                );
                return true;
            });
        } finally {
            generationsInFlight.remove(applicationId);
        }
    }

    private void failGeneration(long applicationId, int attempt, String message, boolean retryable) {
        RetryPolicy policy = properties.getGenerator().retryPolicy();
        Duration retryDelay = withConflictRetry(applicationId, application -> {
            if (application.state() != ApplicationState.GENERATION_REQUESTED) {
                discardResult(application, "generation", attempt);
                return null;
            }
            if (retryable && policy.canRetryAfter(attempt)) {
                Duration delay = policy.delayAfter(attempt);
                transactionTemplate.executeWithoutResult(status -> {
                    applications.compareAndSet(
                        application,
                        application.toBuilder().generationAttempts(attempt).lastError(message).build(),
                        clock.instant()
                    );
                    tracker.recordEvent(
                        applicationId,
                        ApplicationEventKind.GENERATION_FAILED,
                        payload("attempt", attempt, "error", message, "retryInMs", delay.toMillis())
                    );
                });
                log.warn("Generation attempt {} for application {} failed ({}); retrying in {}", attempt, applicationId, message, delay);
                return delay;
            }
            transition(
                application,
                application.toBuilder()
                    .state(ApplicationState.SKIPPED)
                    .generationAttempts(attempt)
                    .lastError(message)
                    .build(),
                payload("reason", retryable ? "generation_exhausted" : "generation_rejected", "attempts", attempt)
            );
            return null;
        });
        if (retryDelay == null) {
            generationsInFlight.remove(applicationId);
            return;
        }
        try {
            scheduler.schedule(() -> {
                generationsInFlight.remove(applicationId);
                dispatcher.dispatch(applicationId);
            }, Math.max(1L, retryDelay.toMillis()), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            generationsInFlight.remove(applicationId);
            log.warn("Could not schedule generation retry for application {}", applicationId, e);
        }
    }

    private boolean routeForApproval(ApplicationRecord application) {
        AutomationLevel level = effectiveAutomationLevel(application.userId());
        double threshold = properties.getAutomation().getQualityThreshold();
        boolean auto = level == AutomationLevel.FULL_AUTO
            && application.qualityScore() != null
            && application.qualityScore() > threshold;
        ApplicationState next = auto ? ApplicationState.AUTO_APPROVED : ApplicationState.PENDING_APPROVAL;
        transition(
            application,
            application.toBuilder().state(next).build(),
            payload("automationLevel", level.name(), "qualityScore", application.qualityScore(), "threshold", threshold)
        );
        return auto;
    }

    private boolean approveAutomatically(ApplicationRecord application) {
        transition(
            application,
            application.toBuilder()
                .state(ApplicationState.APPROVED)
                .approval(ApprovalDecision.APPROVED, "auto")
                .build(),
            payload("reviewer", "auto")
        );
        return true;
    }

    private boolean beginSubmission(ApplicationRecord application) {
        Opportunity opportunity = ingestionService.findById(application.opportunityId());
        String platform = resolvePlatform(opportunity);
        transition(
            application,
            application.toBuilder().state(ApplicationState.SUBMITTING).platform(platform).build(),
            payload("platform", platform)
        );
        return true;
    }

    /**
     * Hands the package to the submission engine once. On re-entry (restart, duplicate
     * dispatch) it replays a terminal result the listener may have missed.
     */
    private boolean ensureSubmitted(ApplicationRecord application) {
        String platform = application.platform();
        if (platform == null) {
            platform = resolvePlatform(ingestionService.findById(application.opportunityId()));
        }
        Optional<SubmissionAttempt> existing = submissionEngine.findAttempt(application.id(), platform);
        if (existing.isEmpty()) {
            long attemptId = submissionEngine.submit(buildPackage(application), platform);
            tracker.recordEvent(
                application.id(),
                ApplicationEventKind.SUBMISSION_QUEUED,
                payload("attemptId", attemptId, "platform", platform)
            );
            return false;
        }
        SubmissionAttempt attempt = existing.get();
        if (attempt.status() == SubmissionStatus.DELIVERED || attempt.status() == SubmissionStatus.FAILED) {
            onSubmissionResult(new SubmissionResult(
                application.id(),
                attempt.id(),
                attempt.platform(),
                attempt.status(),
                attempt.deliveryId(),
                attempt.lastError(),
                attempt.attemptNumber()
            ));
        }
        return false;
    }

    private boolean beginTracking(ApplicationRecord application) {
        ApplicationRecord tracking = transition(
            application,
            application.toBuilder().state(ApplicationState.TRACKING).build(),
            payload()
        );
        tracker.scheduleTrackingFollowUps(application.id(), tracking.stateEnteredAt());
        return true;
    }

    // ---------------------------------------------------------------- inbound events

    @Override
    public void onSubmissionResult(SubmissionResult result) {
        boolean delivered = withConflictRetry(result.applicationId(), application -> {
            if (application.state() != ApplicationState.SUBMITTING) {
                if (application.state().isTerminal()) {
                    discardResult(application, "submission", result.attemptNumber());
                }
                return false;
            }
            if (result.delivered()) {
                transition(
                    application,
                    application.toBuilder().state(ApplicationState.SUBMITTED).lastError(null).build(),
                    payload(
                        "attemptId", result.attemptId(),
                        "platform", result.platform(),
                        "deliveryId", result.deliveryId(),
                        "attempts", result.attemptNumber()
                    )
                );
                return true;
            }
            transition(
                application,
                application.toBuilder().state(ApplicationState.SUBMISSION_FAILED).lastError(result.lastError()).build(),
                payload("attemptId", result.attemptId(), "platform", result.platform(), "attempts", result.attemptNumber())
            );
            return false;
        });
        if (delivered) {
            dispatcher.dispatch(result.applicationId());
        }
    }

    public ApplicationRecord onApprovalDecision(long applicationId, ApprovalDecision decision, String reviewer) {
        if (decision == null) {
            throw new ValidationException("decision is required");
        }
        String reviewerName = reviewer == null || reviewer.isBlank() ? "unknown" : reviewer.trim();
        ApplicationRecord updated = withConflictRetry(applicationId, application -> {
            if (application.state() != ApplicationState.PENDING_APPROVAL) {
                throw new IllegalStateTransitionException(applicationId, application.state(), "receive an approval decision");
            }
            ApplicationState next = decision == ApprovalDecision.APPROVED ? ApplicationState.APPROVED : ApplicationState.REJECTED;
            return transition(
                application,
                application.toBuilder().state(next).approval(decision, reviewerName).build(),
                payload("decision", decision.name(), "reviewer", reviewerName)
            );
        });
        tracker.recordEvent(
            applicationId,
            ApplicationEventKind.APPROVAL_RECEIVED,
            payload("decision", decision.name(), "reviewer", reviewerName)
        );
        if (decision == ApprovalDecision.APPROVED) {
            dispatcher.dispatch(applicationId);
        }
        return updated;
    }

    public ApplicationRecord recordOutcome(long applicationId, Outcome outcome, Instant observedAt) {
        if (outcome == null) {
            throw new ValidationException("outcome is required");
        }
        Instant observed = observedAt == null ? clock.instant() : observedAt;
        ApplicationRecord closed = withConflictRetry(applicationId, application -> {
            if (application.state() != ApplicationState.TRACKING && application.state() != ApplicationState.SUBMITTED) {
                throw new IllegalStateTransitionException(applicationId, application.state(), "record an outcome");
            }
            return transition(
                application,
                application.toBuilder().state(ApplicationState.CLOSED).outcome(outcome).build(),
                payload("outcome", outcome.name(), "observedAt", observed.toString())
            );
        });
        tracker.cancelFollowUps(applicationId);
        tracker.recordEvent(
            applicationId,
            ApplicationEventKind.OUTCOME_RECORDED,
            payload("outcome", outcome.name(), "observedAt", observed.toString())
        );
        feedbackAdapter.recordOutcome(closed, outcome);
        return closed;
    }

    public ApplicationRecord cancel(long applicationId, String operator) {
        String operatorName = operator == null || operator.isBlank() ? "operator" : operator.trim();
        ApplicationRecord abandoned = withConflictRetry(applicationId, application -> {
            if (application.state().isTerminal()) {
                throw new IllegalStateTransitionException(applicationId, application.state(), "be cancelled");
            }
            return transition(
                application,
                application.toBuilder().state(ApplicationState.ABANDONED).build(),
                payload("operator", operatorName, "cancelledFrom", application.state().name())
            );
        });
        int withdrawn = submissionEngine.withdraw(applicationId);
        tracker.cancelFollowUps(applicationId);
        tracker.recordEvent(
            applicationId,
            ApplicationEventKind.CANCELLED,
            payload("operator", operatorName, "withdrawnAttempts", withdrawn)
        );
        return abandoned;
    }

    /**
     * Clears an expired admission deferral and puts the application back in line.
     */
    public boolean releaseDeferred(long applicationId) {
        boolean released = withConflictRetry(applicationId, application -> {
            if (application.state() != ApplicationState.SCORED || application.deferredUntil() == null) {
                return false;
            }
            applications.compareAndSet(application, application.toBuilder().deferredUntil(null).build(), clock.instant());
            return true;
        });
        if (released) {
            dispatcher.dispatch(applicationId);
        }
        return released;
    }

    /**
     * Re-dispatches every application that was progressing automatically when the process
     * stopped. Applications waiting on a reviewer or on tracking are left alone.
     */
    public int resumeInFlight() {
        List<Long> ids = applications.findIdsInStates(RESUMABLE, RESUME_BATCH);
        for (Long id : ids) {
            dispatcher.dispatch(id);
        }
        if (!ids.isEmpty()) {
            log.info("Resumed {} in-flight application(s)", ids.size());
        }
        return ids.size();
    }

    // ---------------------------------------------------------------- queries

    public ApplicationRecord getApplication(long applicationId) {
        return requireApplication(applicationId);
    }

    public List<ApplicationRecord> applicationsFor(String userId) {
        return applications.findByUser(requireUserId(userId));
    }

    // ---------------------------------------------------------------- helpers

    private ApplicationRecord transition(ApplicationRecord current, ApplicationRecord next, Map<String, Object> payload) {
        if (current.state() != next.state() && !current.state().canTransitionTo(next.state())) {
            throw new IllegalStateException(
                "Illegal transition " + current.state() + " -> " + next.state() + " for application " + current.id()
            );
        }
        // the state write and its timeline entry commit together
        return transactionTemplate.execute(status -> {
            ApplicationRecord updated = applications.compareAndSet(current, next, clock.instant());
            if (current.state() != updated.state()) {
                tracker.recordTransition(updated.id(), current.state(), updated.state(), payload);
            }
            return updated;
        });
    }

    /**
     * Applies {@code action} to freshly read state, re-reading and re-applying after each lost
     * compare-and-set.
     */
    private <T> T withConflictRetry(long applicationId, Function<ApplicationRecord, T> action) {
        int limit = properties.getOrchestrator().getConflictRetryLimit();
        for (int attempt = 0; ; attempt++) {
            ApplicationRecord current = requireApplication(applicationId);
            try {
                return action.apply(current);
            } catch (ConflictException e) {
                if (attempt >= limit) {
                    throw new TransientException("Application " + applicationId + " kept changing concurrently", e);
                }
                log.debug("Version conflict on application {} (attempt {}); retrying", applicationId, attempt + 1);
            }
        }
    }

    private void discardResult(ApplicationRecord application, String kind, int attempt) {
        tracker.recordEvent(
            application.id(),
            ApplicationEventKind.RESULT_DISCARDED,
            payload("result", kind, "attempt", attempt, "state", application.state().name())
        );
        log.info("Discarded late {} result for application {} in state {}", kind, application.id(), application.state());
    }

    private void scheduleDispatch(long applicationId, Duration delay) {
        try {
            scheduler.schedule(() -> dispatcher.dispatch(applicationId), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Could not reschedule application {}", applicationId, e);
        }
    }

    private ApplicationPackage buildPackage(ApplicationRecord application) {
        Opportunity opportunity = ingestionService.findById(application.opportunityId());
        String content = "";
        String ref = application.generatedContentRef();
        if (ref != null && ref.startsWith(DRAFT_REF_PREFIX)) {
            try {
                long draftId = Long.parseLong(ref.substring(DRAFT_REF_PREFIX.length()));
                content = applications.findDraftContent(draftId).orElse("");
            } catch (NumberFormatException e) {
                log.warn("Application {} has malformed content reference {}", application.id(), ref);
            }
        }
        return new ApplicationPackage(
            application.id(),
            opportunity.id(),
            application.userId(),
            application.tier() == null ? 3 : application.tier(),
            opportunity.fields().deadline(),
            opportunity.fields().title(),
            opportunity.fields().organization(),
            opportunity.fields().url(),
            content,
            application.qualityScore()
        );
    }

    private String resolvePlatform(Opportunity opportunity) {
        String platform = opportunity.fields().applicationPlatform();
        if (platform == null || platform.isBlank()) {
            platform = properties.getSubmission().getDefaultPlatform();
        }
        return platform.trim().toLowerCase(Locale.ROOT);
    }

    private UserProfile profileFor(String userId) {
        return profiles.find(userId).orElseGet(() -> new UserProfile(
            userId,
            List.of(),
            List.of(),
            0,
            List.of(),
            null,
            null,
            Map.of(),
            null
        ));
    }

    private AutomationLevel effectiveAutomationLevel(String userId) {
        AutomationLevel override = profileFor(userId).automationLevel();
        return override != null ? override : properties.getAutomation().getLevel();
    }

    private ApplicationRecord requireApplication(long applicationId) {
        return applications.findById(applicationId)
            .orElseThrow(() -> new NotFoundException("Application " + applicationId + " not found"));
    }

    private static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        return userId.trim();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isRetryable(Throwable error) {
        return error == null || error instanceof TransientException || error instanceof TimeoutException;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "generator returned no draft";
        }
        if (error instanceof TimeoutException) {
            return "generator_timeout";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static Map<String, Object> payload(Object... keysAndValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                payload.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
            }
        }
        return payload;
    }
}
