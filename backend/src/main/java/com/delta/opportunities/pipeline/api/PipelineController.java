package com.delta.opportunities.pipeline.api;

import com.delta.opportunities.pipeline.error.NotFoundException;
import com.delta.opportunities.pipeline.error.ValidationException;
import com.delta.opportunities.pipeline.ingest.OpportunityIngestionService;
import com.delta.opportunities.pipeline.model.ApplicationRecord;
import com.delta.opportunities.pipeline.model.DiscoverySummary;
import com.delta.opportunities.pipeline.model.FollowUpTask;
import com.delta.opportunities.pipeline.model.FunnelCounts;
import com.delta.opportunities.pipeline.model.Opportunity;
import com.delta.opportunities.pipeline.model.PlatformQueueStats;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import com.delta.opportunities.pipeline.model.ScoringWeights;
import com.delta.opportunities.pipeline.model.UserProfile;
import com.delta.opportunities.pipeline.orchestrator.WorkflowOrchestrator;
import com.delta.opportunities.pipeline.persistence.ProfileJdbcRepository;
import com.delta.opportunities.pipeline.scoring.ScoringWeightsRegistry;
import com.delta.opportunities.pipeline.submission.SubmissionEngine;
import com.delta.opportunities.pipeline.tracking.StatusTrackerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api")
public class PipelineController {
    private final WorkflowOrchestrator orchestrator;
    private final OpportunityIngestionService ingestionService;
    private final ProfileJdbcRepository profiles;
    private final StatusTrackerService tracker;
    private final ScoringWeightsRegistry weightsRegistry;
    private final SubmissionEngine submissionEngine;
    private final Clock clock;

    public PipelineController(
        WorkflowOrchestrator orchestrator,
        OpportunityIngestionService ingestionService,
        ProfileJdbcRepository profiles,
        StatusTrackerService tracker,
        ScoringWeightsRegistry weightsRegistry,
        SubmissionEngine submissionEngine,
        Clock clock
    ) {
        this.orchestrator = orchestrator;
        this.ingestionService = ingestionService;
        this.profiles = profiles;
        this.tracker = tracker;
        this.weightsRegistry = weightsRegistry;
        this.submissionEngine = submissionEngine;
        this.clock = clock;
    }

    @PutMapping("/users/{userId}/profile")
    public UserProfile saveProfile(@PathVariable("userId") String userId, @RequestBody(required = false) UserProfile profile) {
        if (profile == null) {
            throw new ValidationException("profile body is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        UserProfile stored = profile.withUserId(userId.trim());
        profiles.save(stored, clock.instant());
        return stored;
    }

    @GetMapping("/users/{userId}/profile")
    public UserProfile getProfile(@PathVariable("userId") String userId) {
        return profiles.find(userId)
            .orElseThrow(() -> new NotFoundException("Profile for user " + userId + " not found"));
    }

    @PostMapping("/users/{userId}/opportunities")
    public DiscoverySummary discover(
        @PathVariable("userId") String userId,
        @RequestBody(required = false) List<RawOpportunity> opportunities
    ) {
        return orchestrator.discoverBatch(userId, opportunities);
    }

    @GetMapping("/users/{userId}/applications")
    public List<ApplicationRecord> applications(@PathVariable("userId") String userId) {
        return orchestrator.applicationsFor(userId);
    }

    @GetMapping("/users/{userId}/funnel")
    public FunnelCounts funnel(@PathVariable("userId") String userId) {
        return tracker.funnel(userId);
    }

    @GetMapping("/users/{userId}/follow-ups")
    public List<FollowUpTask> followUps(@PathVariable("userId") String userId) {
        return tracker.pendingFollowUps(userId);
    }

    @GetMapping("/opportunities/{id}")
    public Opportunity opportunity(@PathVariable("id") long id) {
        return ingestionService.findById(id);
    }

    @GetMapping("/scoring/weights")
    public ScoringWeights weights() {
        return weightsRegistry.current();
    }

    @PutMapping("/scoring/weights")
    public ScoringWeights overrideWeights(@RequestBody(required = false) WeightsOverrideRequest request) {
        if (request == null || request.weights() == null || request.weights().isEmpty()) {
            throw new ValidationException("weights are required");
        }
        return weightsRegistry.override(request.weights(), request.tier1Threshold(), request.tier2Threshold());
    }

    @GetMapping("/submissions/queues")
    public List<PlatformQueueStats> queues() {
        return submissionEngine.queueStats();
    }
}
