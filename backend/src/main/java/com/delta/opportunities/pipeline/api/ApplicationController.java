package com.delta.opportunities.pipeline.api;

import com.delta.opportunities.pipeline.error.ValidationException;
import com.delta.opportunities.pipeline.model.ApplicationEvent;
import com.delta.opportunities.pipeline.model.ApplicationRecord;
import com.delta.opportunities.pipeline.model.SubmissionAttempt;
import com.delta.opportunities.pipeline.orchestrator.WorkflowOrchestrator;
import com.delta.opportunities.pipeline.submission.SubmissionEngine;
import com.delta.opportunities.pipeline.tracking.StatusTrackerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/applications")
public class ApplicationController {
    private final WorkflowOrchestrator orchestrator;
    private final StatusTrackerService tracker;
    private final SubmissionEngine submissionEngine;

    public ApplicationController(
        WorkflowOrchestrator orchestrator,
        StatusTrackerService tracker,
        SubmissionEngine submissionEngine
    ) {
        this.orchestrator = orchestrator;
        this.tracker = tracker;
        this.submissionEngine = submissionEngine;
    }

    @GetMapping("/{id}")
    public ApplicationRecord getApplication(@PathVariable("id") long id) {
        return orchestrator.getApplication(id);
    }

    @GetMapping("/{id}/timeline")
    public List<ApplicationEvent> timeline(@PathVariable("id") long id) {
        orchestrator.getApplication(id);
        return tracker.timeline(id);
    }

    @GetMapping("/{id}/submissions")
    public List<SubmissionAttempt> submissions(@PathVariable("id") long id) {
        orchestrator.getApplication(id);
        return submissionEngine.attemptsFor(id);
    }

    @PostMapping("/{id}/approval")
    public ApplicationRecord approval(@PathVariable("id") long id, @RequestBody(required = false) ApprovalRequest request) {
        if (request == null || request.decision() == null) {
            throw new ValidationException("decision is required");
        }
        return orchestrator.onApprovalDecision(id, request.decision(), request.reviewer());
    }

    @PostMapping("/{id}/outcome")
    public ApplicationRecord outcome(@PathVariable("id") long id, @RequestBody(required = false) OutcomeRequest request) {
        if (request == null || request.outcome() == null) {
            throw new ValidationException("outcome is required");
        }
        return orchestrator.recordOutcome(id, request.outcome(), request.observedAt());
    }

    @PostMapping("/{id}/cancel")
    public ApplicationRecord cancel(@PathVariable("id") long id, @RequestBody(required = false) CancelRequest request) {
        return orchestrator.cancel(id, request == null ? null : request.operator());
    }
}
