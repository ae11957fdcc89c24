package com.delta.opportunities.pipeline.orchestrator;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.submission.SubmissionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Picks up work interrupted by the previous shutdown: submissions that were on the wire and
 * applications that were advancing automatically.
 */
@Component
@Order(0)
public class PipelineRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineRecoveryRunner.class);

    private final SubmissionEngine submissionEngine;
    private final WorkflowOrchestrator orchestrator;
    private final PipelineProperties properties;

    public PipelineRecoveryRunner(
        SubmissionEngine submissionEngine,
        WorkflowOrchestrator orchestrator,
        PipelineProperties properties
    ) {
        this.submissionEngine = submissionEngine;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.getSubmission().isRecoverOnStartup()) {
            try {
                int recovered = submissionEngine.recover();
                log.info("Recovered {} pending submission attempt(s)", recovered);
            } catch (Exception e) {
                log.warn("Submission recovery failed", e);
            }
        }
        if (properties.getOrchestrator().isResumeOnStartup()) {
            try {
                orchestrator.resumeInFlight();
            } catch (Exception e) {
                log.warn("Resuming in-flight applications failed", e);
            }
        }
    }
}
