package com.delta.opportunities.pipeline.external;

/**
 * Produces application material (cover letter, essay answers) for one application.
 * Implementations may block; the orchestrator calls them off its worker pool with a timeout.
 */
public interface Generator {

    /**
     * @throws com.delta.opportunities.pipeline.error.TransientException on any recoverable failure
     * @throws com.delta.opportunities.pipeline.error.PermanentFailureException when the request was refused
     */
    GeneratedDraft generate(GenerationRequest request);
}
