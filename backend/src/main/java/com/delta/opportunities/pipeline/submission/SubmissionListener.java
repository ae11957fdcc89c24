package com.delta.opportunities.pipeline.submission;

import com.delta.opportunities.pipeline.model.SubmissionResult;

/**
 * Receives the single terminal result of each submission attempt.
 */
public interface SubmissionListener {

    void onSubmissionResult(SubmissionResult result);
}
