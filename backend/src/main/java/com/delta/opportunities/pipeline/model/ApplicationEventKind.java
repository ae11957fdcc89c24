package com.delta.opportunities.pipeline.model;

public enum ApplicationEventKind {
    STATE_CHANGED,
    ADMISSION_DEFERRED,
    GENERATION_FAILED,
    RESULT_DISCARDED,
    APPROVAL_RECEIVED,
    SUBMISSION_QUEUED,
    SUBMISSION_ATTEMPT_FAILED,
    FOLLOW_UP_SCHEDULED,
    FOLLOW_UP_DUE,
    OUTCOME_RECORDED,
    CANCELLED
}
