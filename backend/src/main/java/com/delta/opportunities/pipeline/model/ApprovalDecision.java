package com.delta.opportunities.pipeline.model;

public enum ApprovalDecision {
    APPROVED,
    REJECTED
}
