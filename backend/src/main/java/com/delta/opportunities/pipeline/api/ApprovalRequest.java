package com.delta.opportunities.pipeline.api;

import com.delta.opportunities.pipeline.model.ApprovalDecision;

public record ApprovalRequest(
    ApprovalDecision decision,
    String reviewer
) {
}
