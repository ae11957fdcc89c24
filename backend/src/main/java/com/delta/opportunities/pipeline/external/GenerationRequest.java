package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.pipeline.model.Opportunity;
import com.delta.opportunities.pipeline.model.UserProfile;

import java.util.Map;

public record GenerationRequest(
    long applicationId,
    UserProfile profile,
    Opportunity opportunity,
    Map<String, Object> constraints
) {
    public GenerationRequest {
        constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
    }
}
