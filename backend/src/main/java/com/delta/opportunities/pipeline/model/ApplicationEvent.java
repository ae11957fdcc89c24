package com.delta.opportunities.pipeline.model;

import java.time.Instant;
import java.util.Map;

public record ApplicationEvent(
    long id,
    long applicationId,
    ApplicationEventKind kind,
    ApplicationState fromState,
    ApplicationState toState,
    Map<String, Object> payload,
    Instant occurredAt
) {
}
