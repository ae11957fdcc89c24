package com.delta.opportunities.pipeline.model;

import java.time.Instant;

public record SweepSummary(
    Instant sweptAt,
    int followUpsDispatched,
    int noResponseClosed,
    int deferredReleased,
    int opportunitiesArchived
) {
}
