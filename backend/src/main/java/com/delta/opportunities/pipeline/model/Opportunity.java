package com.delta.opportunities.pipeline.model;

import java.time.Instant;
import java.util.Set;

public record Opportunity(
    long id,
    String fingerprint,
    Set<String> sources,
    OpportunityFields fields,
    Integer tier,
    Double score,
    Instant discoveredAt,
    Instant updatedAt,
    Instant archivedAt
) {
    public Opportunity {
        sources = sources == null ? Set.of() : Set.copyOf(sources);
    }
}
