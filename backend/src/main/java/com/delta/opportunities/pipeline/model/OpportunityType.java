package com.delta.opportunities.pipeline.model;

import java.util.Locale;

public enum OpportunityType {
    JOB,
    SCHOLARSHIP,
    FELLOWSHIP,
    ACCELERATOR,
    GRANT,
    RESEARCH,
    EVENT,
    COMPETITION,
    OTHER;

    /**
     * Parses a free-text type. Blank input is "not provided" and yields {@code null}; unknown
     * labels map to {@link #OTHER}.
     */
    public static OpportunityType fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OpportunityType.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_'));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
