package com.delta.opportunities.pipeline.orchestrator;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Result of the admission check for one scored application.
 */
public record AdmissionDecision(
    Verdict verdict,
    String reason,
    LocalDate quotaDay,
    Instant deferredUntil
) {
    public enum Verdict {
        ADMIT,
        SKIP,
        DEFER
    }

    public static AdmissionDecision admit(LocalDate quotaDay) {
        return new AdmissionDecision(Verdict.ADMIT, null, quotaDay, null);
    }

    public static AdmissionDecision skip(String reason) {
        return new AdmissionDecision(Verdict.SKIP, reason, null, null);
    }

    public static AdmissionDecision defer(String reason, Instant until) {
        return new AdmissionDecision(Verdict.DEFER, reason, null, until);
    }
}
