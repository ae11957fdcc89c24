package com.delta.opportunities.pipeline.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an application. Terminal states accept no further transition; every
 * non-terminal state may additionally move to {@link #ABANDONED} on operator cancellation.
 */
public enum ApplicationState {
    DISCOVERED(false),
    SCORED(false),
    ADMITTED(false),
    SKIPPED(true),
    GENERATION_REQUESTED(false),
    GENERATED(false),
    AUTO_APPROVED(false),
    PENDING_APPROVAL(false),
    APPROVED(false),
    REJECTED(true),
    SUBMITTING(false),
    SUBMITTED(false),
    SUBMISSION_FAILED(true),
    TRACKING(false),
    CLOSED(true),
    ABANDONED(true);

    private final boolean terminal;

    ApplicationState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public Set<ApplicationState> successors() {
        Set<ApplicationState> next = switch (this) {
            case DISCOVERED -> EnumSet.of(SCORED);
            case SCORED -> EnumSet.of(ADMITTED, SKIPPED);
            case ADMITTED -> EnumSet.of(GENERATION_REQUESTED);
            case GENERATION_REQUESTED -> EnumSet.of(GENERATED, SKIPPED);
            case GENERATED -> EnumSet.of(AUTO_APPROVED, PENDING_APPROVAL);
            case AUTO_APPROVED -> EnumSet.of(APPROVED);
            case PENDING_APPROVAL -> EnumSet.of(APPROVED, REJECTED);
            case APPROVED -> EnumSet.of(SUBMITTING);
            case SUBMITTING -> EnumSet.of(SUBMITTED, SUBMISSION_FAILED);
            case SUBMITTED -> EnumSet.of(TRACKING, CLOSED);
            case TRACKING -> EnumSet.of(CLOSED);
            default -> EnumSet.noneOf(ApplicationState.class);
        };
        if (!terminal) {
            next.add(ABANDONED);
        }
        return next;
    }

    public boolean canTransitionTo(ApplicationState target) {
        return target != null && successors().contains(target);
    }
}
