package com.delta.opportunities.pipeline.model;

public enum SubmissionStatus {
    QUEUED(false),
    IN_FLIGHT(false),
    RETRY_SCHEDULED(false),
    DELIVERED(true),
    FAILED(true),
    EXPIRED(true);

    private final boolean terminal;

    SubmissionStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
