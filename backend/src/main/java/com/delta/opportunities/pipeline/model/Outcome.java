package com.delta.opportunities.pipeline.model;

public enum Outcome {
    ACCEPTED(1.0),
    REJECTED(0.0),
    NO_RESPONSE(0.0);

    private final double target;

    Outcome(double target) {
        this.target = target;
    }

    /**
     * Value the fit score should have predicted for this outcome.
     */
    public double target() {
        return target;
    }
}
