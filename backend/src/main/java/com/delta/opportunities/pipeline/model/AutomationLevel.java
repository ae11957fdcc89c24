package com.delta.opportunities.pipeline.model;

public enum AutomationLevel {
    /** High-quality drafts are approved and submitted without a reviewer. */
    FULL_AUTO,
    /** Every draft waits for a reviewer decision. */
    SEMI_AUTO
}
