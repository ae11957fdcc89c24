package com.delta.opportunities.pipeline.model;

public enum QuotaExhaustedPolicy {
    SKIP,
    DEFER
}
