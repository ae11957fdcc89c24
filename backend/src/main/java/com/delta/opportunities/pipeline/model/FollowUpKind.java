package com.delta.opportunities.pipeline.model;

public enum FollowUpKind {
    STATUS_CHECK,
    THANK_YOU,
    ADDITIONAL_INFO,
    OFFER_RESPONSE
}
