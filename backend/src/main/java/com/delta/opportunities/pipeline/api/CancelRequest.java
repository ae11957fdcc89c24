package com.delta.opportunities.pipeline.api;

public record CancelRequest(
    String operator
) {
}
