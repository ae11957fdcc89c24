package com.delta.opportunities.pipeline.model;

/**
 * Acknowledgement from a platform. {@code duplicate} is set when the platform recognized the
 * idempotency key and did not deliver again.
 */
public record DeliveryReceipt(
    String deliveryId,
    boolean duplicate
) {
}
