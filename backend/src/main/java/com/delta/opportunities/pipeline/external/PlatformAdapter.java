package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.pipeline.model.ApplicationPackage;
import com.delta.opportunities.pipeline.model.DeliveryReceipt;

/**
 * Delivers an application package to one external platform. Implementations must treat the
 * idempotency key as the identity of the delivery: repeating a call with the same key never
 * creates a second application on the platform.
 */
public interface PlatformAdapter {

    String platform();

    /**
     * @throws com.delta.opportunities.pipeline.error.TransientException when the delivery may be retried;
     *         any other exception fails the submission at once
     */
    DeliveryReceipt deliver(ApplicationPackage applicationPackage, String idempotencyKey);
}
