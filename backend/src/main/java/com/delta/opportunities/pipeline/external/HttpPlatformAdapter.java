package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.pipeline.error.PermanentFailureException;
import com.delta.opportunities.pipeline.error.TransientException;
import com.delta.opportunities.pipeline.model.ApplicationPackage;
import com.delta.opportunities.pipeline.model.DeliveryReceipt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.Map;

/**
 * Generic HTTP delivery: POST the package as JSON with an {@code Idempotency-Key} header.
 * A 409 means the platform already holds a delivery for the key; other 4xx answers are final.
 */
public class HttpPlatformAdapter implements PlatformAdapter {
    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final String platform;
    private final String endpoint;
    private final Duration timeout;
    private final JsonHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpPlatformAdapter(
        String platform,
        String endpoint,
        Duration timeout,
        JsonHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        this.platform = platform;
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String platform() {
        return platform;
    }

    @Override
    public DeliveryReceipt deliver(ApplicationPackage applicationPackage, String idempotencyKey) {
        String body;
        try {
            body = objectMapper.writeValueAsString(applicationPackage);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize application package", e);
        }
        JsonHttpClient.JsonResponse response = httpClient.postJson(
            endpoint,
            body,
            Map.of(IDEMPOTENCY_HEADER, idempotencyKey),
            timeout
        );
        if (response.statusCode() == 409) {
            return new DeliveryReceipt(deliveryIdFrom(response.body(), idempotencyKey), true);
        }
        if (!response.isSuccessful()) {
            String message = platform + " delivery failed: " + response.describe();
            if (!response.isRetryable()) {
                throw new PermanentFailureException(message);
            }
            throw new TransientException(message);
        }
        return new DeliveryReceipt(deliveryIdFrom(response.body(), idempotencyKey), false);
    }

    private String deliveryIdFrom(String body, String fallback) {
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode id = node.get("deliveryId");
            if (id == null || id.isNull() || id.asText().isBlank()) {
                return fallback;
            }
            return id.asText();
        } catch (JsonProcessingException e) {
            return fallback;
        }
    }
}
