package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.error.PermanentFailureException;
import com.delta.opportunities.pipeline.error.TransientException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Calls the external generation service: POST {endpoint} with the profile, the opportunity and
 * constraints, expecting {@code {"content": "...", "qualityScore": 0.83}} back.
 */
@Component
public class HttpGeneratorClient implements Generator {
    private static final Logger log = LoggerFactory.getLogger(HttpGeneratorClient.class);

    private final JsonHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    public HttpGeneratorClient(JsonHttpClient httpClient, ObjectMapper objectMapper, PipelineProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public GeneratedDraft generate(GenerationRequest request) {
        String endpoint = properties.getGenerator().getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            throw new TransientException("generator endpoint is not configured");
        }
        String body;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("applicationId", request.applicationId());
            payload.set("profile", objectMapper.valueToTree(request.profile()));
            payload.set("opportunity", objectMapper.valueToTree(request.opportunity()));
            payload.set("constraints", objectMapper.valueToTree(request.constraints()));
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Unable to serialize generation request", e);
        }

        Duration timeout = Duration.ofSeconds(properties.getGenerator().getTimeoutSeconds());
        JsonHttpClient.JsonResponse response = httpClient.postJson(endpoint, body, Map.of(), timeout);
        if (!response.isSuccessful()) {
            log.warn("Generator call for application {} failed: {}", request.applicationId(), response.describe());
            String message = "generator call failed: " + response.describe();
            if (!response.isRetryable()) {
                throw new PermanentFailureException(message);
            }
            throw new TransientException(message);
        }
        try {
            JsonNode node = objectMapper.readTree(response.body());
            JsonNode content = node.get("content");
            if (content == null || content.isNull() || content.asText().isBlank()) {
                throw new TransientException("generator returned no content");
            }
            JsonNode quality = node.get("qualityScore");
            double qualityScore = quality == null || !quality.isNumber() ? 0.0 : quality.asDouble();
            return new GeneratedDraft(content.asText(), Math.max(0.0, Math.min(1.0, qualityScore)));
        } catch (JsonProcessingException e) {
            throw new TransientException("generator returned malformed JSON", e);
        }
    }
}
