package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.error.PermanentFailureException;
import com.delta.opportunities.pipeline.error.TransientException;
import com.delta.opportunities.pipeline.model.Opportunity;
import com.delta.opportunities.pipeline.model.OpportunityFields;
import com.delta.opportunities.pipeline.model.OpportunityType;
import com.delta.opportunities.pipeline.model.UserProfile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpGeneratorClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ObjectMapper objectMapper;
    private PipelineProperties properties;
    private HttpGeneratorClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        properties = new PipelineProperties();
        properties.getGenerator().setEndpoint(server.url("/generate").toString());
        properties.getGenerator().setTimeoutSeconds(5);
        client = new HttpGeneratorClient(new JsonHttpClient(properties, executor), objectMapper, properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void postsRequestAndParsesDraft() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"content\":\"Dear hiring team\",\"qualityScore\":1.7}"));

        GeneratedDraft draft = client.generate(request());

        assertThat(draft.content()).isEqualTo("Dear hiring team");
        assertThat(draft.qualityScore()).isEqualTo(1.0);
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertThat(body.get("applicationId").asLong()).isEqualTo(11L);
        assertThat(body.get("opportunity").get("fields").get("title").asText()).isEqualTo("Research Intern");
        assertThat(body.get("constraints").get("tier").asInt()).isEqualTo(1);
    }

    @Test
    void rejectedRequestIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("profile incomplete"));

        assertThatThrownBy(() -> client.generate(request()))
            .isInstanceOf(PermanentFailureException.class)
            .hasMessageContaining("http_400");
    }

    @Test
    void serverErrorIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

        assertThatThrownBy(() -> client.generate(request()))
            .isInstanceOf(TransientException.class)
            .hasMessageContaining("http_503");
    }

    @Test
    void missingContentIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"qualityScore\":0.9}"));

        assertThatThrownBy(() -> client.generate(request()))
            .isInstanceOf(TransientException.class)
            .hasMessageContaining("no content");
    }

    @Test
    void unconfiguredEndpointIsTransient() {
        properties.getGenerator().setEndpoint(" ");

        assertThatThrownBy(() -> client.generate(request()))
            .isInstanceOf(TransientException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    private static GenerationRequest request() {
        OpportunityFields fields = new OpportunityFields(
            null, "Research Intern", "Lab", "https://lab.example/x", "https://lab.example/x", "desc",
            OpportunityType.RESEARCH, null, null, false, List.of(), List.of(), null, null, null, null, Map.of()
        );
        Instant now = Instant.parse("2026-02-01T00:00:00Z");
        Opportunity opportunity = new Opportunity(3L, "fp", Set.of("lab-feed"), fields, 1, 0.9, now, now, null);
        UserProfile profile = new UserProfile("user", List.of("python"), List.of(), 1, List.of(), null, null, Map.of(), null);
        return new GenerationRequest(11L, profile, opportunity, Map.of("tier", 1));
    }
}
