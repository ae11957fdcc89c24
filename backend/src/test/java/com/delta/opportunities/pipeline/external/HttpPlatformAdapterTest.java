package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.error.PermanentFailureException;
import com.delta.opportunities.pipeline.error.TransientException;
import com.delta.opportunities.pipeline.model.ApplicationPackage;
import com.delta.opportunities.pipeline.model.DeliveryReceipt;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpPlatformAdapterTest {
    private MockWebServer server;
    private ExecutorService executor;
    private HttpPlatformAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        JsonHttpClient httpClient = new JsonHttpClient(new PipelineProperties(), executor);
        adapter = new HttpPlatformAdapter("email", server.url("/deliver").toString(), Duration.ofSeconds(5), httpClient, objectMapper);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void sendsIdempotencyKeyAndReadsDeliveryId() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"deliveryId\":\"msg-77\"}"));

        DeliveryReceipt receipt = adapter.deliver(applicationPackage(), "app-5-email");

        assertThat(receipt.deliveryId()).isEqualTo("msg-77");
        assertThat(receipt.duplicate()).isFalse();
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getHeader(HttpPlatformAdapter.IDEMPOTENCY_HEADER)).isEqualTo("app-5-email");
        assertThat(recorded.getBody().readUtf8()).contains("\"applicationId\":5");
    }

    @Test
    void conflictMeansAlreadyDelivered() {
        server.enqueue(new MockResponse().setResponseCode(409).setBody(""));

        DeliveryReceipt receipt = adapter.deliver(applicationPackage(), "app-5-email");

        assertThat(receipt.duplicate()).isTrue();
        assertThat(receipt.deliveryId()).isEqualTo("app-5-email");
    }

    @Test
    void serverFailureIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(502));

        assertThatThrownBy(() -> adapter.deliver(applicationPackage(), "app-5-email"))
            .isInstanceOf(TransientException.class)
            .hasMessageContaining("email delivery failed");
    }

    @Test
    void clientErrorIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"missing resume\"}"));

        assertThatThrownBy(() -> adapter.deliver(applicationPackage(), "app-5-email"))
            .isInstanceOf(PermanentFailureException.class)
            .hasMessageContaining("http_400");
    }

    @Test
    void throttlingStaysTransient() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThatThrownBy(() -> adapter.deliver(applicationPackage(), "app-5-email"))
            .isInstanceOf(TransientException.class);
    }

    private static ApplicationPackage applicationPackage() {
        return new ApplicationPackage(
            5L, 9L, "user", 1, Instant.parse("2026-07-01T00:00:00Z"), "Engineer", "Acme",
            "https://acme.example/jobs/1", "Hello", 0.8
        );
    }
}
