package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Thin JSON POST client shared by the collaborator adapters. Never throws on transport
 * problems: failures come back as a result with an error code, and callers decide what is
 * retryable.
 */
@Service
public class JsonHttpClient {
    private final PipelineProperties properties;
    private final HttpClient client;

    public JsonHttpClient(PipelineProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getSubmission().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public record JsonResponse(
        int statusCode,
        String body,
        Duration elapsed,
        String errorCode,
        String errorMessage
    ) {
        public boolean isSuccessful() {
            return errorCode == null && statusCode >= 200 && statusCode < 300;
        }

        public boolean isRetryable() {
            if (errorCode != null) {
                return !"invalid_url".equals(errorCode) && !"interrupted".equals(errorCode);
            }
            return statusCode == 408 || statusCode == 429 || statusCode >= 500;
        }

        public String describe() {
            if (errorCode != null) {
                return errorCode + (errorMessage == null ? "" : ": " + errorMessage);
            }
            return "http_" + statusCode;
        }
    }

    public JsonResponse postJson(String url, String jsonBody, Map<String, String> headers, Duration timeout) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return new JsonResponse(0, null, Duration.ZERO, "invalid_url", "URL missing host or malformed: " + url);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("User-Agent", PipelineProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", "application/json")
            .header("Content-Type", "application/json");
        if (headers != null) {
            headers.forEach(builder::header);
        }
        HttpRequest request = builder
            .POST(HttpRequest.BodyPublishers.ofString(jsonBody == null ? "" : jsonBody, StandardCharsets.UTF_8))
            .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new JsonResponse(
                response.statusCode(),
                response.body(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResponse(startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResponse(startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResponse(startedAt, "interrupted", e.getMessage());
        }
    }

    private JsonResponse errorResponse(Instant startedAt, String code, String message) {
        return new JsonResponse(0, null, Duration.between(startedAt, Instant.now()), code, message);
    }

    private static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
