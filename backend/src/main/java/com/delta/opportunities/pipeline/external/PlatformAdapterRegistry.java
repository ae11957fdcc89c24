package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.config.PipelineProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the adapter for a platform name. Adapter beans win; every other configured platform
 * with an endpoint gets an {@link HttpPlatformAdapter}.
 */
@Component
public class PlatformAdapterRegistry {
    private static final Logger log = LoggerFactory.getLogger(PlatformAdapterRegistry.class);

    private final Map<String, PlatformAdapter> adapters = new LinkedHashMap<>();

    public PlatformAdapterRegistry(
        List<PlatformAdapter> adapterBeans,
        PipelineProperties properties,
        JsonHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        for (PlatformAdapter adapter : adapterBeans) {
            adapters.put(key(adapter.platform()), adapter);
        }
        Duration timeout = Duration.ofSeconds(properties.getSubmission().getRequestTimeoutSeconds());
        for (Map.Entry<String, PipelineProperties.Platform> entry : properties.getSubmission().getPlatforms().entrySet()) {
            String name = key(entry.getKey());
            String endpoint = entry.getValue().getEndpoint();
            if (adapters.containsKey(name) || endpoint == null || endpoint.isBlank()) {
                continue;
            }
            adapters.put(name, new HttpPlatformAdapter(name, endpoint, timeout, httpClient, objectMapper));
        }
        log.info("Platform adapters available: {}", adapters.keySet());
    }

    public Optional<PlatformAdapter> find(String platform) {
        return Optional.ofNullable(adapters.get(key(platform)));
    }

    public Set<String> platforms() {
        return adapters.keySet();
    }

    static String key(String platform) {
        return platform == null ? "" : platform.trim().toLowerCase(Locale.ROOT);
    }
}
