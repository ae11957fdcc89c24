package com.delta.opportunities.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * An opportunity as handed over by a source scraper, before canonicalization.
 */
public record RawOpportunity(
    String source,
    String externalId,
    String title,
    String organization,
    String url,
    String description,
    OpportunityType opportunityType,
    Instant deadline,
    String location,
    Boolean remote,
    List<String> tags,
    List<String> requiredSkills,
    Integer requiredExperienceYears,
    Double salaryMin,
    Double salaryMax,
    String applicationPlatform,
    Map<String, String> attributes
) {
    public static RawOpportunity of(String source, String title, String organization, String url, String description) {
        return new RawOpportunity(
            source,
            null,
            title,
            organization,
            url,
            description,
            null,
            null,
            null,
            null,
            List.of(),
            List.of(),
            null,
            null,
            null,
            null,
            Map.of()
        );
    }
}
