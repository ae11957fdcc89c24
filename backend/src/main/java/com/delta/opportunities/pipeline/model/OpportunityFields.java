package com.delta.opportunities.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Canonical content of a stored opportunity. A later sighting of the same fingerprint only
 * overwrites the values it actually carries.
 */
public record OpportunityFields(
    String externalId,
    String title,
    String organization,
    String url,
    String canonicalUrl,
    String description,
    OpportunityType opportunityType,
    Instant deadline,
    String location,
    boolean remote,
    List<String> tags,
    List<String> requiredSkills,
    Integer requiredExperienceYears,
    Double salaryMin,
    Double salaryMax,
    String applicationPlatform,
    Map<String, String> attributes
) {
    public OpportunityFields {
        opportunityType = opportunityType == null ? OpportunityType.JOB : opportunityType;
        tags = tags == null ? List.of() : List.copyOf(tags);
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
