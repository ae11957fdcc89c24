package com.delta.opportunities.pipeline.ingest;

import com.delta.opportunities.pipeline.error.ValidationException;
import com.delta.opportunities.pipeline.model.OpportunityFields;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import com.delta.opportunities.pipeline.util.OpportunityUrlUtils;
import com.delta.opportunities.pipeline.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class OpportunityCanonicalizer {

    /**
     * Validates a raw record and turns it into canonical fields.
     *
     * @throws ValidationException listing every missing or malformed field
     */
    public OpportunityFields canonicalize(RawOpportunity raw) {
        if (raw == null) {
            throw new ValidationException("opportunity is required");
        }
        List<String> violations = new ArrayList<>();
        String title = TextNormalizer.trimToNull(raw.title());
        String organization = TextNormalizer.trimToNull(raw.organization());
        String url = TextNormalizer.trimToNull(raw.url());
        String description = TextNormalizer.trimToNull(TextNormalizer.stripHtml(raw.description()));
        String canonicalUrl = OpportunityUrlUtils.canonicalUrl(url);

        if (TextNormalizer.trimToNull(raw.source()) == null) {
            violations.add("source is required");
        }
        if (title == null) {
            violations.add("title is required");
        }
        if (organization == null) {
            violations.add("organization is required");
        }
        if (url == null && description == null) {
            violations.add("url or description is required");
        } else if (url != null && canonicalUrl == null && description == null) {
            violations.add("url is not an absolute http(s) URL");
        }
        if (raw.salaryMin() != null && raw.salaryMax() != null && raw.salaryMin() > raw.salaryMax()) {
            violations.add("salaryMin must not exceed salaryMax");
        }
        if (raw.requiredExperienceYears() != null && raw.requiredExperienceYears() < 0) {
            violations.add("requiredExperienceYears must not be negative");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid opportunity: " + String.join(", ", violations), violations);
        }

        return new OpportunityFields(
            TextNormalizer.trimToNull(raw.externalId()),
            title,
            organization,
            url,
            canonicalUrl,
            description,
            raw.opportunityType(),
            raw.deadline(),
            TextNormalizer.trimToNull(raw.location()),
            Boolean.TRUE.equals(raw.remote()),
            cleanList(raw.tags()),
            cleanList(raw.requiredSkills()),
            raw.requiredExperienceYears(),
            raw.salaryMin(),
            raw.salaryMax(),
            TextNormalizer.trimToNull(raw.applicationPlatform()),
            cleanAttributes(raw.attributes())
        );
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String value : values) {
            String trimmed = TextNormalizer.trimToNull(value);
            if (trimmed != null) {
                out.add(trimmed);
            }
        }
        return List.copyOf(out);
    }

    private static Map<String, String> cleanAttributes(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            String key = TextNormalizer.trimToNull(entry.getKey());
            if (key != null && entry.getValue() != null) {
                out.put(key, entry.getValue().trim());
            }
        }
        return out;
    }
}
