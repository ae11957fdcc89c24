package com.delta.opportunities.pipeline.ingest;

import com.delta.opportunities.pipeline.error.ValidationException;
import com.delta.opportunities.pipeline.model.OpportunityFields;
import com.delta.opportunities.pipeline.model.OpportunityType;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class OpportunityCanonicalizerTest {
    private final OpportunityCanonicalizer canonicalizer = new OpportunityCanonicalizer();

    @Test
    void stripsHtmlAndCleansLists() {
        RawOpportunity raw = new RawOpportunity(
            "board",
            " ext-1 ",
            "  Data Engineer ",
            "Acme",
            "https://acme.example/jobs/7?ref=feed",
            "<h1>Role</h1><p>Build <b>pipelines</b></p>",
            null,
            null,
            " Remote ",
            null,
            Arrays.asList("data", " ", "data", null, "etl"),
            List.of(" SQL ", "Java"),
            2,
            90_000.0,
            120_000.0,
            "Email",
            Map.of(" team ", " platform ")
        );

        OpportunityFields fields = canonicalizer.canonicalize(raw);

        assertThat(fields.title()).isEqualTo("Data Engineer");
        assertThat(fields.externalId()).isEqualTo("ext-1");
        assertThat(fields.description()).isEqualTo("Role Build pipelines");
        assertThat(fields.canonicalUrl()).isEqualTo("https://acme.example/jobs/7");
        assertThat(fields.opportunityType()).isEqualTo(OpportunityType.JOB);
        assertThat(fields.tags()).containsExactly("data", "etl");
        assertThat(fields.requiredSkills()).containsExactly("SQL", "Java");
        assertThat(fields.remote()).isFalse();
    }

    @Test
    void reportsEveryViolation() {
        RawOpportunity raw = new RawOpportunity(
            " ", null, null, null, null, null, null, null, null, null, null, null, -1, 10.0, 5.0, null, null
        );

        ValidationException error = catchThrowableOfType(() -> canonicalizer.canonicalize(raw), ValidationException.class);

        assertThat(error).isNotNull();
        assertThat(error.getViolations()).contains(
            "source is required",
            "title is required",
            "organization is required",
            "url or description is required",
            "salaryMin must not exceed salaryMax",
            "requiredExperienceYears must not be negative"
        );
    }

    @Test
    void rejectsUnusableUrlWithoutDescription() {
        RawOpportunity raw = RawOpportunity.of("board", "Title", "Org", "ftp://files.example/x", null);

        assertThatThrownBy(() -> canonicalizer.canonicalize(raw))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("absolute http(s) URL");
    }
}
