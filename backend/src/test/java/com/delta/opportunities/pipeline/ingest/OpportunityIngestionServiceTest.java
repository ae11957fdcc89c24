package com.delta.opportunities.pipeline.ingest;

import com.delta.opportunities.pipeline.model.IngestResult;
import com.delta.opportunities.pipeline.model.IngestionSummary;
import com.delta.opportunities.pipeline.model.Opportunity;
import com.delta.opportunities.pipeline.model.OpportunityFields;
import com.delta.opportunities.pipeline.model.OpportunityType;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import com.delta.opportunities.support.PipelineTestConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(PipelineTestConfiguration.class)
class OpportunityIngestionServiceTest {
    private static final Instant DEADLINE = Instant.parse("2027-03-01T00:00:00Z");

    @Autowired
    private OpportunityIngestionService ingestionService;

    @Test
    void sparseDuplicateKeepsWhatTheFirstSightingKnew() {
        String title = "Climate Research Grant " + suffix();
        String url = "https://fund.example/grants/" + suffix();
        IngestResult first = ingestionService.ingest(new RawOpportunity(
            "source-a",
            "g-1",
            title,
            "Open Climate Fund",
            url,
            "Funding for open climate models",
            OpportunityType.GRANT,
            DEADLINE,
            "Berlin",
            true,
            List.of("climate"),
            List.of("python", "modeling"),
            3,
            10000.0,
            50000.0,
            "linkedin",
            Map.of("cycle", "2027")
        ));

        IngestResult second = ingestionService.ingest(RawOpportunity.of("source-b", title, "Open Climate Fund", url, null));

        assertThat(second.isNew()).isFalse();
        assertThat(second.opportunity().id()).isEqualTo(first.opportunity().id());
        Opportunity merged = ingestionService.findById(first.opportunity().id());
        assertThat(merged.sources()).containsExactlyInAnyOrder("source-a", "source-b");
        OpportunityFields fields = merged.fields();
        assertThat(fields.opportunityType()).isEqualTo(OpportunityType.GRANT);
        assertThat(fields.deadline()).isEqualTo(DEADLINE);
        assertThat(fields.description()).isEqualTo("Funding for open climate models");
        assertThat(fields.requiredSkills()).containsExactly("python", "modeling");
        assertThat(fields.applicationPlatform()).isEqualTo("linkedin");
        assertThat(fields.remote()).isTrue();
        assertThat(fields.salaryMax()).isEqualTo(50000.0);
        assertThat(fields.attributes()).containsEntry("cycle", "2027");
    }

    @Test
    void laterSightingOverwritesTheValuesItCarries() {
        String title = "Fellowship in Robotics " + suffix();
        String url = "https://lab.example/fellowships/" + suffix();
        ingestionService.ingest(new RawOpportunity(
            "source-a", null, title, "Robo Lab", url, "Two year fellowship", OpportunityType.FELLOWSHIP,
            DEADLINE, null, null, List.of(), List.of("ros"), null, null, null, null, Map.of("round", "1")
        ));
        Instant extended = DEADLINE.plusSeconds(14 * 24 * 3600);

        IngestResult updated = ingestionService.ingest(new RawOpportunity(
            "source-b", null, title, "Robo Lab", url, null, null,
            extended, "Zurich", false, List.of(), List.of(), null, null, null, null, Map.of("round", "2")
        ));

        OpportunityFields fields = ingestionService.findById(updated.opportunity().id()).fields();
        assertThat(fields.deadline()).isEqualTo(extended);
        assertThat(fields.location()).isEqualTo("Zurich");
        assertThat(fields.remote()).isFalse();
        assertThat(fields.opportunityType()).isEqualTo(OpportunityType.FELLOWSHIP);
        assertThat(fields.requiredSkills()).containsExactly("ros");
        assertThat(fields.description()).isEqualTo("Two year fellowship");
        assertThat(fields.attributes()).containsEntry("round", "2");
    }

    @Test
    void batchCountsEachRecordAndHandsOverAcceptedOnes() {
        String title = "Storage Engineer " + suffix();
        String url = "https://disk.example/jobs/" + suffix();
        List<String> accepted = new ArrayList<>();

        IngestionSummary summary = ingestionService.ingestBatch(
            List.of(
                RawOpportunity.of("source-a", title, "Disk Co", url, "Distributed storage"),
                RawOpportunity.of("source-b", title, "Disk Co", url, "Distributed storage"),
                RawOpportunity.of("source-c", " ", "Disk Co", url, "no title")
            ),
            (raw, result) -> accepted.add(raw.source() + ":" + result.isNew())
        );

        assertThat(summary.received()).isEqualTo(3);
        assertThat(summary.created()).isEqualTo(1);
        assertThat(summary.merged()).isEqualTo(1);
        assertThat(summary.rejected()).isEqualTo(1);
        assertThat(summary.errorSamples()).hasSize(1);
        assertThat(accepted).containsExactly("source-a:true", "source-b:false");
    }

    @Test
    void nullBatchIsEmpty() {
        IngestionSummary summary = ingestionService.ingestBatch(null, (raw, result) -> {
            throw new AssertionError("nothing to hand over");
        });

        assertThat(summary.received()).isZero();
        assertThat(summary.errorSamples()).isEmpty();
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
