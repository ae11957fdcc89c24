package com.delta.opportunities.pipeline.cli;

import com.delta.opportunities.pipeline.model.OpportunityType;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class OpportunityCsvReaderTest {

    @Test
    void readsRowsAndReportsUnreadableOnes() throws Exception {
        String csv = """
            source,title,organization,url,type,deadline,required_skills,salary_max,remote
            board,Backend Engineer,Acme,https://acme.example/jobs/1,job,2026-08-01,java; sql,150000,true
            feed,Summer Fellowship,Foundation,https://foundation.example/f,fellowship,2026-09-01T12:00:00Z,,,
            feed,Broken,Org,https://org.example/b,job,,,lots,
            """;

        OpportunityCsvReader.ReadResult result = new OpportunityCsvReader().read(new StringReader(csv));

        assertThat(result.opportunities()).hasSize(2);
        RawOpportunity first = result.opportunities().get(0);
        assertThat(first.source()).isEqualTo("board");
        assertThat(first.requiredSkills()).containsExactly("java", "sql");
        assertThat(first.deadline()).isEqualTo(Instant.parse("2026-08-01T00:00:00Z"));
        assertThat(first.salaryMax()).isEqualTo(150_000.0);
        assertThat(first.remote()).isTrue();
        RawOpportunity second = result.opportunities().get(1);
        assertThat(second.opportunityType()).isEqualTo(OpportunityType.FELLOWSHIP);
        assertThat(second.remote()).isNull();
        assertThat(result.errors()).singleElement().asString().contains("csv row 3").contains("lots");
    }
}
