package com.delta.opportunities.pipeline.ingest;

import com.delta.opportunities.pipeline.model.IngestResult;
import com.delta.opportunities.pipeline.model.Opportunity;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository;
import com.delta.opportunities.support.PipelineTestConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(PipelineTestConfiguration.class)
class OpportunityIngestionConcurrencyTest {

    @Autowired
    private OpportunityIngestionService ingestionService;

    @Autowired
    private OpportunityJdbcRepository repository;

    @Test
    void concurrentSightingsOfOneOpportunityStoreOneRow() throws Exception {
        String title = "Compiler Engineer " + UUID.randomUUID().toString().substring(0, 8);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IngestResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String source = "source-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return ingestionService.ingest(RawOpportunity.of(
                        source,
                        title,
                        "Lambda Labs",
                        "https://lambda.example/jobs/compiler?utm_source=" + source,
                        "Work on the optimizing compiler"
                    ));
                }));
            }
            start.countDown();
            List<IngestResult> results = new ArrayList<>();
            for (Future<IngestResult> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }

            long created = results.stream().filter(IngestResult::isNew).count();
            assertThat(created).isEqualTo(1);
            assertThat(results).extracting(result -> result.opportunity().id()).containsOnly(results.get(0).opportunity().id());

            Opportunity stored = ingestionService.findById(results.get(0).opportunity().id());
            assertThat(repository.countByFingerprint(stored.fingerprint())).isEqualTo(1);
            assertThat(stored.sources()).hasSize(threads);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void trackingParametersDoNotSplitAnOpportunity() {
        String title = "Search Engineer " + UUID.randomUUID().toString().substring(0, 8);

        IngestResult first = ingestionService.ingest(RawOpportunity.of(
            "board-a", title, "Findly", "https://findly.example/jobs/42?utm_campaign=spring", "Ranking and retrieval"));
        IngestResult second = ingestionService.ingest(RawOpportunity.of(
            "board-b", "  " + title.toUpperCase() + "  ", "FINDLY", "https://findly.example/jobs/42", "Ranking and retrieval"));

        assertThat(first.isNew()).isTrue();
        assertThat(second.isNew()).isFalse();
        assertThat(second.opportunity().id()).isEqualTo(first.opportunity().id());
    }
}
