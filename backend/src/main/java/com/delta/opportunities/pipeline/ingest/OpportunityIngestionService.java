package com.delta.opportunities.pipeline.ingest;

import com.delta.opportunities.pipeline.error.NotFoundException;
import com.delta.opportunities.pipeline.error.ValidationException;
import com.delta.opportunities.pipeline.model.IngestResult;
import com.delta.opportunities.pipeline.model.IngestionSummary;
import com.delta.opportunities.pipeline.model.Opportunity;
import com.delta.opportunities.pipeline.model.OpportunityFields;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Opportunity store front door: canonicalizes raw records and folds duplicates into a single
 * stored opportunity per fingerprint.
 */
@Service
public class OpportunityIngestionService {
    private static final Logger log = LoggerFactory.getLogger(OpportunityIngestionService.class);
    private static final int LOCK_STRIPES = 64;
    private static final int ERROR_SAMPLE_LIMIT = 10;

    private final OpportunityJdbcRepository repository;
    private final OpportunityCanonicalizer canonicalizer;
    private final FingerprintCalculator fingerprintCalculator;
    private final Clock clock;
    private final Object[] fingerprintLocks = new Object[LOCK_STRIPES];

    public OpportunityIngestionService(
        OpportunityJdbcRepository repository,
        OpportunityCanonicalizer canonicalizer,
        FingerprintCalculator fingerprintCalculator,
        Clock clock
    ) {
        this.repository = repository;
        this.canonicalizer = canonicalizer;
        this.fingerprintCalculator = fingerprintCalculator;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            fingerprintLocks[i] = new Object();
        }
    }

    public IngestResult ingest(RawOpportunity raw) {
        OpportunityFields fields;
        try {
            fields = canonicalizer.canonicalize(raw);
        } catch (ValidationException e) {
            log.warn("Rejected opportunity from source {}: {}", raw == null ? null : raw.source(), e.getMessage());
            throw e;
        }
        String source = raw.source().trim();
        String fingerprint = fingerprintCalculator.fingerprint(fields);
        Instant now = clock.instant();

        synchronized (lockFor(fingerprint)) {
            Optional<Opportunity> existing = repository.findByFingerprint(fingerprint);
            if (existing.isPresent()) {
                return new IngestResult(merge(existing.get(), fields, raw, source, now), false);
            }
            try {
                long id = repository.insert(fingerprint, fields, now);
                repository.addSource(id, source, now);
                Opportunity created = repository.findById(id)
                    .orElseThrow(() -> new IllegalStateException("Opportunity " + id + " missing after insert"));
                log.info("Stored new opportunity {} ({} at {}) from {}", id, fields.title(), fields.organization(), source);
                return new IngestResult(created, true);
            } catch (DuplicateKeyException e) {
                // another instance stored the fingerprint first
                Opportunity winner = repository.findByFingerprint(fingerprint)
                    .orElseThrow(() -> new IllegalStateException("Opportunity vanished after duplicate insert", e));
                return new IngestResult(merge(winner, fields, raw, source, now), false);
            }
        }
    }

    /**
     * Ingests every record of the batch. Rejected records are counted and sampled instead of
     * aborting the batch; each accepted record is handed to {@code onAccepted} in batch order.
     */
    public IngestionSummary ingestBatch(List<RawOpportunity> batch, BiConsumer<RawOpportunity, IngestResult> onAccepted) {
        int created = 0;
        int merged = 0;
        int rejected = 0;
        List<String> errorSamples = new ArrayList<>();
        List<RawOpportunity> items = batch == null ? List.of() : batch;
        for (RawOpportunity raw : items) {
            try {
                IngestResult result = ingest(raw);
                if (result.isNew()) {
                    created++;
                } else {
                    merged++;
                }
                onAccepted.accept(raw, result);
            } catch (ValidationException e) {
                rejected++;
                if (errorSamples.size() < ERROR_SAMPLE_LIMIT) {
                    errorSamples.add(e.getMessage());
                }
            }
        }
        log.info("Ingested batch received={} created={} merged={} rejected={}", items.size(), created, merged, rejected);
        return new IngestionSummary(items.size(), created, merged, rejected, errorSamples);
    }

    public Opportunity findById(long id) {
        return repository.findById(id)
            .orElseThrow(() -> new NotFoundException("Opportunity " + id + " not found"));
    }

    public Optional<Opportunity> findByFingerprint(String fingerprint) {
        return repository.findByFingerprint(fingerprint);
    }

    public void recordScore(long opportunityId, int tier, double score) {
        repository.updateScore(opportunityId, tier, score);
    }

    public int archiveOlderThan(Instant cutoff) {
        int archived = repository.archiveNotUpdatedSince(cutoff, clock.instant());
        if (archived > 0) {
            log.info("Archived {} opportunities not updated since {}", archived, cutoff);
        }
        return archived;
    }

    private Opportunity merge(Opportunity existing, OpportunityFields fields, RawOpportunity raw, String source, Instant now) {
        repository.mergeFields(existing.id(), mergeFields(existing.fields(), fields, raw), now, now);
        boolean newSource = repository.addSource(existing.id(), source, now);
        if (newSource) {
            log.info("Merged opportunity {} with new source {}", existing.id(), source);
        }
        return repository.findById(existing.id()).orElse(existing);
    }

    /**
     * Latest-wins for every value the new sighting carries. Values it leaves out (null, empty
     * lists, an unspecified type or remote flag) keep what is stored.
     */
    static OpportunityFields mergeFields(OpportunityFields stored, OpportunityFields incoming, RawOpportunity raw) {
        Map<String, String> attributes = new LinkedHashMap<>(stored.attributes());
        attributes.putAll(incoming.attributes());
        return new OpportunityFields(
            pick(incoming.externalId(), stored.externalId()),
            pick(incoming.title(), stored.title()),
            pick(incoming.organization(), stored.organization()),
            pick(incoming.url(), stored.url()),
            pick(incoming.canonicalUrl(), stored.canonicalUrl()),
            pick(incoming.description(), stored.description()),
            raw.opportunityType() != null ? incoming.opportunityType() : stored.opportunityType(),
            pick(incoming.deadline(), stored.deadline()),
            pick(incoming.location(), stored.location()),
            raw.remote() != null ? incoming.remote() : stored.remote(),
            incoming.tags().isEmpty() ? stored.tags() : incoming.tags(),
            incoming.requiredSkills().isEmpty() ? stored.requiredSkills() : incoming.requiredSkills(),
            pick(incoming.requiredExperienceYears(), stored.requiredExperienceYears()),
            pick(incoming.salaryMin(), stored.salaryMin()),
            pick(incoming.salaryMax(), stored.salaryMax()),
            pick(incoming.applicationPlatform(), stored.applicationPlatform()),
            attributes
        );
    }

    private static <T> T pick(T incoming, T stored) {
        return incoming != null ? incoming : stored;
    }

    private Object lockFor(String fingerprint) {
        return fingerprintLocks[Math.floorMod(fingerprint.hashCode(), LOCK_STRIPES)];
    }
}
