package com.delta.opportunities.pipeline.scoring;

import com.delta.opportunities.pipeline.error.ValidationException;
import com.delta.opportunities.pipeline.model.ScoringFeature;
import com.delta.opportunities.pipeline.model.ScoringWeights;
import com.delta.opportunities.pipeline.persistence.ScoringWeightsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active scoring weights. Readers always see one complete version; installs are
 * serialized and only move forward.
 */
@Service
public class ScoringWeightsRegistry {
    private static final Logger log = LoggerFactory.getLogger(ScoringWeightsRegistry.class);

    private final ScoringWeightsRepository repository;
    private final Clock clock;
    private final AtomicReference<ScoringWeights> current = new AtomicReference<>();
    private final Object installLock = new Object();

    public ScoringWeightsRegistry(ScoringWeightsRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @PostConstruct
    public void load() {
        synchronized (installLock) {
            ScoringWeights latest = repository.findLatest().orElse(null);
            if (latest == null) {
                latest = ScoringWeights.defaults(clock.instant());
                try {
                    repository.insert(latest);
                    log.info("Seeded scoring weights version {}", latest.version());
                } catch (DuplicateKeyException e) {
                    latest = repository.findLatest().orElseThrow(() -> e);
                }
            }
            current.set(latest);
            log.info("Active scoring weights version {}", latest.version());
        }
    }

    public ScoringWeights current() {
        ScoringWeights snapshot = current.get();
        if (snapshot == null) {
            load();
            snapshot = current.get();
        }
        return snapshot;
    }

    /**
     * Installs a strictly newer version and persists it before it becomes visible.
     */
    public ScoringWeights install(ScoringWeights weights) {
        synchronized (installLock) {
            ScoringWeights active = current();
            if (weights.version() <= active.version()) {
                throw new ValidationException(
                    "Scoring weights version " + weights.version() + " is not newer than active version " + active.version()
                );
            }
            repository.insert(weights);
            current.set(weights);
            log.info("Installed scoring weights version {}", weights.version());
            return weights;
        }
    }

    /**
     * Operator override: derives the next version from the active one.
     */
    public ScoringWeights override(Map<ScoringFeature, Double> weights, Double tier1Threshold, Double tier2Threshold) {
        synchronized (installLock) {
            ScoringWeights active = current();
            Map<ScoringFeature, Double> nextWeights = weights == null || weights.isEmpty() ? active.weights() : weights;
            double tier1 = tier1Threshold == null ? active.tier1Threshold() : tier1Threshold;
            double tier2 = tier2Threshold == null ? active.tier2Threshold() : tier2Threshold;
            ScoringWeights next;
            try {
                next = active.nextVersion(nextWeights, tier1, tier2, clock.instant());
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage());
            }
            return install(next);
        }
    }
}
