package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.pipeline.model.WeightAdjustmentSignal;
import com.delta.opportunities.pipeline.persistence.WeightSignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes signals to the {@code weight_adjustment_signals} outbox; the learning job drains it.
 */
@Component
public class OutboxLearningSink implements LearningSink {
    private static final Logger log = LoggerFactory.getLogger(OutboxLearningSink.class);

    private final WeightSignalRepository repository;

    public OutboxLearningSink(WeightSignalRepository repository) {
        this.repository = repository;
    }

    @Override
    public void publish(WeightAdjustmentSignal signal) {
        long id = repository.insert(signal);
        log.info(
            "Queued weight adjustment signal {} for application {} (outcome={}, error={})",
            id,
            signal.applicationId(),
            signal.outcome(),
            signal.error()
        );
    }
}
