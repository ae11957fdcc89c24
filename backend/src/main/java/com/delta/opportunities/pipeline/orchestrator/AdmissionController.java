package com.delta.opportunities.pipeline.orchestrator;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.model.ApplicationRecord;
import com.delta.opportunities.pipeline.model.QuotaExhaustedPolicy;
import com.delta.opportunities.pipeline.persistence.AdmissionQuotaRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Tier gate plus the per-user daily admission quota. Quota days are UTC calendar days.
 */
@Component
public class AdmissionController {
    public static final String REASON_TIER = "tier_below_admission";
    public static final String REASON_QUOTA = "daily_quota_exhausted";

    private final AdmissionQuotaRepository quotaRepository;
    private final PipelineProperties properties;

    public AdmissionController(AdmissionQuotaRepository quotaRepository, PipelineProperties properties) {
        this.quotaRepository = quotaRepository;
        this.properties = properties;
    }

    /**
     * Decides admission and, for {@code ADMIT}, consumes one unit of the day's quota. A caller
     * that fails to record the admission must hand the unit back with {@link #release}.
     */
    public AdmissionDecision decide(ApplicationRecord application, Instant now) {
        Integer tier = application.tier();
        if (tier == null || (tier != 1 && tier != 2)) {
            return AdmissionDecision.skip(REASON_TIER);
        }
        LocalDate day = quotaDay(now);
        if (quotaRepository.tryConsume(application.userId(), day, properties.getAdmission().getDailyQuota())) {
            return AdmissionDecision.admit(day);
        }
        if (properties.getAdmission().getQuotaExhaustedPolicy() == QuotaExhaustedPolicy.DEFER) {
            return AdmissionDecision.defer(REASON_QUOTA, nextQuotaReset(now));
        }
        return AdmissionDecision.skip(REASON_QUOTA);
    }

    public void release(String userId, AdmissionDecision decision) {
        if (decision.verdict() == AdmissionDecision.Verdict.ADMIT && decision.quotaDay() != null) {
            quotaRepository.release(userId, decision.quotaDay());
        }
    }

    static LocalDate quotaDay(Instant now) {
        return now.atZone(ZoneOffset.UTC).toLocalDate();
    }

    static Instant nextQuotaReset(Instant now) {
        return quotaDay(now).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
