package com.delta.opportunities.pipeline.persistence;

import com.delta.opportunities.pipeline.error.ConflictException;
import com.delta.opportunities.pipeline.model.ApplicationRecord;
import com.delta.opportunities.pipeline.model.ApplicationState;
import com.delta.opportunities.pipeline.model.ApprovalDecision;
import com.delta.opportunities.pipeline.model.Outcome;
import com.delta.opportunities.pipeline.model.ScoringFeature;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.getDouble;
import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.getInteger;
import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.getLong;
import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toInstant;
import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toTimestamp;

@Repository
public class ApplicationJdbcRepository {
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final TypeReference<Map<ScoringFeature, Double>> FEATURE_MAP = new TypeReference<>() {
    };
    private static final String SELECT_COLUMNS = """
        SELECT id, opportunity_id, user_id, state, score, tier, weights_version, feature_values_json,
               generated_content_ref, quality_score, approval_decision, reviewer, generation_attempts,
               platform, outcome, last_error, deferred_until, state_entered_at, created_at, updated_at,
               archived_at, version
        FROM applications
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public ApplicationJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public record CreateResult(ApplicationRecord application, boolean created) {
    }

    /**
     * Returns the existing record for (user, opportunity) or creates it in {@code DISCOVERED}.
     */
    public CreateResult createIfAbsent(String userId, long opportunityId, Instant now) {
        Optional<ApplicationRecord> existing = findByUserAndOpportunity(userId, opportunityId);
        if (existing.isPresent()) {
            return new CreateResult(existing.get(), false);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("opportunityId", opportunityId)
            .addValue("state", ApplicationState.DISCOVERED.name())
            .addValue("now", toTimestamp(now));
        try {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbc.update(
                """
                    INSERT INTO applications (
                        opportunity_id,
                        user_id,
                        state,
                        generation_attempts,
                        state_entered_at,
                        created_at,
                        updated_at,
                        version
                    )
                    VALUES (:opportunityId, :userId, :state, 0, :now, :now, :now, 0)
                    """,
                params,
                keyHolder,
                new String[]{"id"}
            );
        } catch (DuplicateKeyException e) {
            ApplicationRecord winner = findByUserAndOpportunity(userId, opportunityId)
                .orElseThrow(() -> new IllegalStateException("Application vanished after duplicate insert", e));
            return new CreateResult(winner, false);
        }
        ApplicationRecord created = findByUserAndOpportunity(userId, opportunityId)
            .orElseThrow(() -> new IllegalStateException("Failed to create application for " + userId));
        return new CreateResult(created, true);
    }

    public Optional<ApplicationRecord> findById(long id) {
        List<ApplicationRecord> rows = jdbc.query(
            SELECT_COLUMNS + "WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            applicationMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<ApplicationRecord> findByUserAndOpportunity(String userId, long opportunityId) {
        List<ApplicationRecord> rows = jdbc.query(
            SELECT_COLUMNS + "WHERE user_id = :userId AND opportunity_id = :opportunityId",
            new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("opportunityId", opportunityId),
            applicationMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<ApplicationRecord> findByUser(String userId) {
        return jdbc.query(
            SELECT_COLUMNS + "WHERE user_id = :userId ORDER BY id ASC",
            new MapSqlParameterSource().addValue("userId", userId),
            applicationMapper()
        );
    }

    /**
     * Version-guarded write of {@code next}. Succeeds only if the stored version still equals
     * {@code current.version()}; otherwise throws {@link ConflictException} and writes nothing.
     */
    public ApplicationRecord compareAndSet(ApplicationRecord current, ApplicationRecord next, Instant now) {
        boolean stateChanged = current.state() != next.state();
        Instant stateEnteredAt = stateChanged ? now : current.stateEnteredAt();
        Instant archivedAt = current.archivedAt();
        if (archivedAt == null && next.state().isTerminal()) {
            archivedAt = now;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", current.id())
            .addValue("expectedVersion", current.version())
            .addValue("state", next.state().name())
            .addValue("score", next.score())
            .addValue("tier", next.tier())
            .addValue("weightsVersion", next.weightsVersion())
            .addValue("featureValuesJson", writeFeatures(next.featureValues()))
            .addValue("generatedContentRef", next.generatedContentRef())
            .addValue("qualityScore", next.qualityScore())
            .addValue("approvalDecision", next.approvalDecision() == null ? null : next.approvalDecision().name())
            .addValue("reviewer", next.reviewer())
            .addValue("generationAttempts", next.generationAttempts())
            .addValue("platform", next.platform())
            .addValue("outcome", next.outcome() == null ? null : next.outcome().name())
            .addValue("lastError", truncate(next.lastError()))
            .addValue("deferredUntil", toTimestamp(next.deferredUntil()))
            .addValue("stateEnteredAt", toTimestamp(stateEnteredAt))
            .addValue("updatedAt", toTimestamp(now))
            .addValue("archivedAt", toTimestamp(archivedAt));
        int updated = jdbc.update(
            """
                UPDATE applications
                SET state = :state,
                    score = :score,
                    tier = :tier,
                    weights_version = :weightsVersion,
                    feature_values_json = :featureValuesJson,
                    generated_content_ref = :generatedContentRef,
                    quality_score = :qualityScore,
                    approval_decision = :approvalDecision,
                    reviewer = :reviewer,
                    generation_attempts = :generationAttempts,
                    platform = :platform,
                    outcome = :outcome,
                    last_error = :lastError,
                    deferred_until = :deferredUntil,
                    state_entered_at = :stateEnteredAt,
                    updated_at = :updatedAt,
                    archived_at = :archivedAt,
                    version = version + 1
                WHERE id = :id
                  AND version = :expectedVersion
                """,
            params
        );
        if (updated == 0) {
            throw new ConflictException(current.id(), current.version());
        }
        return new ApplicationRecord(
            current.id(),
            current.opportunityId(),
            current.userId(),
            next.state(),
            next.score(),
            next.tier(),
            next.weightsVersion(),
            next.featureValues(),
            next.generatedContentRef(),
            next.qualityScore(),
            next.approvalDecision(),
            next.reviewer(),
            next.generationAttempts(),
            next.platform(),
            next.outcome(),
            truncate(next.lastError()),
            next.deferredUntil(),
            stateEnteredAt,
            current.createdAt(),
            now,
            archivedAt,
            current.version() + 1
        );
    }

    public List<Long> findIdsInStates(Collection<ApplicationState> states, int limit) {
        if (states.isEmpty()) {
            return List.of();
        }
        return jdbc.queryForList(
            """
                SELECT id
                FROM applications
                WHERE state IN (:states)
                ORDER BY id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("states", states.stream().map(Enum::name).toList())
                .addValue("limit", Math.max(1, limit)),
            Long.class
        );
    }

    public List<Long> findTrackingEnteredBefore(Instant cutoff, int limit) {
        return jdbc.queryForList(
            """
                SELECT id
                FROM applications
                WHERE state = 'TRACKING'
                  AND state_entered_at < :cutoff
                ORDER BY state_entered_at ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("cutoff", toTimestamp(cutoff))
                .addValue("limit", Math.max(1, limit)),
            Long.class
        );
    }

    public List<Long> findDeferredDue(Instant now, int limit) {
        return jdbc.queryForList(
            """
                SELECT id
                FROM applications
                WHERE state = 'SCORED'
                  AND deferred_until IS NOT NULL
                  AND deferred_until <= :now
                ORDER BY deferred_until ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("now", toTimestamp(now))
                .addValue("limit", Math.max(1, limit)),
            Long.class
        );
    }

    public long insertDraft(long applicationId, String content, Double qualityScore, Instant now) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO generated_drafts (application_id, content, quality_score, created_at)
                VALUES (:applicationId, :content, :qualityScore, :createdAt)
                """,
            new MapSqlParameterSource()
                .addValue("applicationId", applicationId)
                .addValue("content", content == null ? "" : content)
                .addValue("qualityScore", qualityScore)
                .addValue("createdAt", toTimestamp(now)),
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert draft for application " + applicationId);
        }
        return key.longValue();
    }

    public Optional<String> findDraftContent(long draftId) {
        List<String> rows = jdbc.query(
            "SELECT content FROM generated_drafts WHERE id = :id",
            new MapSqlParameterSource().addValue("id", draftId),
            (rs, rowNum) -> rs.getString("content")
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private RowMapper<ApplicationRecord> applicationMapper() {
        return (rs, rowNum) -> {
            String approval = rs.getString("approval_decision");
            String outcome = rs.getString("outcome");
            Integer attempts = getInteger(rs, "generation_attempts");
            return new ApplicationRecord(
                rs.getLong("id"),
                rs.getLong("opportunity_id"),
                rs.getString("user_id"),
                ApplicationState.valueOf(rs.getString("state")),
                getDouble(rs, "score"),
                getInteger(rs, "tier"),
                getLong(rs, "weights_version"),
                readFeatures(rs.getString("feature_values_json")),
                rs.getString("generated_content_ref"),
                getDouble(rs, "quality_score"),
                approval == null ? null : ApprovalDecision.valueOf(approval),
                rs.getString("reviewer"),
                attempts == null ? 0 : attempts,
                rs.getString("platform"),
                outcome == null ? null : Outcome.valueOf(outcome),
                rs.getString("last_error"),
                toInstant(rs.getTimestamp("deferred_until")),
                toInstant(rs.getTimestamp("state_entered_at")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")),
                toInstant(rs.getTimestamp("archived_at")),
                rs.getLong("version")
            );
        };
    }

    private String writeFeatures(Map<ScoringFeature, Double> features) {
        if (features == null || features.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(features);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize feature values", e);
        }
    }

    private Map<ScoringFeature, Double> readFeatures(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, FEATURE_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read feature values", e);
        }
    }

    static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
