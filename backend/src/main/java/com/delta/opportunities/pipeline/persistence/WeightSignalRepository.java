package com.delta.opportunities.pipeline.persistence;

import com.delta.opportunities.pipeline.model.Outcome;
import com.delta.opportunities.pipeline.model.ScoringFeature;
import com.delta.opportunities.pipeline.model.WeightAdjustmentSignal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toInstant;
import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toTimestamp;

/**
 * Outbox of weight-adjustment signals awaiting the external learning consumer.
 */
@Repository
public class WeightSignalRepository {
    private static final TypeReference<Map<ScoringFeature, Double>> DELTA_MAP = new TypeReference<>() {
    };
    private static final String SELECT_COLUMNS = """
        SELECT id, application_id, weights_version, outcome, predicted_score, prediction_error,
               feature_deltas_json, emitted_at, consumed_at
        FROM weight_adjustment_signals
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public WeightSignalRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public record StoredSignal(long id, WeightAdjustmentSignal signal, Instant consumedAt) {
    }

    public long insert(WeightAdjustmentSignal signal) {
        String json;
        try {
            json = objectMapper.writeValueAsString(signal.featureDeltas());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize feature deltas", e);
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO weight_adjustment_signals (
                    application_id,
                    weights_version,
                    outcome,
                    predicted_score,
                    prediction_error,
                    feature_deltas_json,
                    emitted_at
                )
                VALUES (:applicationId, :weightsVersion, :outcome, :predictedScore, :error, :deltasJson, :emittedAt)
                """,
            new MapSqlParameterSource()
                .addValue("applicationId", signal.applicationId())
                .addValue("weightsVersion", signal.weightsVersion())
                .addValue("outcome", signal.outcome().name())
                .addValue("predictedScore", signal.predictedScore())
                .addValue("error", signal.error())
                .addValue("deltasJson", json)
                .addValue("emittedAt", toTimestamp(signal.emittedAt())),
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? -1L : key.longValue();
    }

    public List<StoredSignal> findPending(int limit) {
        return jdbc.query(
            SELECT_COLUMNS + """
                WHERE consumed_at IS NULL
                ORDER BY id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            signalMapper()
        );
    }

    public List<StoredSignal> findByApplication(long applicationId) {
        return jdbc.query(
            SELECT_COLUMNS + "WHERE application_id = :applicationId ORDER BY id ASC",
            new MapSqlParameterSource().addValue("applicationId", applicationId),
            signalMapper()
        );
    }

    public boolean markConsumed(long id, Instant now) {
        return jdbc.update(
            """
                UPDATE weight_adjustment_signals
                SET consumed_at = :now
                WHERE id = :id
                  AND consumed_at IS NULL
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("now", toTimestamp(now))
        ) == 1;
    }

    private RowMapper<StoredSignal> signalMapper() {
        return (rs, rowNum) -> new StoredSignal(
            rs.getLong("id"),
            new WeightAdjustmentSignal(
                rs.getLong("application_id"),
                rs.getLong("weights_version"),
                Outcome.valueOf(rs.getString("outcome")),
                rs.getDouble("predicted_score"),
                rs.getDouble("prediction_error"),
                readDeltas(rs.getString("feature_deltas_json")),
                toInstant(rs.getTimestamp("emitted_at"))
            ),
            toInstant(rs.getTimestamp("consumed_at"))
        );
    }

    private Map<ScoringFeature, Double> readDeltas(String json) {
        try {
            return objectMapper.readValue(json, DELTA_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read feature deltas", e);
        }
    }
}
