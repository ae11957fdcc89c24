package com.delta.opportunities.pipeline.persistence;

import com.delta.opportunities.pipeline.model.ScoringFeature;
import com.delta.opportunities.pipeline.model.ScoringWeights;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toInstant;
import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toTimestamp;

@Repository
public class ScoringWeightsRepository {
    private static final TypeReference<Map<ScoringFeature, Double>> WEIGHT_MAP = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public ScoringWeightsRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public Optional<ScoringWeights> findLatest() {
        List<ScoringWeights> rows = jdbc.query(
            """
                SELECT version, weights_json, tier1_threshold, tier2_threshold, updated_at
                FROM scoring_weights
                ORDER BY version DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new ScoringWeights(
                rs.getLong("version"),
                readWeights(rs.getString("weights_json")),
                rs.getDouble("tier1_threshold"),
                rs.getDouble("tier2_threshold"),
                toInstant(rs.getTimestamp("updated_at"))
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Throws {@link org.springframework.dao.DuplicateKeyException} when the version is already stored.
     */
    public void insert(ScoringWeights weights) {
        String json;
        try {
            json = objectMapper.writeValueAsString(weights.weights());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize scoring weights", e);
        }
        jdbc.update(
            """
                INSERT INTO scoring_weights (version, weights_json, tier1_threshold, tier2_threshold, updated_at)
                VALUES (:version, :weightsJson, :tier1, :tier2, :updatedAt)
                """,
            new MapSqlParameterSource()
                .addValue("version", weights.version())
                .addValue("weightsJson", json)
                .addValue("tier1", weights.tier1Threshold())
                .addValue("tier2", weights.tier2Threshold())
                .addValue("updatedAt", toTimestamp(weights.updatedAt()))
        );
    }

    private Map<ScoringFeature, Double> readWeights(String json) {
        try {
            return objectMapper.readValue(json, WEIGHT_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read scoring weights", e);
        }
    }
}
