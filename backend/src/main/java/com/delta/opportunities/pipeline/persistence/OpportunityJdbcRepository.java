package com.delta.opportunities.pipeline.persistence;

import com.delta.opportunities.pipeline.model.Opportunity;
import com.delta.opportunities.pipeline.model.OpportunityFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public class OpportunityJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public OpportunityJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public Optional<Opportunity> findById(long id) {
        List<Opportunity> rows = jdbc.query(
            """
                SELECT id, fingerprint, fields_json, tier, score, discovered_at, updated_at, archived_at
                FROM opportunities
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id),
            opportunityMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(withSources(rows.get(0)));
    }

    public Optional<Opportunity> findByFingerprint(String fingerprint) {
        List<Opportunity> rows = jdbc.query(
            """
                SELECT id, fingerprint, fields_json, tier, score, discovered_at, updated_at, archived_at
                FROM opportunities
                WHERE fingerprint = :fingerprint
                """,
            new MapSqlParameterSource().addValue("fingerprint", fingerprint),
            opportunityMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(withSources(rows.get(0)));
    }

    public int countByFingerprint(String fingerprint) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM opportunities WHERE fingerprint = :fingerprint",
            new MapSqlParameterSource().addValue("fingerprint", fingerprint),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    /**
     * Inserts a new opportunity. Throws {@link DuplicateKeyException} when another writer
     * stored the same fingerprint first.
     */
    public long insert(String fingerprint, OpportunityFields fields, Instant discoveredAt) {
        MapSqlParameterSource params = fieldParams(fields)
            .addValue("fingerprint", fingerprint)
            .addValue("discoveredAt", toTimestamp(discoveredAt))
            .addValue("updatedAt", toTimestamp(discoveredAt));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO opportunities (
                    fingerprint,
                    title,
                    organization,
                    canonical_url,
                    opportunity_type,
                    deadline,
                    fields_json,
                    discovered_at,
                    updated_at
                )
                VALUES (
                    :fingerprint,
                    :title,
                    :organization,
                    :canonicalUrl,
                    :opportunityType,
                    :deadline,
                    :fieldsJson,
                    :discoveredAt,
                    :updatedAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key != null) {
            return key.longValue();
        }
        Long id = jdbc.queryForObject(
            "SELECT id FROM opportunities WHERE fingerprint = :fingerprint",
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Failed to insert opportunity " + fingerprint);
        }
        return id;
    }

    /**
     * Stores already merged fields; keeps the earliest discovery time.
     */
    public void mergeFields(long id, OpportunityFields fields, Instant discoveredAt, Instant updatedAt) {
        MapSqlParameterSource params = fieldParams(fields)
            .addValue("id", id)
            .addValue("discoveredAt", toTimestamp(discoveredAt))
            .addValue("updatedAt", toTimestamp(updatedAt));
        jdbc.update(
            """
                UPDATE opportunities
                SET title = :title,
                    organization = :organization,
                    canonical_url = :canonicalUrl,
                    opportunity_type = :opportunityType,
                    deadline = :deadline,
                    fields_json = :fieldsJson,
                    discovered_at = CASE WHEN discovered_at > :discoveredAt THEN :discoveredAt ELSE discovered_at END,
                    updated_at = :updatedAt,
                    archived_at = NULL
                WHERE id = :id
                """,
            params
        );
    }

    public boolean addSource(long opportunityId, String source, Instant seenAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("opportunityId", opportunityId)
            .addValue("source", source)
            .addValue("seenAt", toTimestamp(seenAt));
        Integer existing = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM opportunity_sources
                WHERE opportunity_id = :opportunityId
                  AND source = :source
                """,
            params,
            Integer.class
        );
        if (existing != null && existing > 0) {
            return false;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO opportunity_sources (opportunity_id, source, first_seen_at)
                    VALUES (:opportunityId, :source, :seenAt)
                    """,
                params
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public Set<String> findSources(long opportunityId) {
        List<String> sources = jdbc.query(
            """
                SELECT source
                FROM opportunity_sources
                WHERE opportunity_id = :opportunityId
                ORDER BY first_seen_at ASC, source ASC
                """,
            new MapSqlParameterSource().addValue("opportunityId", opportunityId),
            (rs, rowNum) -> rs.getString("source")
        );
        return new LinkedHashSet<>(sources);
    }

    public void updateScore(long id, int tier, double score) {
        jdbc.update(
            """
                UPDATE opportunities
                SET tier = :tier,
                    score = :score
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("tier", tier)
                .addValue("score", score)
        );
    }

    public int archiveNotUpdatedSince(Instant cutoff, Instant now) {
        return jdbc.update(
            """
                UPDATE opportunities
                SET archived_at = :now
                WHERE archived_at IS NULL
                  AND updated_at < :cutoff
                """,
            new MapSqlParameterSource()
                .addValue("cutoff", toTimestamp(cutoff))
                .addValue("now", toTimestamp(now))
        );
    }

    private Opportunity withSources(Opportunity opportunity) {
        return new Opportunity(
            opportunity.id(),
            opportunity.fingerprint(),
            findSources(opportunity.id()),
            opportunity.fields(),
            opportunity.tier(),
            opportunity.score(),
            opportunity.discoveredAt(),
            opportunity.updatedAt(),
            opportunity.archivedAt()
        );
    }

    private RowMapper<Opportunity> opportunityMapper() {
        return (rs, rowNum) -> new Opportunity(
            rs.getLong("id"),
            rs.getString("fingerprint"),
            Set.of(),
            readFields(rs.getString("fields_json")),
            getInteger(rs, "tier"),
            getDouble(rs, "score"),
            toInstant(rs.getTimestamp("discovered_at")),
            toInstant(rs.getTimestamp("updated_at")),
            toInstant(rs.getTimestamp("archived_at"))
        );
    }

    private MapSqlParameterSource fieldParams(OpportunityFields fields) {
        return new MapSqlParameterSource()
            .addValue("title", fields.title())
            .addValue("organization", fields.organization())
            .addValue("canonicalUrl", fields.canonicalUrl())
            .addValue("opportunityType", fields.opportunityType().name())
            .addValue("deadline", toTimestamp(fields.deadline()))
            .addValue("fieldsJson", writeFields(fields));
    }

    private String writeFields(OpportunityFields fields) {
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize opportunity fields", e);
        }
    }

    private OpportunityFields readFields(String json) {
        try {
            return objectMapper.readValue(json, OpportunityFields.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read opportunity fields", e);
        }
    }

    static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
