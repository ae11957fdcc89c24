package com.delta.opportunities.pipeline.persistence;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;

/**
 * Per-user, per-UTC-day admission counters. Consumption is a single conditional increment, so
 * concurrent admissions can never push a counter past its limit.
 */
@Repository
public class AdmissionQuotaRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public AdmissionQuotaRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean tryConsume(String userId, LocalDate day, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("day", Date.valueOf(day))
            .addValue("limit", limit);
        ensureRow(params);
        return jdbc.update(
            """
                UPDATE admission_quota
                SET admitted_count = admitted_count + 1
                WHERE user_id = :userId
                  AND quota_day = :day
                  AND admitted_count < :limit
                """,
            params
        ) == 1;
    }

    /**
     * Gives back a unit consumed by an admission that did not go through.
     */
    public void release(String userId, LocalDate day) {
        jdbc.update(
            """
                UPDATE admission_quota
                SET admitted_count = admitted_count - 1
                WHERE user_id = :userId
                  AND quota_day = :day
                  AND admitted_count > 0
                """,
            new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("day", Date.valueOf(day))
        );
    }

    private void ensureRow(MapSqlParameterSource params) {
        Integer existing = jdbc.queryForObject(
            "SELECT COUNT(*) FROM admission_quota WHERE user_id = :userId AND quota_day = :day",
            params,
            Integer.class
        );
        if (existing != null && existing > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO admission_quota (user_id, quota_day, admitted_count)
                    VALUES (:userId, :day, 0)
                    """,
                params
            );
        } catch (DuplicateKeyException ignored) {
            // another admission created the row first
        }
    }
}
