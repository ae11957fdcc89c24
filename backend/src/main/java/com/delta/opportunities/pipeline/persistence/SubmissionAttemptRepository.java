package com.delta.opportunities.pipeline.persistence;

import com.delta.opportunities.pipeline.model.ApplicationPackage;
import com.delta.opportunities.pipeline.model.SubmissionAttempt;
import com.delta.opportunities.pipeline.model.SubmissionStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.delta.opportunities.pipeline.persistence.ApplicationJdbcRepository.truncate;
import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toInstant;
import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toTimestamp;

/**
 * Durable bookkeeping for platform deliveries. Every status change is a guarded update so that
 * a terminal attempt can never be rewritten.
 */
@Repository
public class SubmissionAttemptRepository {
    private static final String SELECT_COLUMNS = """
        SELECT id, application_id, platform, idempotency_key, status, attempt_number, next_retry_at,
               last_error, delivery_id, package_json, created_at, updated_at
        FROM submission_attempts
        """;
    private static final List<String> TERMINAL = List.of(
        SubmissionStatus.DELIVERED.name(),
        SubmissionStatus.FAILED.name(),
        SubmissionStatus.EXPIRED.name()
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public SubmissionAttemptRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public record CreateResult(SubmissionAttempt attempt, boolean created) {
    }

    /**
     * Creates a QUEUED attempt for the idempotency key, or returns the attempt that already owns it.
     */
    public CreateResult createIfAbsent(
        ApplicationPackage applicationPackage,
        String platform,
        String idempotencyKey,
        Instant now
    ) {
        Optional<SubmissionAttempt> existing = findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            return new CreateResult(existing.get(), false);
        }
        try {
            jdbc.update(
                """
                    INSERT INTO submission_attempts (
                        application_id,
                        platform,
                        idempotency_key,
                        status,
                        attempt_number,
                        package_json,
                        created_at,
                        updated_at
                    )
                    VALUES (:applicationId, :platform, :idempotencyKey, :status, 0, :packageJson, :now, :now)
                    """,
                new MapSqlParameterSource()
                    .addValue("applicationId", applicationPackage.applicationId())
                    .addValue("platform", platform)
                    .addValue("idempotencyKey", idempotencyKey)
                    .addValue("status", SubmissionStatus.QUEUED.name())
                    .addValue("packageJson", writePackage(applicationPackage))
                    .addValue("now", toTimestamp(now))
            );
        } catch (DuplicateKeyException e) {
            SubmissionAttempt winner = findByIdempotencyKey(idempotencyKey)
                .orElseThrow(() -> new IllegalStateException("Attempt vanished after duplicate insert", e));
            return new CreateResult(winner, false);
        }
        SubmissionAttempt created = findByIdempotencyKey(idempotencyKey)
            .orElseThrow(() -> new IllegalStateException("Failed to create submission attempt " + idempotencyKey));
        return new CreateResult(created, true);
    }

    public Optional<SubmissionAttempt> findById(long id) {
        List<SubmissionAttempt> rows = jdbc.query(
            SELECT_COLUMNS + "WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            attemptMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<SubmissionAttempt> findByIdempotencyKey(String idempotencyKey) {
        List<SubmissionAttempt> rows = jdbc.query(
            SELECT_COLUMNS + "WHERE idempotency_key = :idempotencyKey",
            new MapSqlParameterSource().addValue("idempotencyKey", idempotencyKey),
            attemptMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<SubmissionAttempt> findByApplication(long applicationId) {
        return jdbc.query(
            SELECT_COLUMNS + "WHERE application_id = :applicationId ORDER BY id ASC",
            new MapSqlParameterSource().addValue("applicationId", applicationId),
            attemptMapper()
        );
    }

    public List<SubmissionAttempt> findNonTerminal(int limit) {
        return jdbc.query(
            SELECT_COLUMNS + """
                WHERE status NOT IN (:terminal)
                ORDER BY id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("terminal", TERMINAL)
                .addValue("limit", Math.max(1, limit)),
            attemptMapper()
        );
    }

    /**
     * Claims a queued or retry-scheduled attempt for one worker. Returns false when another
     * worker, a withdrawal, or a terminal write got there first.
     */
    public boolean markInFlight(long id, int attemptNumber, Instant now) {
        return jdbc.update(
            """
                UPDATE submission_attempts
                SET status = 'IN_FLIGHT',
                    attempt_number = :attemptNumber,
                    next_retry_at = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND status IN ('QUEUED', 'RETRY_SCHEDULED')
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("attemptNumber", attemptNumber)
                .addValue("now", toTimestamp(now))
        ) == 1;
    }

    public boolean markRetryScheduled(long id, Instant nextRetryAt, String error, Instant now) {
        return jdbc.update(
            """
                UPDATE submission_attempts
                SET status = 'RETRY_SCHEDULED',
                    next_retry_at = :nextRetryAt,
                    last_error = :lastError,
                    updated_at = :now
                WHERE id = :id
                  AND status NOT IN (:terminal)
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("nextRetryAt", toTimestamp(nextRetryAt))
                .addValue("lastError", truncate(error))
                .addValue("now", toTimestamp(now))
                .addValue("terminal", TERMINAL)
        ) == 1;
    }

    public boolean markDelivered(long id, String deliveryId, Instant now) {
        return jdbc.update(
            """
                UPDATE submission_attempts
                SET status = 'DELIVERED',
                    delivery_id = :deliveryId,
                    next_retry_at = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND status NOT IN (:terminal)
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("deliveryId", deliveryId)
                .addValue("now", toTimestamp(now))
                .addValue("terminal", TERMINAL)
        ) == 1;
    }

    public boolean markFailed(long id, String error, Instant now) {
        return jdbc.update(
            """
                UPDATE submission_attempts
                SET status = 'FAILED',
                    last_error = :lastError,
                    next_retry_at = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND status NOT IN (:terminal)
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("lastError", truncate(error))
                .addValue("now", toTimestamp(now))
                .addValue("terminal", TERMINAL)
        ) == 1;
    }

    /**
     * Expires attempts of the application that are not yet handed to a platform.
     */
    public int expireWaiting(long applicationId, Instant now) {
        return jdbc.update(
            """
                UPDATE submission_attempts
                SET status = 'EXPIRED',
                    next_retry_at = NULL,
                    last_error = 'withdrawn',
                    updated_at = :now
                WHERE application_id = :applicationId
                  AND status IN ('QUEUED', 'RETRY_SCHEDULED')
                """,
            new MapSqlParameterSource()
                .addValue("applicationId", applicationId)
                .addValue("now", toTimestamp(now))
        );
    }

    public Map<SubmissionStatus, Long> countByStatus() {
        Map<SubmissionStatus, Long> counts = new EnumMap<>(SubmissionStatus.class);
        for (SubmissionStatus status : SubmissionStatus.values()) {
            counts.put(status, 0L);
        }
        jdbc.query(
            "SELECT status, COUNT(*) AS total FROM submission_attempts GROUP BY status",
            new MapSqlParameterSource(),
            rs -> {
                counts.put(SubmissionStatus.valueOf(rs.getString("status")), rs.getLong("total"));
            }
        );
        return counts;
    }

    private RowMapper<SubmissionAttempt> attemptMapper() {
        return (rs, rowNum) -> new SubmissionAttempt(
            rs.getLong("id"),
            rs.getLong("application_id"),
            rs.getString("platform"),
            rs.getString("idempotency_key"),
            SubmissionStatus.valueOf(rs.getString("status")),
            rs.getInt("attempt_number"),
            toInstant(rs.getTimestamp("next_retry_at")),
            rs.getString("last_error"),
            rs.getString("delivery_id"),
            readPackage(rs.getString("package_json")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private String writePackage(ApplicationPackage applicationPackage) {
        try {
            return objectMapper.writeValueAsString(applicationPackage);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize application package", e);
        }
    }

    private ApplicationPackage readPackage(String json) {
        try {
            return objectMapper.readValue(json, ApplicationPackage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read application package", e);
        }
    }
}
