package com.delta.opportunities.pipeline.persistence;

import com.delta.opportunities.pipeline.model.ApplicationEvent;
import com.delta.opportunities.pipeline.model.ApplicationEventKind;
import com.delta.opportunities.pipeline.model.ApplicationState;
import com.delta.opportunities.pipeline.model.FollowUpKind;
import com.delta.opportunities.pipeline.model.FollowUpTask;
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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toInstant;
import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toTimestamp;

@Repository
public class TrackingJdbcRepository {
    private static final TypeReference<Map<String, Object>> PAYLOAD_MAP = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public TrackingJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insertEvent(
        long applicationId,
        ApplicationEventKind kind,
        ApplicationState fromState,
        ApplicationState toState,
        Map<String, Object> payload,
        Instant occurredAt
    ) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO application_events (application_id, kind, from_state, to_state, payload_json, occurred_at)
                VALUES (:applicationId, :kind, :fromState, :toState, :payloadJson, :occurredAt)
                """,
            new MapSqlParameterSource()
                .addValue("applicationId", applicationId)
                .addValue("kind", kind.name())
                .addValue("fromState", fromState == null ? null : fromState.name())
                .addValue("toState", toState == null ? null : toState.name())
                .addValue("payloadJson", writePayload(payload))
                .addValue("occurredAt", toTimestamp(occurredAt)),
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? -1L : key.longValue();
    }

    public List<ApplicationEvent> findEvents(long applicationId) {
        return jdbc.query(
            """
                SELECT id, application_id, kind, from_state, to_state, payload_json, occurred_at
                FROM application_events
                WHERE application_id = :applicationId
                ORDER BY id ASC
                """,
            new MapSqlParameterSource().addValue("applicationId", applicationId),
            eventMapper()
        );
    }

    public long insertFollowUp(long applicationId, Instant dueAt, FollowUpKind kind, Instant now) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO follow_up_tasks (application_id, due_at, kind, completed, created_at)
                VALUES (:applicationId, :dueAt, :kind, FALSE, :createdAt)
                """,
            new MapSqlParameterSource()
                .addValue("applicationId", applicationId)
                .addValue("dueAt", toTimestamp(dueAt))
                .addValue("kind", kind.name())
                .addValue("createdAt", toTimestamp(now)),
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert follow-up for application " + applicationId);
        }
        return key.longValue();
    }

    public List<FollowUpTask> findDueFollowUps(Instant now, int limit) {
        return jdbc.query(
            """
                SELECT id, application_id, due_at, kind, completed, completed_at
                FROM follow_up_tasks
                WHERE completed = FALSE
                  AND due_at <= :now
                ORDER BY due_at ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("now", toTimestamp(now))
                .addValue("limit", Math.max(1, limit)),
            followUpMapper()
        );
    }

    public List<FollowUpTask> findPendingFollowUps(String userId) {
        return jdbc.query(
            """
                SELECT f.id, f.application_id, f.due_at, f.kind, f.completed, f.completed_at
                FROM follow_up_tasks f
                JOIN applications a ON a.id = f.application_id
                WHERE a.user_id = :userId
                  AND f.completed = FALSE
                ORDER BY f.due_at ASC, f.id ASC
                """,
            new MapSqlParameterSource().addValue("userId", userId),
            followUpMapper()
        );
    }

    public boolean completeFollowUp(long taskId, Instant now) {
        return jdbc.update(
            """
                UPDATE follow_up_tasks
                SET completed = TRUE,
                    completed_at = :now
                WHERE id = :id
                  AND completed = FALSE
                """,
            new MapSqlParameterSource()
                .addValue("id", taskId)
                .addValue("now", toTimestamp(now))
        ) == 1;
    }

    /**
     * Cancels open follow-ups of an application that left tracking.
     */
    public int completeFollowUpsForApplication(long applicationId, Instant now) {
        return jdbc.update(
            """
                UPDATE follow_up_tasks
                SET completed = TRUE,
                    completed_at = :now
                WHERE application_id = :applicationId
                  AND completed = FALSE
                """,
            new MapSqlParameterSource()
                .addValue("applicationId", applicationId)
                .addValue("now", toTimestamp(now))
        );
    }

    /**
     * Number of the user's applications that ever entered each state, from the timeline.
     */
    public Map<ApplicationState, Long> countApplicationsReachingStates(String userId) {
        Map<ApplicationState, Long> counts = new EnumMap<>(ApplicationState.class);
        jdbc.query(
            """
                SELECT e.to_state AS state, COUNT(DISTINCT e.application_id) AS total
                FROM application_events e
                JOIN applications a ON a.id = e.application_id
                WHERE a.user_id = :userId
                  AND e.kind = 'STATE_CHANGED'
                  AND e.to_state IS NOT NULL
                GROUP BY e.to_state
                """,
            new MapSqlParameterSource().addValue("userId", userId),
            rs -> {
                counts.put(ApplicationState.valueOf(rs.getString("state")), rs.getLong("total"));
            }
        );
        return counts;
    }

    public long countApplications(String userId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM applications WHERE user_id = :userId",
            new MapSqlParameterSource().addValue("userId", userId),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public long countApplicationsWithOutcome(String userId, String outcome) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM applications WHERE user_id = :userId AND outcome = :outcome",
            new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("outcome", outcome),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private RowMapper<ApplicationEvent> eventMapper() {
        return (rs, rowNum) -> {
            String from = rs.getString("from_state");
            String to = rs.getString("to_state");
            return new ApplicationEvent(
                rs.getLong("id"),
                rs.getLong("application_id"),
                ApplicationEventKind.valueOf(rs.getString("kind")),
                from == null ? null : ApplicationState.valueOf(from),
                to == null ? null : ApplicationState.valueOf(to),
                readPayload(rs.getString("payload_json")),
                toInstant(rs.getTimestamp("occurred_at"))
            );
        };
    }

    private RowMapper<FollowUpTask> followUpMapper() {
        return (rs, rowNum) -> new FollowUpTask(
            rs.getLong("id"),
            rs.getLong("application_id"),
            toInstant(rs.getTimestamp("due_at")),
            FollowUpKind.valueOf(rs.getString("kind")),
            rs.getBoolean("completed"),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    private String writePayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize event payload", e);
        }
    }

    private Map<String, Object> readPayload(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read event payload", e);
        }
    }
}
