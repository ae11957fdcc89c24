package com.delta.opportunities.pipeline.persistence;

import com.delta.opportunities.pipeline.model.UserProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.delta.opportunities.pipeline.persistence.OpportunityJdbcRepository.toTimestamp;

@Repository
public class ProfileJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public ProfileJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public Optional<UserProfile> find(String userId) {
        List<String> rows = jdbc.query(
            "SELECT profile_json FROM user_profiles WHERE user_id = :userId",
            new MapSqlParameterSource().addValue("userId", userId),
            (rs, rowNum) -> rs.getString("profile_json")
        );
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(rows.get(0), UserProfile.class).withUserId(userId));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read profile for " + userId, e);
        }
    }

    public void save(UserProfile profile, Instant now) {
        String json;
        try {
            json = objectMapper.writeValueAsString(profile);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize profile for " + profile.userId(), e);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("userId", profile.userId())
            .addValue("profileJson", json)
            .addValue("updatedAt", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE user_profiles
                SET profile_json = :profileJson,
                    updated_at = :updatedAt
                WHERE user_id = :userId
                """,
            params
        );
        if (updated > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO user_profiles (user_id, profile_json, updated_at)
                    VALUES (:userId, :profileJson, :updatedAt)
                    """,
                params
            );
        } catch (DuplicateKeyException e) {
            jdbc.update(
                "UPDATE user_profiles SET profile_json = :profileJson, updated_at = :updatedAt WHERE user_id = :userId",
                params
            );
        }
    }
}
