package com.nevis.agentrun.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.agentrun.model.Session;
import com.nevis.agentrun.model.SessionUpdate;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Array;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
@RequiredArgsConstructor
public class JdbcSessionRepository implements SessionRepository {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT_TYPE = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    private final RowMapper<Session> sessionRowMapper = (rs, rowNum) -> new Session(
        rs.getString("owner_id"),
        readObject(rs.getString("credential_data")),
        rs.getLong("credential_version"),
        toSet(rs.getArray("requested_scopes")),
        toSet(rs.getArray("granted_scopes")),
        rs.getBoolean("authenticated"),
        readObject(rs.getString("profile")),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public Optional<Session> findByOwnerId(String ownerId) {
        return jdbcClient.sql("SELECT * FROM sessions WHERE owner_id = :ownerId")
            .param("ownerId", ownerId)
            .query(sessionRowMapper)
            .optional();
    }

    @Override
    @Transactional
    public Session upsert(String ownerId, SessionUpdate update) {
        jdbcClient.sql("INSERT INTO sessions (owner_id) VALUES (:ownerId) ON CONFLICT (owner_id) DO NOTHING")
            .param("ownerId", ownerId)
            .update();

        Session current = jdbcClient.sql("SELECT * FROM sessions WHERE owner_id = :ownerId FOR UPDATE")
            .param("ownerId", ownerId)
            .query(sessionRowMapper)
            .single();

        Session merged = update.applyTo(current);

        return jdbcClient.sql("""
                UPDATE sessions
                SET credential_data = CAST(:credentialData AS jsonb),
                    credential_version = :credentialVersion,
                    requested_scopes = :requestedScopes,
                    granted_scopes = :grantedScopes,
                    authenticated = :authenticated,
                    profile = CAST(:profile AS jsonb),
                    updated_at = NOW()
                WHERE owner_id = :ownerId
                RETURNING *
                """)
            .param("credentialData", writeJson(merged.credentialData()))
            .param("credentialVersion", merged.credentialVersion())
            .param("requestedScopes", merged.requestedScopes().toArray(new String[0]))
            .param("grantedScopes", merged.grantedScopes().toArray(new String[0]))
            .param("authenticated", merged.authenticated())
            .param("profile", writeJson(merged.profile()))
            .param("ownerId", ownerId)
            .query(sessionRowMapper)
            .single();
    }

    @Override
    public boolean updateCredentials(String ownerId, Map<String, Object> credentialData, long expectedVersion) {
        String sql = """
            UPDATE sessions
            SET credential_data = CAST(:credentialData AS jsonb),
                credential_version = credential_version + 1,
                updated_at = NOW()
            WHERE owner_id = :ownerId
              AND credential_version = :expectedVersion
            """;

        return jdbcClient.sql(sql)
            .param("credentialData", writeJson(credentialData))
            .param("ownerId", ownerId)
            .param("expectedVersion", expectedVersion)
            .update() == 1;
    }

    @Override
    public boolean markLoggedOut(String ownerId) {
        return jdbcClient.sql("""
                UPDATE sessions
                SET authenticated = FALSE,
                    updated_at = NOW()
                WHERE owner_id = :ownerId
                """)
            .param("ownerId", ownerId)
            .update() == 1;
    }

    private static Set<String> toSet(Array array) throws SQLException {
        if (array == null) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList((String[]) array.getArray()));
    }

    @SneakyThrows
    private String writeJson(Object value) {
        return objectMapper.writeValueAsString(value);
    }

    @SneakyThrows
    private Map<String, Object> readObject(String json) {
        return json == null ? Map.of() : objectMapper.readValue(json, JSON_OBJECT_TYPE);
    }
}
