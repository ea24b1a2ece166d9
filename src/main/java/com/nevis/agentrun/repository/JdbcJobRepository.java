package com.nevis.agentrun.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.model.JobError;
import com.nevis.agentrun.model.JobErrorKind;
import com.nevis.agentrun.model.JobStatus;
import com.nevis.agentrun.model.UsageMetrics;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcJobRepository implements JobRepository {

    private static final TypeReference<Map<String, String>> ENV_CONTEXT_TYPE = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    private final RowMapper<Job> jobRowMapper = (rs, rowNum) -> {
        String errorKind = rs.getString("error_kind");
        JobError error = errorKind != null
            ? new JobError(JobErrorKind.valueOf(errorKind), rs.getString("error_message"))
            : null;

        String usage = rs.getString("usage_metrics");

        return new Job(
            rs.getObject("id", UUID.class),
            rs.getString("owner_id"),
            rs.getString("input"),
            JobStatus.valueOf(rs.getString("status")),
            rs.getString("result"),
            error,
            usage != null ? readJson(usage, UsageMetrics.class) : null,
            readEnvContext(rs.getString("env_context")),
            rs.getString("queue_name"),
            rs.getInt("attempts"),
            rs.getInt("claim_count"),
            rs.getObject("claim_token", UUID.class),
            rs.getObject("published_at", OffsetDateTime.class),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class),
            rs.getObject("completed_at", OffsetDateTime.class)
        );
    };

    @Override
    public Job save(Job job) {
        return jdbcClient.sql("""
                INSERT INTO jobs (owner_id, input, status, env_context, queue_name)
                VALUES (:ownerId, :input, 'PENDING'::job_status, CAST(:envContext AS jsonb), :queueName)
                RETURNING *
                """)
            .param("ownerId", job.ownerId())
            .param("input", job.input())
            .param("envContext", writeJson(job.envContext()))
            .param("queueName", job.queueName())
            .query(jobRowMapper)
            .single();
    }

    @Override
    public Optional<Job> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM jobs WHERE id = :id")
            .param("id", id)
            .query(jobRowMapper)
            .optional();
    }

    @Override
    public Optional<Job> findByIdAndOwner(UUID id, String ownerId) {
        return jdbcClient.sql("SELECT * FROM jobs WHERE id = :id AND owner_id = :ownerId")
            .param("id", id)
            .param("ownerId", ownerId)
            .query(jobRowMapper)
            .optional();
    }

    @Override
    public List<Job> findByOwner(String ownerId) {
        return jdbcClient.sql("""
                SELECT * FROM jobs
                WHERE owner_id = :ownerId
                ORDER BY created_at DESC, id
                """)
            .param("ownerId", ownerId)
            .query(jobRowMapper)
            .list();
    }

    @Override
    public void markPublished(UUID id) {
        jdbcClient.sql("""
                UPDATE jobs
                SET published_at = NOW()
                WHERE id = :id AND published_at IS NULL
                """)
            .param("id", id)
            .update();
    }

    @Override
    @Transactional
    public Optional<Job> claim(UUID id, UUID claimToken, Duration staleAfter) {
        String sql = """
            UPDATE jobs
            SET status = 'RUNNING'::job_status,
                claim_count = CASE
                    WHEN status = 'RUNNING'::job_status AND claim_token = :claimToken THEN claim_count
                    ELSE claim_count + 1
                END,
                claim_token = :claimToken,
                updated_at = NOW()
            WHERE id = :id
              AND (
                status = 'PENDING'::job_status
                OR (status = 'RUNNING'::job_status AND claim_token = :claimToken)
                OR (status = 'RUNNING'::job_status AND updated_at < NOW() - (INTERVAL '1 millisecond' * :staleMillis))
              )
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("id", id)
            .param("claimToken", claimToken)
            .param("staleMillis", staleAfter.toMillis())
            .query(jobRowMapper)
            .optional();
    }

    @Override
    public boolean recordAttempt(UUID id, UUID claimToken) {
        String sql = """
            UPDATE jobs
            SET attempts = attempts + 1,
                updated_at = NOW()
            WHERE id = :id
              AND status = 'RUNNING'::job_status
              AND claim_token = :claimToken
            """;

        return jdbcClient.sql(sql)
            .param("id", id)
            .param("claimToken", claimToken)
            .update() == 1;
    }

    @Override
    @Transactional
    public boolean complete(UUID id, UUID claimToken, String result, UsageMetrics usage) {
        String sql = """
            UPDATE jobs
            SET status = 'COMPLETED'::job_status,
                result = :result,
                usage_metrics = CAST(:usage AS jsonb),
                completed_at = NOW(),
                updated_at = NOW()
            WHERE id = :id
              AND status = 'RUNNING'::job_status
              AND claim_token = :claimToken
            """;

        return jdbcClient.sql(sql)
            .param("result", result)
            .param("usage", usage != null ? writeJson(usage) : null)
            .param("id", id)
            .param("claimToken", claimToken)
            .update() == 1;
    }

    @Override
    @Transactional
    public boolean fail(UUID id, UUID claimToken, JobError error) {
        String sql = """
            UPDATE jobs
            SET status = 'FAILED'::job_status,
                error_kind = :errorKind,
                error_message = :errorMessage,
                completed_at = NOW(),
                updated_at = NOW()
            WHERE id = :id
              AND status = 'RUNNING'::job_status
              AND claim_token = :claimToken
            """;

        return jdbcClient.sql(sql)
            .param("errorKind", error.kind().name())
            .param("errorMessage", error.message())
            .param("id", id)
            .param("claimToken", claimToken)
            .update() == 1;
    }

    @Override
    @Transactional
    public List<Job> requeueStaleJobs(Duration staleAfter, int maxClaims) {
        String sql = """
            UPDATE jobs
            SET published_at = NOW()
            WHERE id IN (
                SELECT id
                FROM jobs
                WHERE status = 'RUNNING'::job_status
                  AND updated_at < NOW() - (INTERVAL '1 millisecond' * :staleMillis)
                  AND claim_count < :maxClaims
                  AND (published_at IS NULL OR published_at < NOW() - (INTERVAL '1 millisecond' * :staleMillis))
                FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("staleMillis", staleAfter.toMillis())
            .param("maxClaims", maxClaims)
            .query(jobRowMapper)
            .list();
    }

    @Override
    @Transactional
    public List<UUID> failAbandonedJobs(Duration staleAfter, int maxClaims, String message) {
        String sql = """
            UPDATE jobs
            SET status = 'FAILED'::job_status,
                error_kind = 'WORKER_LOST',
                error_message = :message,
                completed_at = NOW(),
                updated_at = NOW()
            WHERE id IN (
                SELECT id
                FROM jobs
                WHERE status = 'RUNNING'::job_status
                  AND updated_at < NOW() - (INTERVAL '1 millisecond' * :staleMillis)
                  AND claim_count >= :maxClaims
                FOR UPDATE SKIP LOCKED
            )
            RETURNING id
            """;

        return jdbcClient.sql(sql)
            .param("message", message)
            .param("staleMillis", staleAfter.toMillis())
            .param("maxClaims", maxClaims)
            .query(UUID.class)
            .list();
    }

    @Override
    public List<Job> findUnpublished(Duration olderThan, int limit) {
        String sql = """
            SELECT * FROM jobs
            WHERE status = 'PENDING'::job_status
              AND published_at IS NULL
              AND created_at < NOW() - (INTERVAL '1 millisecond' * :ageMillis)
            ORDER BY created_at
            LIMIT :limit
            """;

        return jdbcClient.sql(sql)
            .param("ageMillis", olderThan.toMillis())
            .param("limit", limit)
            .query(jobRowMapper)
            .list();
    }

    @SneakyThrows
    private String writeJson(Object value) {
        return objectMapper.writeValueAsString(value);
    }

    @SneakyThrows
    private <T> T readJson(String json, Class<T> type) {
        return objectMapper.readValue(json, type);
    }

    @SneakyThrows
    private Map<String, String> readEnvContext(String json) {
        return json == null ? Map.of() : objectMapper.readValue(json, ENV_CONTEXT_TYPE);
    }
}
