package com.nevis.agentrun.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed queue. Consumers lock the next visible row with {@code FOR UPDATE SKIP LOCKED} and push its
 * visibility forward instead of deleting it, so an unacknowledged message reappears after the timeout.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.queue", name = "type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcTaskQueue implements TaskQueue {

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;
    private final Duration visibilityTimeout;
    private final Duration pollInterval;

    private final RowMapper<TaskDelivery> deliveryRowMapper = (rs, rowNum) -> new TaskDelivery(
        rs.getObject("id", UUID.class),
        rs.getString("queue_name"),
        rs.getObject("receipt", UUID.class),
        rs.getInt("delivery_count"),
        readMessage(rs.getString("payload"))
    );

    public JdbcTaskQueue(
        JdbcClient jdbcClient,
        ObjectMapper objectMapper,
        @Value("${app.queue.visibility-timeout:35m}") Duration visibilityTimeout,
        @Value("${app.queue.poll-interval:500ms}") Duration pollInterval
    ) {
        this.jdbcClient = jdbcClient;
        this.objectMapper = objectMapper;
        this.visibilityTimeout = visibilityTimeout;
        this.pollInterval = pollInterval;
    }

    @Override
    public void publish(String queueName, TaskMessage message) {
        jdbcClient.sql("""
                INSERT INTO task_messages (queue_name, job_id, payload)
                VALUES (:queueName, :jobId, CAST(:payload AS jsonb))
                """)
            .param("queueName", queueName)
            .param("jobId", message.jobId())
            .param("payload", writeMessage(message))
            .update();

        log.debug("Published job {} to queue {}", message.jobId(), queueName);
    }

    @Override
    public Optional<TaskDelivery> poll(String queueName, Duration wait) throws InterruptedException {
        long deadline = System.nanoTime() + wait.toNanos();

        while (true) {
            Optional<TaskDelivery> delivery = receiveNext(queueName);
            if (delivery.isPresent()) {
                return delivery;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
        }
    }

    private Optional<TaskDelivery> receiveNext(String queueName) {
        String sql = """
            UPDATE task_messages
            SET receipt = gen_random_uuid(),
                delivery_count = delivery_count + 1,
                visible_at = NOW() + (INTERVAL '1 millisecond' * :visibilityMillis)
            WHERE id = (
                SELECT id FROM task_messages
                WHERE queue_name = :queueName
                  AND visible_at <= NOW()
                ORDER BY visible_at, created_at
                LIMIT 1 FOR UPDATE SKIP LOCKED
            )
            RETURNING id, queue_name, receipt, delivery_count, payload
            """;

        return jdbcClient.sql(sql)
            .param("visibilityMillis", visibilityTimeout.toMillis())
            .param("queueName", queueName)
            .query(deliveryRowMapper)
            .optional();
    }

    @Override
    public void ack(TaskDelivery delivery) {
        int rows = jdbcClient.sql("DELETE FROM task_messages WHERE id = :id AND receipt = :receipt")
            .param("id", delivery.messageId())
            .param("receipt", delivery.receipt())
            .update();

        if (rows == 0) {
            log.debug("Ack for message {} ignored: it was redelivered or already acknowledged", delivery.messageId());
        }
    }

    @Override
    public void release(TaskDelivery delivery, Duration delay) {
        jdbcClient.sql("""
                UPDATE task_messages
                SET receipt = NULL,
                    visible_at = NOW() + (INTERVAL '1 millisecond' * :delayMillis)
                WHERE id = :id AND receipt = :receipt
                """)
            .param("delayMillis", delay.toMillis())
            .param("id", delivery.messageId())
            .param("receipt", delivery.receipt())
            .update();
    }

    @Override
    public int depth(String queueName) {
        return jdbcClient.sql("SELECT COUNT(*) FROM task_messages WHERE queue_name = :queueName")
            .param("queueName", queueName)
            .query(Integer.class)
            .single();
    }

    @SneakyThrows
    private String writeMessage(TaskMessage message) {
        return objectMapper.writeValueAsString(message);
    }

    @SneakyThrows
    private TaskMessage readMessage(String payload) {
        return objectMapper.readValue(payload, TaskMessage.class);
    }
}
