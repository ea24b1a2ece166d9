package com.nevis.agentrun.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record Job(
    UUID id,
    String ownerId,
    String input,
    JobStatus status,
    String result,
    JobError error,
    UsageMetrics usageMetrics,
    Map<String, String> envContext,
    String queueName,
    int attempts,
    int claimCount,
    UUID claimToken,
    OffsetDateTime publishedAt,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt,
    OffsetDateTime completedAt
) {
    public Job {
        envContext = envContext == null ? Map.of() : Map.copyOf(envContext);
    }

    public static Job pending(String ownerId, String input, Map<String, String> envContext, String queueName) {
        return new Job(
            null,
            ownerId,
            input,
            JobStatus.PENDING,
            null,
            null,
            null,
            envContext,
            queueName,
            0,
            0,
            null,
            null,
            null,
            null,
            null
        );
    }
}
