package com.nevis.agentrun.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.model.JobErrorKind;
import com.nevis.agentrun.model.JobStatus;
import com.nevis.agentrun.model.UsageMetrics;

import java.time.OffsetDateTime;
import java.util.UUID;

public record JobResponse(
    @JsonProperty("job_id")
    UUID jobId,

    @JsonProperty("owner_id")
    String ownerId,

    String message,

    JobStatus status,

    String result,

    @JsonProperty("error_kind")
    JobErrorKind errorKind,

    @JsonProperty("error_message")
    String errorMessage,

    @JsonProperty("resubmittable")
    Boolean resubmittable,

    @JsonProperty("token_usage")
    UsageMetrics tokenUsage,

    int attempts,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt,

    @JsonProperty("completed_at")
    OffsetDateTime completedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
            job.id(),
            job.ownerId(),
            job.input(),
            job.status(),
            job.result(),
            job.error() == null ? null : job.error().kind(),
            job.error() == null ? null : job.error().message(),
            job.error() == null ? null : job.error().kind().isResubmittable(),
            job.usageMetrics(),
            job.attempts(),
            job.createdAt(),
            job.updatedAt(),
            job.completedAt()
        );
    }
}
