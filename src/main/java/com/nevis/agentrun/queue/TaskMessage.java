package com.nevis.agentrun.queue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.agentrun.model.Job;

import java.util.Map;
import java.util.UUID;

public record TaskMessage(
    @JsonProperty("job_id") UUID jobId,
    @JsonProperty("owner_id") String ownerId,
    String input,
    @JsonProperty("env_context") Map<String, String> envContext
) {
    public static TaskMessage from(Job job) {
        return new TaskMessage(job.id(), job.ownerId(), job.input(), job.envContext());
    }
}
