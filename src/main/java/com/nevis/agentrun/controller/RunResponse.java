package com.nevis.agentrun.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.agentrun.model.JobStatus;

import java.util.UUID;

public record RunResponse(
    @JsonProperty("job_id")
    UUID jobId,

    JobStatus status,

    String message
) {}
