package com.nevis.agentrun.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * {@code jobId} is only set when a job was stored despite the error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String message,
    int status,
    long timestamp,
    @JsonProperty("job_id") UUID jobId
) {}
