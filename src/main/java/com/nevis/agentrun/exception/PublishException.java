package com.nevis.agentrun.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * The job was stored but its task could not be handed to the queue. The stored job is queued later by
 * reconciliation, so the caller should poll it instead of submitting again.
 */
@Getter
public class PublishException extends RuntimeException {
    private final UUID jobId;

    public PublishException(UUID jobId, Throwable cause) {
        super("Job " + jobId + " was stored but could not be queued yet", cause);
        this.jobId = jobId;
    }
}
