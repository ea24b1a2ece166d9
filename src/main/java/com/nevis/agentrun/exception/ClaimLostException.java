package com.nevis.agentrun.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class ClaimLostException extends RuntimeException {
    private final UUID jobId;

    public ClaimLostException(UUID jobId) {
        super("Claim on job " + jobId + " was taken over by another worker");
        this.jobId = jobId;
    }
}
