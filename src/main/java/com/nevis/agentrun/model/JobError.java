package com.nevis.agentrun.model;

public record JobError(
    JobErrorKind kind,
    String message
) {
    public static JobError retriesExhausted(int attempts, String cause) {
        return new JobError(JobErrorKind.RETRIES_EXHAUSTED,
            String.format("Retries exhausted after %d attempts: %s", attempts, cause));
    }

    public static JobError nonRetriable(String cause) {
        return new JobError(JobErrorKind.NON_RETRIABLE, cause);
    }
}
