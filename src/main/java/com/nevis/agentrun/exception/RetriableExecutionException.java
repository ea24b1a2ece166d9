package com.nevis.agentrun.exception;

import lombok.experimental.StandardException;

/**
 * Transient toolkit or credential failure; the worker retries it with backoff.
 */
@StandardException
public class RetriableExecutionException extends RuntimeException {
}
