package com.nevis.agentrun.exception;

import lombok.experimental.StandardException;

/**
 * Failure that another attempt cannot fix, e.g. input the toolkit itself rejects.
 */
@StandardException
public class FatalExecutionException extends RuntimeException {
}
