package com.nevis.agentrun.service;

/**
 * What happened to a delivered task. Every outcome means the message can be acknowledged.
 */
public enum ExecutionOutcome {
    COMPLETED,
    FAILED,
    /** The job was terminal or claimed elsewhere; nothing was written. */
    DISCARDED
}
