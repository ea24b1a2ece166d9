package com.nevis.agentrun.model;

/**
 * PENDING -> RUNNING -> COMPLETED | FAILED. The compare-and-set updates in the job repository are the only
 * writers of this column.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
