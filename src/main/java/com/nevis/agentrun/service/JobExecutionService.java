package com.nevis.agentrun.service;

import com.nevis.agentrun.queue.TaskMessage;

import java.util.UUID;

public interface JobExecutionService {

    /**
     * Claims and runs the job behind {@code message}. Throws {@link com.nevis.agentrun.exception.StorageException}
     * when the job store cannot be reached, in which case the message must not be acknowledged.
     *
     * @param claimToken stable across redeliveries of one queue message, so a redelivery after a released
     *                   delivery resumes the job that delivery had claimed
     */
    ExecutionOutcome execute(TaskMessage message, UUID claimToken);
}
