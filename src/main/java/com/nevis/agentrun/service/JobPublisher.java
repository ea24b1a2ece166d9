package com.nevis.agentrun.service;

import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.queue.TaskMessage;
import com.nevis.agentrun.queue.TaskQueue;
import com.nevis.agentrun.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Hands a stored job to its queue and records that it was handed over.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobPublisher {

    private final TaskQueue taskQueue;
    private final JobRepository jobRepository;

    /**
     * Queue failures propagate; a failure to stamp {@code published_at} afterwards is only logged,
     * since the worst outcome is a duplicate message.
     */
    public void publish(Job job) {
        taskQueue.publish(job.queueName(), TaskMessage.from(job));
        try {
            jobRepository.markPublished(job.id());
        } catch (RuntimeException e) {
            log.warn("Job {} queued but not marked as published: {}", job.id(), e.getMessage());
        }
    }
}
