package com.nevis.agentrun.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * At-least-once channel between the submission gateway and the workers.
 *
 * <p>A polled message stays invisible to other consumers for the visibility timeout and is delivered again
 * unless it is acknowledged first. Workers acknowledge only once the job is terminal, the claim was lost,
 * or the job was abandoned; a crash between poll and ack therefore results in redelivery.</p>
 */
public interface TaskQueue {

    void publish(String queueName, TaskMessage message);

    /**
     * Waits up to {@code wait} for a visible message on the queue.
     */
    Optional<TaskDelivery> poll(String queueName, Duration wait) throws InterruptedException;

    void ack(TaskDelivery delivery);

    /**
     * Gives the message back for redelivery after {@code delay} without acknowledging it.
     */
    void release(TaskDelivery delivery, Duration delay);

    int depth(String queueName);
}
