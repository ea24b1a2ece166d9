package com.nevis.agentrun.worker;

import com.nevis.agentrun.config.WorkerProperties;
import com.nevis.agentrun.queue.TaskDelivery;
import com.nevis.agentrun.queue.TaskQueue;
import com.nevis.agentrun.service.ExecutionOutcome;
import com.nevis.agentrun.service.JobExecutionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pull loops over the configured queues, one per unit of concurrency.
 *
 * <p>A message is acknowledged once its job reached a terminal state or the claim was discarded. When the job
 * store is unreachable the message is released instead, so it is delivered again later. The message id doubles
 * as the claim token, which lets that redelivery pick up the job it had already claimed.</p>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobWorkerPool implements DisposableBean {

    private final TaskQueue taskQueue;
    private final JobExecutionService executionService;
    private final TaskExecutor executor;
    private final WorkerProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public JobWorkerPool(
        TaskQueue taskQueue,
        JobExecutionService executionService,
        @Qualifier("jobWorkerExecutor") TaskExecutor executor,
        WorkerProperties properties
    ) {
        this.taskQueue = taskQueue;
        this.executionService = executionService;
        this.executor = executor;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        properties.queues().forEach((queueName, concurrency) -> {
            for (int i = 0; i < concurrency; i++) {
                executor.execute(() -> pullLoop(queueName));
            }
            log.info("Started {} worker loop(s) on queue {}", concurrency, queueName);
        });
    }

    @Override
    public void destroy() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping worker loops");
        }
    }

    boolean isRunning() {
        return running.get();
    }

    private void pullLoop(String queueName) {
        while (running.get()) {
            try {
                Optional<TaskDelivery> delivery = taskQueue.poll(queueName, properties.pollWait());
                delivery.ifPresent(this::handle);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Worker loop on {} interrupted", queueName);
                return;
            } catch (RuntimeException e) {
                log.error("Polling {} failed, backing off: {}", queueName, e.getMessage(), e);
                if (!pause()) {
                    return;
                }
            }
        }
        log.debug("Worker loop on {} exited", queueName);
    }

    void handle(TaskDelivery delivery) {
        if (delivery.deliveryCount() > 1) {
            log.info("Redelivery #{} of job {}", delivery.deliveryCount(), delivery.message().jobId());
        }
        ExecutionOutcome outcome;
        try {
            outcome = executionService.execute(delivery.message(), delivery.messageId());
        } catch (RuntimeException e) {
            log.error("Job {} could not be processed, releasing message: {}",
                delivery.message().jobId(), e.getMessage(), e);
            taskQueue.release(delivery, properties.redeliveryDelay());
            return;
        }
        log.debug("Job {} handled with outcome {}", delivery.message().jobId(), outcome);
        taskQueue.ack(delivery);
    }

    private boolean pause() {
        try {
            Thread.sleep(properties.redeliveryDelay().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
