package com.nevis.agentrun.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process queue with the same visibility and acknowledgement semantics as {@link JdbcTaskQueue}.
 * Messages do not survive a restart.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.queue", name = "type", havingValue = "memory")
public class InMemoryTaskQueue implements TaskQueue {

    private final Map<String, List<Entry>> queues = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Duration visibilityTimeout;

    public InMemoryTaskQueue(@Value("${app.queue.visibility-timeout:35m}") Duration visibilityTimeout) {
        this.visibilityTimeout = visibilityTimeout;
    }

    private static final class Entry {
        private final UUID id = UUID.randomUUID();
        private final TaskMessage message;
        private long visibleAtNanos;
        private UUID receipt;
        private int deliveryCount;

        private Entry(TaskMessage message, long visibleAtNanos) {
            this.message = message;
            this.visibleAtNanos = visibleAtNanos;
        }
    }

    @Override
    public void publish(String queueName, TaskMessage message) {
        lock.lock();
        try {
            queues.computeIfAbsent(queueName, k -> new ArrayList<>()).add(new Entry(message, System.nanoTime()));
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Published job {} to in-memory queue {}", message.jobId(), queueName);
    }

    @Override
    public Optional<TaskDelivery> poll(String queueName, Duration wait) throws InterruptedException {
        long remaining = wait.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                long now = System.nanoTime();
                List<Entry> entries = queues.getOrDefault(queueName, List.of());

                Entry next = null;
                long untilNextVisible = Long.MAX_VALUE;
                for (Entry entry : entries) {
                    long delta = entry.visibleAtNanos - now;
                    if (delta <= 0) {
                        next = entry;
                        break;
                    }
                    untilNextVisible = Math.min(untilNextVisible, delta);
                }

                if (next != null) {
                    next.receipt = UUID.randomUUID();
                    next.deliveryCount++;
                    next.visibleAtNanos = now + visibilityTimeout.toNanos();
                    return Optional.of(new TaskDelivery(next.id, queueName, next.receipt, next.deliveryCount, next.message));
                }

                if (remaining <= 0) {
                    return Optional.empty();
                }

                long waitNanos = Math.min(remaining, untilNextVisible);
                long left = changed.awaitNanos(waitNanos);
                remaining -= waitNanos - Math.max(left, 0);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void ack(TaskDelivery delivery) {
        lock.lock();
        try {
            boolean removed = queues.getOrDefault(delivery.queueName(), new ArrayList<>())
                .removeIf(entry -> entry.id.equals(delivery.messageId()) && delivery.receipt().equals(entry.receipt));
            if (!removed) {
                log.debug("Ack for message {} ignored: it was redelivered or already acknowledged", delivery.messageId());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(TaskDelivery delivery, Duration delay) {
        lock.lock();
        try {
            for (Entry entry : queues.getOrDefault(delivery.queueName(), List.of())) {
                if (entry.id.equals(delivery.messageId()) && delivery.receipt().equals(entry.receipt)) {
                    entry.receipt = null;
                    entry.visibleAtNanos = System.nanoTime() + delay.toNanos();
                    changed.signalAll();
                    return;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int depth(String queueName) {
        lock.lock();
        try {
            return queues.getOrDefault(queueName, List.of()).size();
        } finally {
            lock.unlock();
        }
    }
}
