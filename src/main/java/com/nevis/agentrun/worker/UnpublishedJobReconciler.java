package com.nevis.agentrun.worker;

import com.nevis.agentrun.config.WorkerProperties;
import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.repository.JobRepository;
import com.nevis.agentrun.service.JobPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Publishes PENDING jobs that were stored but never reached the queue. A submit that failed to
 * publish is told to poll instead of resubmitting, so this is the only path that runs those jobs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class UnpublishedJobReconciler {

    private final JobRepository jobRepository;
    private final JobPublisher jobPublisher;
    private final WorkerProperties properties;

    @Value("${app.maintenance.reconcile-batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${app.maintenance.reconcile-interval-ms:60000}")
    public void reconcile() {
        List<Job> orphans = jobRepository.findUnpublished(properties.reconcileAfter(), batchSize);
        if (orphans.isEmpty()) {
            return;
        }

        log.info("Republishing {} jobs that never reached the queue", orphans.size());
        int published = 0;
        for (Job job : orphans) {
            try {
                jobPublisher.publish(job);
                published++;
            } catch (RuntimeException e) {
                log.warn("Queue still unavailable for job {}: {}", job.id(), e.getMessage());
                break;
            }
        }
        log.info("Republished {}/{} jobs", published, orphans.size());
    }
}
