package com.nevis.agentrun.worker;

import com.nevis.agentrun.config.WorkerProperties;
import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.repository.JobRepository;
import com.nevis.agentrun.service.JobPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Recovers RUNNING jobs whose worker stopped making progress. They are queued again so another worker can claim
 * them, or failed once they have been claimed too often.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StaleJobReclaimWorker {

    private final JobRepository jobRepository;
    private final JobPublisher jobPublisher;
    private final WorkerProperties properties;

    @Scheduled(fixedDelayString = "${app.maintenance.reclaim-interval-ms:60000}")
    public void reclaimStaleJobs() {
        log.debug("Checking for stale running jobs...");

        List<UUID> abandoned = jobRepository.failAbandonedJobs(
            properties.staleTimeout(),
            properties.maxClaims(),
            "Worker stopped responding " + properties.maxClaims() + " times"
        );
        if (!abandoned.isEmpty()) {
            log.error("Failed {} jobs abandoned by workers: {}", abandoned.size(), abandoned);
        }

        List<Job> stale = jobRepository.requeueStaleJobs(properties.staleTimeout(), properties.maxClaims());
        if (stale.isEmpty()) {
            return;
        }
        log.info("Requeueing {} stale jobs for another worker", stale.size());
        for (Job job : stale) {
            try {
                jobPublisher.publish(job);
            } catch (RuntimeException e) {
                // retried after another stale period
                log.warn("Could not requeue stale job {}: {}", job.id(), e.getMessage());
            }
        }
    }
}
