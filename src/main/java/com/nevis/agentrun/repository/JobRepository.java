package com.nevis.agentrun.repository;

import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.model.JobError;
import com.nevis.agentrun.model.UsageMetrics;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface JobRepository {
    Job save(Job job);
    Optional<Job> findById(UUID id);
    Optional<Job> findByIdAndOwner(UUID id, String ownerId);
    List<Job> findByOwner(String ownerId);
    void markPublished(UUID id);

    /**
     * Compare-and-set PENDING -> RUNNING, or takes over a RUNNING job untouched for longer than {@code staleAfter}.
     * A RUNNING job already holding {@code claimToken} is resumed without counting a new claim.
     * Empty when the job is missing, terminal, or held by another live claimant.
     */
    Optional<Job> claim(UUID id, UUID claimToken, Duration staleAfter);

    boolean recordAttempt(UUID id, UUID claimToken);
    boolean complete(UUID id, UUID claimToken, String result, UsageMetrics usage);
    boolean fail(UUID id, UUID claimToken, JobError error);

    /**
     * Stale RUNNING jobs still below {@code maxClaims}, stamped as republished so they are returned at most
     * once per stale period. The jobs stay RUNNING; the next claim takes them over.
     */
    List<Job> requeueStaleJobs(Duration staleAfter, int maxClaims);
    List<UUID> failAbandonedJobs(Duration staleAfter, int maxClaims, String message);
    List<Job> findUnpublished(Duration olderThan, int limit);
}
