package com.nevis.agentrun.service;

import com.nevis.agentrun.config.WorkerProperties;
import com.nevis.agentrun.exception.ClaimLostException;
import com.nevis.agentrun.exception.CredentialExpiredException;
import com.nevis.agentrun.exception.FatalExecutionException;
import com.nevis.agentrun.exception.RetriableExecutionException;
import com.nevis.agentrun.exception.StorageException;
import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.model.JobError;
import com.nevis.agentrun.model.Session;
import com.nevis.agentrun.queue.TaskMessage;
import com.nevis.agentrun.repository.JobRepository;
import com.nevis.agentrun.toolkit.Toolkit;
import com.nevis.agentrun.toolkit.ToolkitCredentials;
import com.nevis.agentrun.toolkit.ToolkitResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
public class JobExecutionServiceImpl implements JobExecutionService {

    private final JobRepository jobRepository;
    private final SessionService sessionService;
    private final Toolkit toolkit;
    private final RetryTemplate retryTemplate;
    private final Duration staleTimeout;

    public JobExecutionServiceImpl(
        JobRepository jobRepository,
        SessionService sessionService,
        Toolkit toolkit,
        @Qualifier("toolkitRetryTemplate") RetryTemplate retryTemplate,
        WorkerProperties workerProperties
    ) {
        this.jobRepository = jobRepository;
        this.sessionService = sessionService;
        this.toolkit = toolkit;
        this.retryTemplate = retryTemplate;
        this.staleTimeout = workerProperties.staleTimeout();
    }

    @Override
    public ExecutionOutcome execute(TaskMessage message, UUID claimToken) {
        UUID jobId = message.jobId();

        Optional<Job> claimed = StorageException.guard("job claim",
            () -> jobRepository.claim(jobId, claimToken, staleTimeout));
        if (claimed.isEmpty()) {
            log.info("Job {} is terminal, missing or held by a live worker; discarding message", jobId);
            return ExecutionOutcome.DISCARDED;
        }

        Job job = claimed.get();
        log.info("Claimed job {} for {} (claim #{})", jobId, job.ownerId(), job.claimCount());

        boolean authenticated = sessionService.find(job.ownerId()).map(Session::authenticated).orElse(false);
        if (!authenticated) {
            return fail(job, claimToken, JobError.nonRetriable("Owner has no authenticated session"));
        }

        AtomicInteger attempts = new AtomicInteger();
        try {
            ToolkitResult result = retryTemplate.execute(context -> attempt(job, claimToken, attempts));

            boolean written = StorageException.guard("job completion",
                () -> jobRepository.complete(jobId, claimToken, result.result(), result.usage()));
            if (!written) {
                log.warn("Job {} finished but its claim was taken over; result dropped", jobId);
                return ExecutionOutcome.DISCARDED;
            }
            log.info("Job {} completed after {} attempt(s)", jobId, attempts.get());
            return ExecutionOutcome.COMPLETED;

        } catch (ClaimLostException e) {
            log.warn(e.getMessage());
            return ExecutionOutcome.DISCARDED;
        } catch (StorageException e) {
            throw e;
        } catch (RetriableExecutionException e) {
            return fail(job, claimToken, JobError.retriesExhausted(attempts.get(), e.getMessage()));
        } catch (FatalExecutionException e) {
            return fail(job, claimToken, JobError.nonRetriable(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error while running job {}: {}", jobId, e.getMessage(), e);
            return fail(job, claimToken, JobError.nonRetriable("Unexpected error: " + e.getMessage()));
        }
    }

    private ToolkitResult attempt(Job job, UUID claimToken, AtomicInteger attempts) {
        int attempt = attempts.incrementAndGet();
        boolean stillOwned = StorageException.guard("attempt record",
            () -> jobRepository.recordAttempt(job.id(), claimToken));
        if (!stillOwned) {
            throw new ClaimLostException(job.id());
        }

        Session session = sessionService.find(job.ownerId())
            .filter(Session::authenticated)
            .orElseThrow(() -> new FatalExecutionException("Owner session was revoked during execution"));

        ToolkitCredentials credentials = new ToolkitCredentials(
            job.ownerId(),
            session.credentialData(),
            sessionService.scopeFilter(job.ownerId(), session.requestedScopes())
        );

        log.debug("Job {} attempt {}", job.id(), attempt);
        try {
            return toolkit.execute(job.input(), job.envContext(), credentials);
        } catch (CredentialExpiredException e) {
            log.warn("Job {} attempt {}: credentials expired, refreshing", job.id(), attempt);
            sessionService.refreshCredentials(job.ownerId(), session.credentialVersion());
            throw e;
        } catch (RetriableExecutionException e) {
            log.warn("Job {} attempt {} failed, will retry if attempts remain: {}", job.id(), attempt, e.getMessage());
            throw e;
        }
    }

    private ExecutionOutcome fail(Job job, UUID claimToken, JobError error) {
        boolean written = StorageException.guard("job failure",
            () -> jobRepository.fail(job.id(), claimToken, error));
        if (!written) {
            log.warn("Job {} failed but its claim was taken over; error dropped", job.id());
            return ExecutionOutcome.DISCARDED;
        }
        log.error("Job {} failed ({}): {}", job.id(), error.kind(), error.message());
        return ExecutionOutcome.FAILED;
    }
}
