package com.nevis.agentrun.service;

import com.nevis.agentrun.exception.EntityNotFoundException;
import com.nevis.agentrun.exception.PublishException;
import com.nevis.agentrun.exception.SessionNotAuthenticatedException;
import com.nevis.agentrun.exception.StorageException;
import com.nevis.agentrun.exception.ValidationException;
import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.model.Session;
import com.nevis.agentrun.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@Slf4j
public class JobServiceImpl implements JobService {

    private static final String ENTITY = "Job";

    private final JobRepository jobRepository;
    private final JobPublisher jobPublisher;
    private final SessionService sessionService;

    @Value("${app.gateway.queue:agent-runs}")
    private String queueName;

    @Value("${app.gateway.max-input-chars:20000}")
    private int maxInputChars;

    @Value("${app.gateway.require-authenticated-session:true}")
    private boolean requireAuthenticatedSession;

    public JobServiceImpl(JobRepository jobRepository, JobPublisher jobPublisher, SessionService sessionService) {
        this.jobRepository = jobRepository;
        this.jobPublisher = jobPublisher;
        this.sessionService = sessionService;
    }

    /**
     * Not transactional on purpose: the record must stay visible as PENDING when publishing fails.
     */
    @Override
    public Job submit(String ownerId, String input, Map<String, String> envContext) {
        Map<String, String> env = envContext == null ? Map.of() : envContext;
        validate(input, env);

        if (requireAuthenticatedSession) {
            boolean authenticated = sessionService.find(ownerId).map(Session::authenticated).orElse(false);
            if (!authenticated) {
                throw new SessionNotAuthenticatedException(ownerId);
            }
        }

        Job job = StorageException.guard("job create",
            () -> jobRepository.save(Job.pending(ownerId, input, env, queueName)));
        log.info("Job {} submitted by {} to queue {}", job.id(), ownerId, queueName);

        try {
            jobPublisher.publish(job);
        } catch (RuntimeException e) {
            log.error("Job {} stored but publishing to {} failed: {}", job.id(), queueName, e.getMessage(), e);
            throw new PublishException(job.id(), e);
        }
        return job;
    }

    private void validate(String input, Map<String, String> env) {
        if (input == null || input.isBlank()) {
            throw new ValidationException("Input must not be blank");
        }
        if (input.length() > maxInputChars) {
            throw new ValidationException("Input exceeds " + maxInputChars + " characters");
        }
        env.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new ValidationException("Environment keys must not be blank");
            }
            if (value == null) {
                throw new ValidationException("Environment value for '" + key + "' must not be null");
            }
        });
    }

    @Override
    public Job get(UUID jobId, String ownerId) {
        return StorageException.guard("job lookup", () -> jobRepository.findByIdAndOwner(jobId, ownerId))
            .orElseThrow(() -> new EntityNotFoundException(ENTITY, jobId));
    }

    @Override
    public List<Job> list(String ownerId) {
        return StorageException.guard("job listing", () -> jobRepository.findByOwner(ownerId));
    }
}
