package com.nevis.agentrun.config;

import com.nevis.agentrun.exception.RetriableExecutionException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfig {

    /**
     * Only {@link RetriableExecutionException} is retried; anything else propagates on the first attempt.
     */
    @Bean
    public RetryTemplate toolkitRetryTemplate(WorkerProperties workerProperties) {
        return toolkitRetryTemplate(
            workerProperties.maxAttempts(),
            workerProperties.initialBackoff().toMillis(),
            workerProperties.backoffMultiplier(),
            workerProperties.maxBackoff().toMillis()
        );
    }

    public static RetryTemplate toolkitRetryTemplate(int maxAttempts, long initialBackoffMillis,
                                                     double multiplier, long maxBackoffMillis) {
        return RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .exponentialBackoff(initialBackoffMillis, multiplier, Math.max(maxBackoffMillis, initialBackoffMillis + 1))
            .retryOn(RetriableExecutionException.class)
            .build();
    }
}
