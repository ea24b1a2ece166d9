package com.nevis.agentrun.config;

import com.nevis.agentrun.exception.FatalExecutionException;
import com.nevis.agentrun.exception.RetriableExecutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryConfigTest {

    private final RetryTemplate retryTemplate = RetryConfig.toolkitRetryTemplate(3, 1, 2.0, 5);

    @Test
    @DisplayName("Retriable failures are retried up to the attempt limit, then rethrown")
    void shouldRetryRetriableUpToLimit() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryTemplate.execute(context -> {
            calls.incrementAndGet();
            throw new RetriableExecutionException("busy");
        })).isInstanceOf(RetriableExecutionException.class);

        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Fatal failures are not retried")
    void shouldNotRetryFatal() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryTemplate.execute(context -> {
            calls.incrementAndGet();
            throw new FatalExecutionException("bad");
        })).isInstanceOf(FatalExecutionException.class);

        assertThat(calls.get()).isEqualTo(1);
    }
}
