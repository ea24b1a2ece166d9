package com.nevis.agentrun.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute and tokens-per-minute budgets per owner, in process memory.
 *
 * <p>Output tokens are only known after the model answered, so a settled call may leave the token bucket in
 * debt; the owner's next reservation then waits until the window has paid it back.</p>
 */
@Slf4j
public class BucketRateLimiter implements RateLimiter {

    private record OwnerBudget(Bucket requests, Bucket tokens) {}

    private final Map<String, OwnerBudget> budgets = new ConcurrentHashMap<>();

    private final int requestsPerMinute;
    private final int tokensPerMinute;

    public BucketRateLimiter(int requestsPerMinute, int tokensPerMinute) {
        if (requestsPerMinute < 1 || tokensPerMinute < 1) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.tokensPerMinute = tokensPerMinute;
    }

    private OwnerBudget budget(String ownerId) {
        return budgets.computeIfAbsent(ownerId, k -> new OwnerBudget(perMinute(requestsPerMinute), perMinute(tokensPerMinute)));
    }

    private static Bucket perMinute(int capacity) {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(capacity, Refill.greedy(capacity, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    @SneakyThrows
    public void reserve(String ownerId, int estimatedTokens) {
        OwnerBudget budget = budget(ownerId);
        budget.requests().asBlocking().consume(1);
        budget.tokens().asBlocking().consume(clamp(estimatedTokens));
    }

    @Override
    public void settle(String ownerId, int estimatedTokens, int actualTokens) {
        long difference = (long) actualTokens - clamp(estimatedTokens);
        if (difference == 0) {
            return;
        }
        Bucket tokens = budget(ownerId).tokens();
        if (difference > 0) {
            tokens.consumeIgnoringRateLimits(Math.min(difference, tokensPerMinute));
            log.debug("Charged {} extra tokens to {}", difference, ownerId);
        } else {
            tokens.addTokens(-difference);
        }
    }

    // a single call larger than the whole window would block forever
    private long clamp(int tokens) {
        return Math.max(1, Math.min(tokens, tokensPerMinute));
    }

    long availableRequests(String ownerId) {
        OwnerBudget budget = budgets.get(ownerId);
        return budget == null ? requestsPerMinute : budget.requests().getAvailableTokens();
    }

    long availableTokens(String ownerId) {
        OwnerBudget budget = budgets.get(ownerId);
        return budget == null ? tokensPerMinute : budget.tokens().getAvailableTokens();
    }
}
