package com.nevis.agentrun.infra;

/**
 * Per-owner throttle in front of the toolkit. A call reserves its estimated token cost before it runs and is
 * settled against the usage the model reports once it returns.
 */
public interface RateLimiter {

    /**
     * Blocks until the owner has a request and {@code estimatedTokens} left in the current window.
     */
    void reserve(String ownerId, int estimatedTokens);

    /**
     * Charges the part of {@code actualTokens} the reservation did not cover, or refunds what it over-reserved.
     */
    void settle(String ownerId, int estimatedTokens, int actualTokens);
}
