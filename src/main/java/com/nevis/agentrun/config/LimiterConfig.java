package com.nevis.agentrun.config;

import com.nevis.agentrun.infra.BucketRateLimiter;
import com.nevis.agentrun.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("toolkitLimiter")
    public RateLimiter toolkitLimiter(
        @Value("${app.toolkit.requests-per-minute:12}") int requestsPerMinute,
        @Value("${app.toolkit.tokens-per-minute:500000}") int tokensPerMinute
    ) {
        return new BucketRateLimiter(requestsPerMinute, tokensPerMinute);
    }
}
