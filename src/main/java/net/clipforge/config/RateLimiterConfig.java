/**
 * Configuration for request throttling
 * - Per-owner inbound request counters for the generation endpoint
 * - Outbound submission limiter protecting the generation service quota
 */
package net.clipforge.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import net.clipforge.support.ratelimit.CaffeineRequestCounterStore;
import net.clipforge.support.ratelimit.RequestCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiterConfig.class);

    @Bean
    public RequestCounterStore requestCounterStore(GenerationProperties generationProperties) {
        return new CaffeineRequestCounterStore(generationProperties.getRateLimit().getMaximumTrackedOwners());
    }

    /**
     * Rate limiter for job submissions to the generation service
     * - Waits up to the request timeout for a permit rather than failing fast
     *
     * @return Configured rate limiter instance
     */
    @Bean
    public RateLimiter generationSubmitRateLimiter(GenerationProperties generationProperties) {
        io.github.resilience4j.ratelimiter.RateLimiterConfig config = io.github.resilience4j.ratelimiter.RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, generationProperties.getSubmitsPerMinute()))
                .timeoutDuration(generationProperties.getRequestTimeout())
                .build();

        RateLimiter rateLimiter = RateLimiter.of("generationSubmitRateLimiter", config);

        logger.info("Generation submit rate limiter initialized with limit of {} submissions/minute",
                generationProperties.getSubmitsPerMinute());

        return rateLimiter;
    }
}
