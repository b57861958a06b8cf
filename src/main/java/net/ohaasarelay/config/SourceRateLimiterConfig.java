/**
 * Configuration for the horoscope feed rate limiter
 * - Every guild keeps its own cache entry, so a shared post time makes many guilds miss at once
 * - Keeps those misses from bursting against the broadcaster's feed
 */
package net.ohaasarelay.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class SourceRateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(SourceRateLimiterConfig.class);

    private static final Duration PERMIT_WAIT = Duration.ofSeconds(30);

    /**
     * Rate limiter for the Oha Asa JSON feed
     * - Refreshes once a minute with the configured request budget
     * - Callers wait up to 30 seconds for a permit before failing the fetch
     *
     * @return Configured rate limiter instance
     */
    @Bean
    public RateLimiter horoscopeSourceRateLimiter(OhaasaProperties properties) {
        int requestsPerMinute = properties.getSource().getRequestsPerMinute();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(requestsPerMinute)
                .timeoutDuration(PERMIT_WAIT)
                .build();

        RateLimiter rateLimiter = RateLimiter.of("horoscopeSourceRateLimiter", config);

        logger.info("Horoscope feed rate limiter initialized with limit of {} requests per minute", requestsPerMinute);

        return rateLimiter;
    }
}
