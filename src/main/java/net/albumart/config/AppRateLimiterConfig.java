/**
 * Configuration for outbound API rate limiting
 * - Keeps artwork lookups inside the public iTunes Search allowance
 * - Complements the server-driven cooldown gate used after a rejection
 */
package net.albumart.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AppRateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppRateLimiterConfig.class);

    /**
     * Rate limiter for the iTunes Search API
     * - Limits requests per minute from configuration
     * - Never waits for a permit; an exhausted budget degrades to native artwork
     *
     * @param properties application properties supplying the per-minute budget
     * @return Configured rate limiter instance
     */
    @Bean
    public RateLimiter itunesArtworkRateLimiter(AlbumArtProperties properties) {
        int requestsPerMinute = properties.getArtwork().getRequestsPerMinute();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(requestsPerMinute)
                .timeoutDuration(Duration.ZERO)
                .build();

        RateLimiter rateLimiter = RateLimiter.of("itunesArtwork", config);

        logger.info("iTunes artwork rate limiter initialized with limit of {} requests per minute", requestsPerMinute);

        return rateLimiter;
    }
}
