package org.vectorfill.pipeline.embedding;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

/**
 * Builds the requests-per-minute limiter shared by all concurrent embedding calls of a process.
 *
 * <p>{@code burst} permits are handed out per {@code burst / requestsPerMinute} minutes, so up to
 * {@code burst} calls may go back to back after an idle period while the average rate stays at
 * {@code requestsPerMinute}. A caller that would wait longer than {@code maxWait} is refused with
 * {@link io.github.resilience4j.ratelimiter.RequestNotPermitted} without consuming a permit.
 */
public final class EmbeddingRateLimiters {

    public static final String NAME = "embedding-requests";

    private EmbeddingRateLimiters() {}

    public static RateLimiter perMinute(int requestsPerMinute, int burst, Duration maxWait) {
        return RateLimiter.of(NAME, config(requestsPerMinute, burst, maxWait));
    }

    static RateLimiterConfig config(int requestsPerMinute, int burst, Duration maxWait) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be > 0, got " + requestsPerMinute);
        }
        if (burst <= 0) {
            throw new IllegalArgumentException("burst must be > 0, got " + burst);
        }
        long periodNanos = TimeUnit.MINUTES.toNanos(1) * burst / requestsPerMinute;
        return RateLimiterConfig.custom()
            .limitForPeriod(burst)
            .limitRefreshPeriod(Duration.ofNanos(periodNanos))
            .timeoutDuration(maxWait != null ? maxWait : Duration.ZERO)
            .build();
    }
}
