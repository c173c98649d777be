package org.vectorfill.pipeline.retry;

import java.time.Duration;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Exponential backoff shared by the cursor manager, the embedding client and the writer.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseDelay   delay before the first retry
 * @param multiplier  growth factor per retry
 * @param maxDelay    upper bound of a single delay
 */
public record BackoffPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay) {

    private static final Logger log = LoggerFactory.getLogger(BackoffPolicy.class);

    public static final BackoffPolicy DEFAULT =
        new BackoffPolicy(4, Duration.ofSeconds(2), 2.0, Duration.ofMinutes(1));

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0, got " + baseDelay);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got " + multiplier);
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, got " + maxDelay);
        }
    }

    public static BackoffPolicy noRetries() {
        return new BackoffPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /** Delay before retry number {@code retry} (0 based). */
    public Duration delayFor(long retry) {
        double millis = baseDelay.toMillis() * Math.pow(multiplier, retry);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * A Reactor retry spec that retries failures matching {@code retryable} until
     * {@link #maxAttempts} attempts were made, then propagates the last failure unchanged.
     */
    public Retry toRetry(Predicate<Throwable> retryable, String operation) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            var failure = signal.failure();
            long retry = signal.totalRetries();
            if (!retryable.test(failure) || retry + 1 >= maxAttempts) {
                return Mono.error(failure);
            }
            var delay = delayFor(retry);
            log.atWarn().setMessage("{} failed (attempt {}/{}), retrying in {}: {}")
                .addArgument(operation)
                .addArgument(retry + 1)
                .addArgument(maxAttempts)
                .addArgument(delay)
                .addArgument(failure::toString)
                .log();
            return Mono.delay(delay).thenReturn(retry);
        }));
    }
}
