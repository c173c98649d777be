package org.vectorfill.pipeline.retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.vectorfill.pipeline.source.StoreFailures;
import org.vectorfill.pipeline.source.TransientStoreException;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BackoffPolicyTest {

    @Test
    void delaysGrowExponentiallyUpToTheCap() {
        var policy = new BackoffPolicy(6, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(10));

        assertEquals(Duration.ofSeconds(2), policy.delayFor(0));
        assertEquals(Duration.ofSeconds(4), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(8), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(10), policy.delayFor(3));
        assertEquals(Duration.ofSeconds(10), policy.delayFor(30));
    }

    @Test
    void transientFailuresAreRetriedAfterTheBackoffDelay() {
        var attempts = new AtomicInteger();
        var policy = new BackoffPolicy(4, Duration.ofSeconds(2), 2.0, Duration.ofMinutes(1));

        StepVerifier.withVirtualTime(() -> Mono.defer(() -> attempts.incrementAndGet() < 3
                    ? Mono.<String>error(new TransientStoreException("503"))
                    : Mono.just("ok"))
                .retryWhen(policy.toRetry(StoreFailures::isTransient, "read")))
            .expectSubscription()
            .expectNoEvent(Duration.ofSeconds(2))
            .thenAwait(Duration.ofSeconds(4))
            .expectNext("ok")
            .verifyComplete();

        assertEquals(3, attempts.get());
    }

    @Test
    void givesUpAfterMaxAttemptsWithTheLastFailure() {
        var attempts = new AtomicInteger();
        var policy = new BackoffPolicy(3, Duration.ZERO, 1.0, Duration.ZERO);

        StepVerifier.create(Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return Mono.error(new TransientStoreException("still down"));
                })
                .retryWhen(policy.toRetry(StoreFailures::isTransient, "read")))
            .expectErrorMatches(e -> e instanceof TransientStoreException && e.getMessage().equals("still down"))
            .verify(Duration.ofSeconds(5));

        assertEquals(3, attempts.get());
    }

    @Test
    void permanentFailuresAreNotRetried() {
        var attempts = new AtomicInteger();

        StepVerifier.create(Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return Mono.error(new IllegalArgumentException("bad query"));
                })
                .retryWhen(BackoffPolicy.DEFAULT.toRetry(StoreFailures::isTransient, "read")))
            .expectError(IllegalArgumentException.class)
            .verify(Duration.ofSeconds(5));

        assertEquals(1, attempts.get());
    }

    @Test
    void rejectsInconsistentSettings() {
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(0, Duration.ZERO, 1.0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(3, Duration.ofSeconds(5), 2.0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(3, Duration.ZERO, 0.5, Duration.ZERO));
    }
}
