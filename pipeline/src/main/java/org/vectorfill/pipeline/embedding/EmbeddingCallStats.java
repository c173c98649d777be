package org.vectorfill.pipeline.embedding;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of embedding calls made by one client, read into the run report.
 */
public class EmbeddingCallStats {

    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong tokens = new AtomicLong();
    private final AtomicLong latencyMillis = new AtomicLong();

    void call() {
        calls.incrementAndGet();
    }

    void attempt() {
        attempts.incrementAndGet();
    }

    void success(long tokenCount, long elapsedMillis) {
        successes.incrementAndGet();
        tokens.addAndGet(tokenCount);
        latencyMillis.addAndGet(elapsedMillis);
    }

    void failure() {
        failures.incrementAndGet();
    }

    public Snapshot snapshot() {
        long ok = successes.get();
        long sent = attempts.get();
        return new Snapshot(calls.get(), sent, ok, failures.get(), Math.max(0, sent - calls.get()), tokens.get(),
            ok == 0 ? 0 : latencyMillis.get() / ok);
    }

    /**
     * @param calls             logical calls, one per group of texts
     * @param attempts          requests sent, retries included
     * @param successes         calls that returned embeddings
     * @param failures          calls that gave up
     * @param retries           requests that repeated a failed one
     * @param tokens            tokens billed across successful calls
     * @param meanLatencyMillis mean latency of successful calls, rate limit waits included
     */
    public record Snapshot(long calls, long attempts, long successes, long failures, long retries, long tokens,
                           long meanLatencyMillis) {}
}
