package org.vectorfill.pipeline;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import org.vectorfill.pipeline.ir.PipelineState;

/**
 * Rolling average of recent batch times, used to estimate how long a targeted backfill still runs.
 */
class BatchProgress {

    static final int WINDOW = 10;

    private final Deque<Duration> recent = new ArrayDeque<>();
    private final int concurrentBatches;

    BatchProgress(int concurrentBatches) {
        this.concurrentBatches = Math.max(1, concurrentBatches);
    }

    synchronized void record(Duration batchTime) {
        recent.addLast(batchTime);
        if (recent.size() > WINDOW) {
            recent.removeFirst();
        }
    }

    /** Empty without a target or before the first batch. */
    synchronized Optional<Duration> remaining(PipelineState state) {
        if (recent.isEmpty() || state.targetCount() <= 0) {
            return Optional.empty();
        }
        long total = 0;
        for (var time : recent) {
            total += time.toMillis();
        }
        long average = total / recent.size();
        long remainingBatches = (state.remainingToTarget() + state.batchSize() - 1) / state.batchSize();
        return Optional.of(Duration.ofMillis(average * remainingBatches / concurrentBatches));
    }
}
