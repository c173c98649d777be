package org.vectorfill.pipeline;

import java.time.Clock;
import java.time.Instant;

import org.vectorfill.pipeline.checkpoint.CheckpointStore;
import org.vectorfill.pipeline.ir.BatchOutcome;
import org.vectorfill.pipeline.ir.DailySpend;
import org.vectorfill.pipeline.ir.PipelineState;
import org.vectorfill.pipeline.ir.SortCursor;
import org.vectorfill.pipeline.ir.TerminationReason;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Sole owner of the run's {@link PipelineState}. Batches are folded in one at a time, in the
 * order they are handed over, and each new state is on disk before the commit completes.
 */
@Slf4j
class StateCommitter {

    private final CheckpointStore store;
    private final Clock clock;
    private volatile PipelineState current;

    StateCommitter(CheckpointStore store, PipelineState initial, Clock clock) {
        this.store = store;
        this.current = initial;
        this.clock = clock;
    }

    PipelineState current() {
        return current;
    }

    Mono<PipelineState> commit(BatchOutcome batch, DailySpend dailySpend) {
        return persist(() -> current.advance(batch, Instant.now(clock)).toBuilder().dailySpend(dailySpend).build())
            .doOnNext(state -> log.atInfo()
                .setMessage("Committed batch {}: {} embedded, {} skipped, {} failed; {} processed, cost {}, cursor {}")
                .addArgument(state.batchesCommitted())
                .addArgument(() -> batch.embeddedIds().size())
                .addArgument(batch::skippedCount)
                .addArgument(batch::failedCount)
                .addArgument(state.processedCount())
                .addArgument(state.totalCost())
                .addArgument(state.cursor())
                .log());
    }

    Mono<PipelineState> continueCandidateScan(SortCursor cursor, Instant scanStartedAt) {
        return persist(() -> current.continueCandidateScan(cursor, scanStartedAt, Instant.now(clock)));
    }

    Mono<PipelineState> completeCandidateScan(Instant scanStartedAt) {
        return persist(() -> current.completeCandidateScan(scanStartedAt, Instant.now(clock)));
    }

    Mono<PipelineState> terminate(TerminationReason reason) {
        return persist(() -> current.terminate(reason, Instant.now(clock)));
    }

    private Mono<PipelineState> persist(StateUpdate update) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                var next = update.apply();
                store.save(next);
                current = next;
                return next;
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @FunctionalInterface
    private interface StateUpdate {
        PipelineState apply();
    }
}
