package org.vectorfill.pipeline.ir;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import lombok.Builder;

/**
 * Progress of one run. Immutable; the pipeline replaces its instance after every committed batch
 * and only the checkpoint store persists it.
 *
 * <p>{@code cursor} always holds the sort values of the last document of the last batch whose
 * embeddings were acknowledged by the store. {@code failedCount} is the number of distinct ids in
 * {@code failedDocumentIds} and {@code quarantinedDocumentIds}, so it shrinks when a later attempt
 * succeeds.
 *
 * <p>In continuous mode a candidate scan may span several cycles: {@code candidateCursor} is
 * where the next cycle resumes it and {@code candidateScanStartedAt} when it began. The
 * watermark only moves, to that start, once a scan has reached the end of the candidates.
 */
@Builder(toBuilder = true)
public record PipelineState(
    String sessionId,
    PipelineMode mode,
    long targetCount,
    long processedCount,
    long embeddedCount,
    long skippedCount,
    long failedCount,
    int batchSize,
    long batchesCommitted,
    long totalTokens,
    BigDecimal totalCost,
    SortCursor cursor,
    Instant continuousWatermark,
    SortCursor candidateCursor,
    Instant candidateScanStartedAt,
    DailySpend dailySpend,
    Set<String> failedDocumentIds,
    Set<String> quarantinedDocumentIds,
    Instant startedAt,
    Instant updatedAt,
    TerminationReason terminationReason
) {
    public PipelineState {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got " + batchSize);
        }
        totalCost = totalCost == null ? BigDecimal.ZERO : totalCost;
        failedDocumentIds = sortedCopy(failedDocumentIds);
        quarantinedDocumentIds = sortedCopy(quarantinedDocumentIds);
        var allFailed = new TreeSet<>(failedDocumentIds);
        allFailed.addAll(quarantinedDocumentIds);
        failedCount = allFailed.size();
    }

    private static Set<String> sortedCopy(Set<String> ids) {
        return ids == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(new TreeSet<>(ids));
    }

    public static PipelineState start(String sessionId, PipelineMode mode, long targetCount, int batchSize, Instant now) {
        return PipelineState.builder()
            .sessionId(sessionId)
            .mode(mode)
            .targetCount(targetCount)
            .batchSize(batchSize)
            .startedAt(now)
            .updatedAt(now)
            .build();
    }

    /** Whether a positive target was set and has been reached. */
    public boolean reachedTarget() {
        return targetCount > 0 && processedCount >= targetCount;
    }

    /** Documents still to visit before the target, or {@link Long#MAX_VALUE} without a target. */
    public long remainingToTarget() {
        return targetCount > 0 ? Math.max(0, targetCount - processedCount) : Long.MAX_VALUE;
    }

    public boolean knowsFailure(String documentId) {
        return failedDocumentIds.contains(documentId) || quarantinedDocumentIds.contains(documentId);
    }

    /**
     * Folds a committed batch into a new state. The cursor only moves when the batch carries one,
     * which is the case for backfill pages but not for continuous cycles.
     */
    public PipelineState advance(BatchOutcome batch, Instant now) {
        var failed = new TreeSet<>(failedDocumentIds);
        var quarantined = new TreeSet<>(quarantinedDocumentIds);
        failed.removeAll(batch.embeddedIds());
        quarantined.removeAll(batch.embeddedIds());
        failed.addAll(batch.failedIds());
        quarantined.addAll(batch.quarantinedIds());
        failed.removeAll(batch.quarantinedIds());
        return toBuilder()
            .processedCount(processedCount + batch.visitedCount())
            .embeddedCount(embeddedCount + batch.embeddedIds().size())
            .skippedCount(skippedCount + batch.skippedCount())
            .batchesCommitted(batchesCommitted + 1)
            .totalTokens(totalTokens + batch.tokens())
            .totalCost(totalCost.add(batch.cost()))
            .cursor(batch.cursor() != null ? batch.cursor() : cursor)
            .failedDocumentIds(failed)
            .quarantinedDocumentIds(quarantined)
            .updatedAt(now)
            .build();
    }

    /** The candidate scan stopped at its limit and continues after {@code cursor} next cycle. */
    public PipelineState continueCandidateScan(SortCursor cursor, Instant scanStartedAt, Instant now) {
        return toBuilder().candidateCursor(cursor).candidateScanStartedAt(scanStartedAt).updatedAt(now).build();
    }

    /** The candidate scan reached the end; changes from {@code scanStartedAt} on are picked up next. */
    public PipelineState completeCandidateScan(Instant scanStartedAt, Instant now) {
        return toBuilder()
            .continuousWatermark(scanStartedAt)
            .candidateCursor(null)
            .candidateScanStartedAt(null)
            .updatedAt(now)
            .build();
    }

    public PipelineState terminate(TerminationReason reason, Instant now) {
        return toBuilder().terminationReason(reason).updatedAt(now).build();
    }

    public PipelineState resumed(Instant now) {
        return toBuilder().terminationReason(null).updatedAt(now).build();
    }
}
