package org.vectorfill.pipeline.report;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import org.vectorfill.pipeline.embedding.EmbeddingCallStats;
import org.vectorfill.pipeline.ir.DailySpend;
import org.vectorfill.pipeline.ir.PipelineMode;
import org.vectorfill.pipeline.ir.PipelineState;
import org.vectorfill.pipeline.ir.SortCursor;
import org.vectorfill.pipeline.ir.TerminationReason;

import lombok.Builder;

/**
 * Summary of a run, produced the same way on every termination path.
 */
@Builder
public record RunReport(
    String sessionId,
    PipelineMode mode,
    TerminationReason terminationReason,
    boolean dryRun,
    long targetCount,
    long processedCount,
    long embeddedCount,
    long skippedCount,
    long failedCount,
    int quarantinedCount,
    long batchesCommitted,
    long totalTokens,
    BigDecimal totalCost,
    BigDecimal budgetCeiling,
    DailySpend dailySpend,
    int ledgerEntries,
    SortCursor finalCursor,
    Instant continuousWatermark,
    Instant startedAt,
    Instant finishedAt,
    long elapsedMillis,
    EmbeddingCallStats.Snapshot embeddingCalls,
    String errorMessage
) {

    public static RunReport of(PipelineState state, boolean dryRun, BigDecimal budgetCeiling, int ledgerEntries,
                               EmbeddingCallStats.Snapshot calls, Instant runStartedAt, Instant finishedAt,
                               String errorMessage) {
        return RunReport.builder()
            .sessionId(state.sessionId())
            .mode(state.mode())
            .terminationReason(state.terminationReason())
            .dryRun(dryRun)
            .targetCount(state.targetCount())
            .processedCount(state.processedCount())
            .embeddedCount(state.embeddedCount())
            .skippedCount(state.skippedCount())
            .failedCount(state.failedCount())
            .quarantinedCount(state.quarantinedDocumentIds().size())
            .batchesCommitted(state.batchesCommitted())
            .totalTokens(state.totalTokens())
            .totalCost(state.totalCost())
            .budgetCeiling(budgetCeiling)
            .dailySpend(state.dailySpend())
            .ledgerEntries(ledgerEntries)
            .finalCursor(state.cursor())
            .continuousWatermark(state.continuousWatermark())
            .startedAt(state.startedAt())
            .finishedAt(finishedAt)
            .elapsedMillis(Duration.between(runStartedAt, finishedAt).toMillis())
            .embeddingCalls(calls)
            .errorMessage(errorMessage)
            .build();
    }

    /** For runs that failed before a state could be loaded or created. */
    public static RunReport failedToStart(String sessionId, PipelineMode mode, Instant startedAt, Instant finishedAt,
                                          String errorMessage) {
        return RunReport.builder()
            .sessionId(sessionId)
            .mode(mode)
            .terminationReason(TerminationReason.FATAL_ERROR)
            .totalCost(BigDecimal.ZERO)
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .elapsedMillis(Duration.between(startedAt, finishedAt).toMillis())
            .errorMessage(errorMessage)
            .build();
    }
}
