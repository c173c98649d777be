package org.vectorfill.pipeline.ir;

import java.math.BigDecimal;
import java.util.Set;

/**
 * What one batch did, ready to be folded into {@link PipelineState}.
 *
 * @param cursor         sort values of the batch's last document, null for continuous batches
 * @param visitedCount   documents the batch looked at, embedded or not
 * @param embeddedIds    documents whose new embedding the store acknowledged
 * @param skippedCount   documents that already had a current embedding or too little text
 * @param failedIds      documents that may be retried later
 * @param quarantinedIds documents excluded from automatic retries
 * @param tokens         tokens billed for the batch
 * @param cost           cost billed for the batch
 */
public record BatchOutcome(
    SortCursor cursor,
    int visitedCount,
    Set<String> embeddedIds,
    int skippedCount,
    Set<String> failedIds,
    Set<String> quarantinedIds,
    long tokens,
    BigDecimal cost
) {
    public BatchOutcome {
        embeddedIds = Set.copyOf(embeddedIds);
        failedIds = Set.copyOf(failedIds);
        quarantinedIds = Set.copyOf(quarantinedIds);
        cost = cost == null ? BigDecimal.ZERO : cost;
    }

    public int failedCount() {
        return failedIds.size() + quarantinedIds.size();
    }
}
