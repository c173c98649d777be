package org.vectorfill.pipeline.ir;

import java.util.Objects;

/**
 * A document waiting in the continuous-mode queue. Lives for one scheduling cycle only; after a
 * restart the queue is rebuilt from the store.
 */
public record PriorityQueueEntry(
    DocumentRef document,
    PriorityTier tier,
    EnqueueReason reason
) {
    public PriorityQueueEntry {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
