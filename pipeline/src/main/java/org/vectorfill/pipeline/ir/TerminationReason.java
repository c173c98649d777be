package org.vectorfill.pipeline.ir;

public enum TerminationReason {
    /** Target reached, pages exhausted, or the configured number of cycles ran. */
    COMPLETED,
    /** The cost ledger reached the budget ceiling; the checkpoint is clean and resumable. */
    BUDGET_EXHAUSTED,
    /** A stop signal arrived; the in-flight batch was finished and checkpointed. */
    CANCELLED,
    /** Checkpoint corruption or the store stayed unreachable for a whole batch. */
    FATAL_ERROR
}
