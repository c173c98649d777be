package org.vectorfill.backfill;

import org.vectorfill.pipeline.ir.TerminationReason;

/**
 * Process exit codes. A scheduler restarts the process on {@link #BUDGET_EXHAUSTED} once the
 * budget is raised, and never on {@link #FATAL}.
 */
public final class ExitCodes {

    public static final int COMPLETED = 0;
    public static final int FATAL = 1;
    public static final int BUDGET_EXHAUSTED = 2;
    /** Invalid command line or configuration. */
    public static final int USAGE = 64;
    /** 128 + SIGINT, what a shell reports for an interrupted process. */
    public static final int CANCELLED = 130;

    private ExitCodes() {}

    public static int forReason(TerminationReason reason) {
        switch (reason) {
            case COMPLETED:
                return COMPLETED;
            case BUDGET_EXHAUSTED:
                return BUDGET_EXHAUSTED;
            case CANCELLED:
                return CANCELLED;
            case FATAL_ERROR:
            default:
                return FATAL;
        }
    }
}
