package org.vectorfill.pipeline.ir;

public enum PipelineMode {
    /** One pass over the whole corpus, driven by the sort-key cursor. */
    BACKFILL,
    /** Repeating cycles over new, changed and stale documents, ranked by priority tier. */
    CONTINUOUS
}
