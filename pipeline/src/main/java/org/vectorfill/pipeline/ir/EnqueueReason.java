package org.vectorfill.pipeline.ir;

public enum EnqueueReason {
    NEWLY_CREATED,
    FIELD_CHANGED,
    STALE
}
