package org.vectorfill.pipeline.ir;

/**
 * Why a document could not be embedded or written.
 */
public enum FailureKind {
    /** Timeouts, 5xx, rate-limit rejections. Retried with backoff, then counted as failed. */
    TRANSIENT(true, false),
    /** The payload was rejected. Never retried; the document is quarantined. */
    INVALID_INPUT(false, true),
    /** Authentication or configuration problem. Never retried; not the document's fault. */
    UNAUTHORIZED(false, false);

    private final boolean retryable;
    private final boolean quarantined;

    FailureKind(boolean retryable, boolean quarantined) {
        this.retryable = retryable;
        this.quarantined = quarantined;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isQuarantined() {
        return quarantined;
    }
}
