package org.vectorfill.pipeline.embedding;

import org.vectorfill.pipeline.ir.FailureKind;

import lombok.Getter;

/**
 * A whole embedding call failed. The kind decides whether it is retried.
 */
public class EmbeddingServiceException extends RuntimeException {
    @Getter
    private final FailureKind kind;

    public EmbeddingServiceException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EmbeddingServiceException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
