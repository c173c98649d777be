package org.vectorfill.pipeline.ir;

import java.util.Objects;

/**
 * Per-document result of an embedding attempt.
 */
public sealed interface DocumentOutcome {

    String documentId();

    record Embedded(EmbeddingResult result) implements DocumentOutcome {
        public Embedded {
            Objects.requireNonNull(result, "result must not be null");
        }

        @Override
        public String documentId() {
            return result.documentId();
        }
    }

    record Failed(String documentId, String reason, FailureKind kind) implements DocumentOutcome {
        public Failed {
            Objects.requireNonNull(documentId, "documentId must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
        }
    }
}
