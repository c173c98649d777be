package org.vectorfill.pipeline.ir;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A freshly generated embedding for one document. Instances are never mutated; the vector is
 * copied on the way in and on the way out.
 */
public record EmbeddingResult(
    String documentId,
    float[] vector,
    String model,
    Instant generatedAt,
    String textHash
) {
    public EmbeddingResult {
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(vector, "vector must not be null for document " + documentId);
        if (vector.length == 0) {
            throw new IllegalArgumentException("vector must not be empty for document " + documentId);
        }
        vector = vector.clone();
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    public int dimensions() {
        return vector.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EmbeddingResult)) {
            return false;
        }
        EmbeddingResult other = (EmbeddingResult) o;
        return documentId.equals(other.documentId)
            && Arrays.equals(vector, other.vector)
            && Objects.equals(model, other.model)
            && Objects.equals(generatedAt, other.generatedAt)
            && Objects.equals(textHash, other.textHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, Arrays.hashCode(vector), model, generatedAt, textHash);
    }

    @Override
    public String toString() {
        return "EmbeddingResult[documentId=" + documentId + ", dimensions=" + vector.length
            + ", model=" + model + ", generatedAt=" + generatedAt + "]";
    }
}
