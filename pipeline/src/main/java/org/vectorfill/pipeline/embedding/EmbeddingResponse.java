package org.vectorfill.pipeline.embedding;

import java.util.List;

import org.vectorfill.pipeline.ir.FailureKind;

/**
 * @param items       one per requested text, in request order
 * @param totalTokens tokens the service billed for the call
 */
public record EmbeddingResponse(List<Item> items, long totalTokens) {

    public EmbeddingResponse {
        items = List.copyOf(items);
    }

    /** Either a vector or an error. */
    public record Item(float[] vector, String error, FailureKind errorKind) {
        public static Item ok(float[] vector) {
            return new Item(vector, null, null);
        }

        public static Item failed(String error, FailureKind kind) {
            return new Item(null, error, kind);
        }

        public boolean isOk() {
            return vector != null;
        }
    }
}
