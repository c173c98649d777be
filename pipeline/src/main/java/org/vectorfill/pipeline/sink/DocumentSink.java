package org.vectorfill.pipeline.sink;

import java.util.List;

import org.vectorfill.pipeline.ir.EmbeddingResult;
import org.vectorfill.pipeline.ir.WriteAck;

import reactor.core.publisher.Mono;

/**
 * Port for storing embeddings on their documents.
 *
 * A write either fails as a whole (transport problem, signalled as an error) or returns an ack
 * that says per document whether it was stored.
 */
public interface DocumentSink extends AutoCloseable {

    Mono<WriteAck> writeBatch(List<EmbeddingResult> batch);

    /** Make written embeddings visible to searches. Called once at the end of a run. */
    default Mono<Void> refresh() {
        return Mono.empty();
    }

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
