package org.vectorfill.pipeline.embedding;

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * Port for the external embedding model. One call embeds several texts; the response lists one
 * item per text in the same order.
 *
 * Whole-call failures are signalled with {@link EmbeddingServiceException}; failures of single
 * texts inside an otherwise successful call are reported on the items.
 */
public interface EmbeddingService extends AutoCloseable {

    /** Model identifier stored next to each embedding. */
    String modelId();

    Mono<EmbeddingResponse> embed(List<String> texts);

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
