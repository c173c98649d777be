package org.vectorfill.pipeline.source;

import java.util.List;

import org.vectorfill.pipeline.ir.CandidateQuery;
import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.PageRequest;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Port for reading documents from any store (OpenSearch, Elasticsearch, in-memory test store).
 *
 * Pagination is cursor based only: a request names the sort, the page size and the sort values to
 * resume after. Implementations signal retryable problems with {@link TransientStoreException}
 * or an {@link java.io.IOException}; anything else is treated as permanent.
 */
public interface DocumentSource extends AutoCloseable {

    /** Read the next page in sort order, empty when nothing follows {@code request.searchAfter()}. */
    Mono<List<DocumentRef>> readPage(PageRequest request);

    /** Documents that may need a new embedding, for continuous mode. */
    Flux<DocumentRef> readCandidates(CandidateQuery query);

    /**
     * A single document by id, empty when the store has no such document. The sort values of the
     * returned document hold only its id.
     */
    Mono<DocumentRef> readDocument(String id);

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
