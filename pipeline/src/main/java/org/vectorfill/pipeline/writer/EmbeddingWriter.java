package org.vectorfill.pipeline.writer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;

import org.vectorfill.pipeline.ir.EmbeddingResult;
import org.vectorfill.pipeline.ir.WriteAck;
import org.vectorfill.pipeline.retry.BackoffPolicy;
import org.vectorfill.pipeline.sink.DocumentSink;
import org.vectorfill.pipeline.source.StoreFailures;
import org.vectorfill.pipeline.source.StoreUnavailableException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Writes embeddings to the sink. A bulk request that fails as a whole is retried; if it keeps
 * failing the batch fails with {@link StoreUnavailableException}. Documents the sink rejects, or
 * does not mention in its ack, are reported as failed without failing the batch.
 */
@Slf4j
public class EmbeddingWriter {

    private final DocumentSink sink;
    private final BackoffPolicy backoff;

    public EmbeddingWriter(DocumentSink sink, BackoffPolicy backoff) {
        this.sink = sink;
        this.backoff = backoff;
    }

    public Mono<WriteAck> write(List<EmbeddingResult> results) {
        if (results.isEmpty()) {
            return Mono.just(WriteAck.empty());
        }
        return Mono.defer(() -> sink.writeBatch(results))
            .retryWhen(backoff.toRetry(StoreFailures::isTransient, "Bulk write of " + results.size() + " embeddings"))
            .onErrorMap(e -> !(e instanceof StoreUnavailableException),
                e -> new StoreUnavailableException("Bulk write of " + results.size() + " embeddings failed", e))
            .map(ack -> reconcile(results, ack));
    }

    private static WriteAck reconcile(List<EmbeddingResult> results, WriteAck ack) {
        var written = new ArrayList<String>();
        var failed = new HashMap<String, String>();
        var acknowledged = new HashSet<>(ack.written());
        for (var result : results) {
            var id = result.documentId();
            if (ack.failed().containsKey(id)) {
                failed.put(id, ack.failed().get(id));
            } else if (acknowledged.contains(id)) {
                written.add(id);
            } else {
                failed.put(id, "not acknowledged by the store");
            }
        }
        if (!failed.isEmpty()) {
            log.atWarn().setMessage("{} of {} embeddings were not stored: {}")
                .addArgument(failed::size)
                .addArgument(results::size)
                .addArgument(failed)
                .log();
        }
        return new WriteAck(written, failed);
    }
}
