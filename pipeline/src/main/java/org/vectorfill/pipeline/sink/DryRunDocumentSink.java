package org.vectorfill.pipeline.sink;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.vectorfill.pipeline.ir.EmbeddingResult;
import org.vectorfill.pipeline.ir.WriteAck;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Acknowledges every write without touching the store. Used for dry runs, which still fetch,
 * embed and account cost.
 */
@Slf4j
public class DryRunDocumentSink implements DocumentSink {

    private final AtomicLong acknowledged = new AtomicLong();

    @Override
    public Mono<WriteAck> writeBatch(List<EmbeddingResult> batch) {
        return Mono.fromCallable(() -> {
            var total = acknowledged.addAndGet(batch.size());
            log.atDebug().setMessage("Dry run: discarding {} embeddings ({} so far)")
                .addArgument(batch::size)
                .addArgument(total)
                .log();
            return WriteAck.allWritten(batch.stream().map(EmbeddingResult::documentId).toList());
        });
    }

    public long getAcknowledged() {
        return acknowledged.get();
    }
}
