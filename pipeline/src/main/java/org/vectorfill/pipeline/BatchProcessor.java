package org.vectorfill.pipeline;

import java.util.HashSet;
import java.util.List;

import org.vectorfill.pipeline.embedding.RateLimitedEmbeddingClient;
import org.vectorfill.pipeline.ir.BatchOutcome;
import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.FailureKind;
import org.vectorfill.pipeline.ir.SortCursor;
import org.vectorfill.pipeline.writer.EmbeddingWriter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Embeds and writes one batch and reports what happened to each of its documents.
 */
@Slf4j
@RequiredArgsConstructor
class BatchProcessor {

    private final RateLimitedEmbeddingClient client;
    private final EmbeddingWriter writer;

    /**
     * @param cursor       where the batch ends, null for continuous batches
     * @param visitedCount documents of the batch, skipped ones included
     * @param toEmbed      documents that need an embedding
     * @param skippedCount documents left alone
     */
    Mono<BatchOutcome> process(SortCursor cursor, int visitedCount, List<DocumentRef> toEmbed, int skippedCount) {
        return client.embed(toEmbed)
            .flatMap(embedded -> writer.write(embedded.embedded())
                .map(ack -> {
                    var failed = new HashSet<String>(ack.failed().keySet());
                    var quarantined = new HashSet<String>();
                    for (var failure : embedded.failed()) {
                        if (failure.kind() == FailureKind.INVALID_INPUT) {
                            quarantined.add(failure.documentId());
                        } else {
                            failed.add(failure.documentId());
                        }
                    }
                    log.atDebug().setMessage("Batch ending at {}: {} to embed, {} written, {} failed, {} quarantined")
                        .addArgument(cursor)
                        .addArgument(toEmbed::size)
                        .addArgument(() -> ack.written().size())
                        .addArgument(failed::size)
                        .addArgument(quarantined::size)
                        .log();
                    return new BatchOutcome(cursor, visitedCount, new HashSet<>(ack.written()), skippedCount,
                        failed, quarantined, embedded.tokens(), embedded.cost());
                }));
    }
}
