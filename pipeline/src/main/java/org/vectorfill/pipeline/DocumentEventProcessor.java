package org.vectorfill.pipeline;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

import org.vectorfill.pipeline.embedding.EmbeddingRateLimiters;
import org.vectorfill.pipeline.embedding.EmbeddingService;
import org.vectorfill.pipeline.embedding.RateLimitedEmbeddingClient;
import org.vectorfill.pipeline.embedding.TextHasher;
import org.vectorfill.pipeline.ir.BudgetStatus;
import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ledger.CostLedger;
import org.vectorfill.pipeline.sink.DocumentSink;
import org.vectorfill.pipeline.source.DocumentSource;
import org.vectorfill.pipeline.source.StoreFailures;
import org.vectorfill.pipeline.source.StoreUnavailableException;
import org.vectorfill.pipeline.writer.EmbeddingWriter;

import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Embeds single documents as change events for them arrive, outside of any session. Shares the
 * rate limiter, retry policy and cost limits of the pipeline but keeps no checkpoint: an event
 * that ends {@link Outcome#FAILED} or {@link Outcome#DEFERRED} is picked up by the next
 * continuous cycle.
 */
@Slf4j
public class DocumentEventProcessor {

    public enum Outcome {
        EMBEDDED,
        NOT_FOUND,
        TEXT_TOO_SHORT,
        UP_TO_DATE,
        /** the budget ceiling or the daily limit is reached */
        DEFERRED,
        FAILED
    }

    private final DocumentSource source;
    private final PipelineConfig config;
    private final RateLimitedEmbeddingClient client;
    private final EmbeddingWriter writer;
    @Getter
    private final CostLedger ledger;

    /**
     * @param ledger where the spend of the events is recorded; by default one held in memory with
     *               the configured ceiling and daily limit
     */
    @Builder
    public DocumentEventProcessor(DocumentSource source,
                                  DocumentSink sink,
                                  EmbeddingService embeddingService,
                                  PipelineConfig config,
                                  RateLimiter rateLimiter,
                                  CostLedger ledger,
                                  Clock clock) {
        this.source = source;
        this.config = (config != null ? config : PipelineConfig.builder().build()).validate();
        var eventClock = clock != null ? clock : Clock.systemUTC();
        this.ledger = ledger != null ? ledger : new CostLedger(this.config.getUnitCost(),
            this.config.getBudgetCeiling(), BigDecimal.ZERO, eventClock, this.config.getDailyCostLimit(), null);
        this.client = RateLimitedEmbeddingClient.builder()
            .service(embeddingService)
            .rateLimiter(rateLimiter != null ? rateLimiter : EmbeddingRateLimiters.perMinute(
                this.config.getRequestsPerMinute(), this.config.getBurst(), this.config.getMaxRateLimitWait()))
            .ledger(this.ledger)
            .backoff(this.config.getBackoff())
            .maxTextsPerCall(1)
            .maxConcurrentRequests(1)
            .callTimeout(this.config.getCallTimeout())
            .expectedDimensions(this.config.getExpectedDimensions())
            .clock(eventClock)
            .build();
        this.writer = new EmbeddingWriter(sink, this.config.getBackoff());
    }

    /** Reads the document again and writes a fresh embedding when its text needs one. */
    public Mono<Outcome> process(String documentId) {
        return Mono.defer(() -> {
            var status = ledger.budgetStatus();
            if (!(status instanceof BudgetStatus.Available)) {
                log.warn("Deferring document {}, {}", documentId, status);
                return Mono.just(Outcome.DEFERRED);
            }
            return source.readDocument(documentId)
                .retryWhen(config.getBackoff().toRetry(StoreFailures::isTransient, "Document read"))
                .onErrorMap(StoreFailures::isTransient,
                    e -> new StoreUnavailableException("Reading document " + documentId + " kept failing", e))
                .flatMap(this::embed)
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Document {} not found", documentId);
                    return Outcome.NOT_FOUND;
                }));
        });
    }

    private Mono<Outcome> embed(DocumentRef document) {
        if (document.textLength() < config.getMinTextLength()) {
            log.debug("Document {} has too little text to embed", document.id());
            return Mono.just(Outcome.TEXT_TOO_SHORT);
        }
        if (!config.isForce() && isUpToDate(document)) {
            log.debug("Embedding of document {} is up to date", document.id());
            return Mono.just(Outcome.UP_TO_DATE);
        }
        return client.embed(List.of(document))
            .flatMap(embedded -> {
                if (embedded.embedded().isEmpty()) {
                    embedded.failed().forEach(failure -> log.atWarn()
                        .setMessage("Could not embed document {}: {} ({})")
                        .addArgument(failure::documentId)
                        .addArgument(failure::reason)
                        .addArgument(failure::kind)
                        .log());
                    return Mono.just(Outcome.FAILED);
                }
                return writer.write(embedded.embedded())
                    .map(ack -> {
                        if (ack.written().contains(document.id())) {
                            log.info("Embedded document {}", document.id());
                            return Outcome.EMBEDDED;
                        }
                        log.warn("Store rejected the embedding of document {}: {}", document.id(),
                            ack.failed().get(document.id()));
                        return Outcome.FAILED;
                    });
            });
    }

    private boolean isUpToDate(DocumentRef document) {
        return client.modelId().equals(document.embeddingModel())
            && document.embeddedTextHash() != null
            && document.embeddedTextHash().equals(TextHasher.hash(document.text()));
    }
}
