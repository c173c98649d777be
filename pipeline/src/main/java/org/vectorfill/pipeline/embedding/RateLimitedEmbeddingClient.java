package org.vectorfill.pipeline.embedding;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.vectorfill.pipeline.ir.DocumentOutcome;
import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.EmbeddingResult;
import org.vectorfill.pipeline.ir.FailureKind;
import org.vectorfill.pipeline.ledger.CostLedger;
import org.vectorfill.pipeline.retry.BackoffPolicy;
import org.vectorfill.pipeline.source.StoreFailures;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

/**
 * Embeds batches of documents through an {@link EmbeddingService} while keeping to the configured
 * request rate, retrying transient failures and billing the ledger.
 *
 * <p>A batch is split into calls of at most {@code maxTextsPerCall} texts, of which at most
 * {@code maxConcurrentRequests} are in flight. Every request, retries included, first takes a
 * permit from the shared {@link RateLimiter}. A call rejected as invalid input is split up and
 * each text is sent alone once, so one bad document does not fail its neighbours. Once all calls of a batch
 * are done, one ledger entry with the tokens of the successful calls is appended.
 */
@Slf4j
public class RateLimitedEmbeddingClient {

    private final EmbeddingService service;
    private final RateLimiter rateLimiter;
    private final CostLedger ledger;
    private final BackoffPolicy backoff;
    private final int maxTextsPerCall;
    private final int maxConcurrentRequests;
    private final Duration callTimeout;
    private final int expectedDimensions;
    private final Clock clock;
    @Getter
    private final EmbeddingCallStats stats = new EmbeddingCallStats();

    @Builder
    public RateLimitedEmbeddingClient(EmbeddingService service,
                                      RateLimiter rateLimiter,
                                      CostLedger ledger,
                                      BackoffPolicy backoff,
                                      int maxTextsPerCall,
                                      int maxConcurrentRequests,
                                      Duration callTimeout,
                                      int expectedDimensions,
                                      Clock clock) {
        if (service == null || rateLimiter == null || ledger == null) {
            throw new IllegalArgumentException("service, rateLimiter and ledger are required");
        }
        this.service = service;
        this.rateLimiter = rateLimiter;
        this.ledger = ledger;
        this.backoff = backoff != null ? backoff : BackoffPolicy.DEFAULT;
        this.maxTextsPerCall = maxTextsPerCall > 0 ? maxTextsPerCall : 100;
        this.maxConcurrentRequests = maxConcurrentRequests > 0 ? maxConcurrentRequests : 1;
        this.callTimeout = callTimeout != null ? callTimeout : Duration.ofSeconds(60);
        this.expectedDimensions = expectedDimensions;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public String modelId() {
        return service.modelId();
    }

    /**
     * Embed the documents. Never fails because of individual documents: those come back as
     * {@link DocumentOutcome.Failed}. Completes only after the batch has been billed.
     */
    public Mono<EmbedOutcome> embed(List<DocumentRef> documents) {
        if (documents.isEmpty()) {
            return Mono.just(EmbedOutcome.empty());
        }
        return Flux.fromIterable(partition(documents, maxTextsPerCall))
            .flatMapSequential(this::embedGroup, maxConcurrentRequests)
            .collectList()
            .map(this::bill);
    }

    private EmbedOutcome bill(List<GroupResult> groups) {
        var outcomes = new ArrayList<DocumentOutcome>();
        long tokens = 0;
        int successfulCalls = 0;
        for (var group : groups) {
            outcomes.addAll(group.outcomes());
            tokens += group.tokens();
            successfulCalls += group.successfulCalls();
        }
        if (successfulCalls == 0) {
            return new EmbedOutcome(outcomes, 0, BigDecimal.ZERO);
        }
        int embedded = (int) outcomes.stream().filter(DocumentOutcome.Embedded.class::isInstance).count();
        var entry = ledger.append(embedded, tokens);
        return new EmbedOutcome(outcomes, tokens, entry.batchCost());
    }

    private Mono<GroupResult> embedGroup(List<DocumentRef> group) {
        var texts = group.stream().map(d -> d.text() == null ? "" : d.text().strip()).toList();
        return call(texts)
            .map(response -> new GroupResult(toOutcomes(group, texts, response), response.totalTokens(), 1))
            .onErrorResume(e -> failGroup(group, e));
    }

    private Mono<EmbeddingResponse> call(List<String> texts) {
        return Mono.defer(() -> {
                stats.attempt();
                return Mono.defer(() -> service.embed(texts))
                    .timeout(callTimeout)
                    .transformDeferred(RateLimiterOperator.of(rateLimiter));
            })
            .flatMap(response -> response.items().size() == texts.size()
                ? Mono.just(response)
                : Mono.error(new EmbeddingServiceException(FailureKind.TRANSIENT,
                    "Service returned " + response.items().size() + " items for " + texts.size() + " texts")))
            .elapsed()
            .retryWhen(backoff.toRetry(RateLimitedEmbeddingClient::isTransient,
                "Embedding call of " + texts.size() + " texts"))
            .doOnSubscribe(s -> stats.call())
            .doOnNext(timed -> stats.success(timed.getT2().totalTokens(), timed.getT1()))
            .map(Tuple2::getT2);
    }

    private Mono<GroupResult> failGroup(List<DocumentRef> group, Throwable error) {
        var kind = kindOf(error);
        if (kind == FailureKind.INVALID_INPUT && group.size() > 1) {
            log.atWarn().setMessage("Embedding call of {} texts rejected as invalid input, sending each text alone")
                .addArgument(group::size)
                .log();
            return Flux.fromIterable(group)
                .concatMap(document -> embedGroup(List.of(document)))
                .collectList()
                .map(GroupResult::merge);
        }
        stats.failure();
        if (kind == FailureKind.TRANSIENT && !isTransient(error)) {
            log.atError().setMessage("Unexpected failure embedding {} documents").addArgument(group::size)
                .setCause(error).log();
        } else {
            log.atWarn().setMessage("Embedding call of {} documents failed ({}): {}")
                .addArgument(group::size)
                .addArgument(kind)
                .addArgument(error::getMessage)
                .log();
        }
        var reason = String.valueOf(error.getMessage());
        var outcomes = group.stream()
            .<DocumentOutcome>map(d -> new DocumentOutcome.Failed(d.id(), reason, kind))
            .toList();
        return Mono.just(new GroupResult(outcomes, 0, 0));
    }

    private List<DocumentOutcome> toOutcomes(List<DocumentRef> group, List<String> texts, EmbeddingResponse response) {
        var now = Instant.now(clock);
        var outcomes = new ArrayList<DocumentOutcome>(group.size());
        for (int i = 0; i < group.size(); i++) {
            var document = group.get(i);
            var item = response.items().get(i);
            if (!item.isOk()) {
                var kind = item.errorKind() != null ? item.errorKind() : FailureKind.INVALID_INPUT;
                outcomes.add(new DocumentOutcome.Failed(document.id(), item.error(), kind));
            } else if (expectedDimensions > 0 && item.vector().length != expectedDimensions) {
                outcomes.add(new DocumentOutcome.Failed(document.id(),
                    "Expected " + expectedDimensions + " dimensions but got " + item.vector().length,
                    FailureKind.TRANSIENT));
            } else {
                outcomes.add(new DocumentOutcome.Embedded(new EmbeddingResult(
                    document.id(), item.vector(), service.modelId(), now, TextHasher.hash(texts.get(i)))));
            }
        }
        return outcomes;
    }

    static boolean isTransient(Throwable t) {
        if (t instanceof EmbeddingServiceException serviceError) {
            return serviceError.getKind().isRetryable();
        }
        return t instanceof RequestNotPermitted || StoreFailures.isTransient(t);
    }

    static FailureKind kindOf(Throwable t) {
        if (t instanceof EmbeddingServiceException serviceError) {
            return serviceError.getKind();
        }
        return FailureKind.TRANSIENT;
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        var groups = new ArrayList<List<T>>();
        for (int from = 0; from < items.size(); from += size) {
            groups.add(List.copyOf(items.subList(from, Math.min(items.size(), from + size))));
        }
        return groups;
    }

    private record GroupResult(List<DocumentOutcome> outcomes, long tokens, int successfulCalls) {
        static GroupResult merge(List<GroupResult> parts) {
            var outcomes = new ArrayList<DocumentOutcome>();
            long tokens = 0;
            int calls = 0;
            for (var part : parts) {
                outcomes.addAll(part.outcomes());
                tokens += part.tokens();
                calls += part.successfulCalls();
            }
            return new GroupResult(outcomes, tokens, calls);
        }
    }
}
