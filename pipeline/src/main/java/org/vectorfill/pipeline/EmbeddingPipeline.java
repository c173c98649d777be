package org.vectorfill.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.vectorfill.pipeline.checkpoint.CheckpointStore;
import org.vectorfill.pipeline.cursor.CursorManager;
import org.vectorfill.pipeline.embedding.EmbeddingService;
import org.vectorfill.pipeline.embedding.RateLimitedEmbeddingClient;
import org.vectorfill.pipeline.embedding.EmbeddingRateLimiters;
import org.vectorfill.pipeline.ir.BatchOutcome;
import org.vectorfill.pipeline.ir.BudgetStatus;
import org.vectorfill.pipeline.ir.CandidateQuery;
import org.vectorfill.pipeline.ir.PageResult;
import org.vectorfill.pipeline.ir.PipelineMode;
import org.vectorfill.pipeline.ir.PipelineState;
import org.vectorfill.pipeline.ir.PriorityQueueEntry;
import org.vectorfill.pipeline.ir.SortCursor;
import org.vectorfill.pipeline.ir.SortSpec;
import org.vectorfill.pipeline.ir.TerminationReason;
import org.vectorfill.pipeline.ledger.CostLedger;
import org.vectorfill.pipeline.ledger.JsonLinesCostLedger;
import org.vectorfill.pipeline.report.RunReport;
import org.vectorfill.pipeline.report.RunReportWriter;
import org.vectorfill.pipeline.select.BackfillSelector;
import org.vectorfill.pipeline.select.PriorityClassifier;
import org.vectorfill.pipeline.select.PriorityScheduler;
import org.vectorfill.pipeline.sink.DocumentSink;
import org.vectorfill.pipeline.source.DocumentSource;
import org.vectorfill.pipeline.source.StoreFailures;
import org.vectorfill.pipeline.source.StoreUnavailableException;
import org.vectorfill.pipeline.writer.EmbeddingWriter;

import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;

/**
 * Wires a DocumentSource, an EmbeddingService and a DocumentSink into a resumable run.
 *
 * <p>Backfill walks the store in sort order, one page per batch. Batches may be embedded
 * concurrently but are committed strictly in cursor order, and a batch's cursor is checkpointed
 * only after the sink acknowledged its embeddings. Once a batch fails, no later batch is
 * committed. With a budget ceiling or a daily limit, batches run one at a time. Continuous mode
 * repeats cycles over new, changed and stale documents, highest priority tier first.
 *
 * <p>Every run ends with a {@link RunReport}, whatever the termination reason.
 */
@Slf4j
public class EmbeddingPipeline {

    private static final DateTimeFormatter SESSION_TIME =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final DocumentSource source;
    private final DocumentSink sink;
    private final EmbeddingService embeddingService;
    private final CheckpointStore checkpointStore;
    private final PipelineConfig config;
    private final SortSpec sort;
    private final Path outputDirectory;
    private final boolean dryRun;
    private final Clock clock;
    @Getter
    private final StopSignal stopSignal;
    private final RateLimiter rateLimiter;
    private final RunReportWriter reportWriter;

    /**
     * @param outputDirectory where the cost ledger and the run report are written; null keeps both in memory
     * @param dryRun          only recorded in the report; the caller passes a sink that does not write
     */
    @Builder
    public EmbeddingPipeline(DocumentSource source,
                             DocumentSink sink,
                             EmbeddingService embeddingService,
                             CheckpointStore checkpointStore,
                             PipelineConfig config,
                             SortSpec sort,
                             Path outputDirectory,
                             boolean dryRun,
                             Clock clock,
                             StopSignal stopSignal,
                             RateLimiter rateLimiter) {
        this.source = source;
        this.sink = sink;
        this.embeddingService = embeddingService;
        this.checkpointStore = checkpointStore;
        this.config = (config != null ? config : PipelineConfig.builder().build()).validate();
        if (this.config.getMode() == PipelineMode.BACKFILL && sort == null) {
            throw new IllegalArgumentException("A backfill needs a sort spec");
        }
        this.sort = sort;
        this.outputDirectory = outputDirectory;
        this.dryRun = dryRun;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.stopSignal = stopSignal != null ? stopSignal : new StopSignal();
        this.rateLimiter = rateLimiter != null ? rateLimiter : EmbeddingRateLimiters.perMinute(
            this.config.getRequestsPerMinute(), this.config.getBurst(), this.config.getMaxRateLimitWait());
        this.reportWriter = new RunReportWriter(outputDirectory);
    }

    /**
     * Run until the corpus or target is done, the budget is spent, a stop is requested or a fatal
     * error occurs. Emits the run report; fatal errors are reported, not signalled.
     */
    public Mono<RunReport> run() {
        var runStartedAt = clock.instant();
        return Mono.fromCallable(this::openState)
            .subscribeOn(Schedulers.boundedElastic())
            .flatMapMany(state -> execute(state, runStartedAt),
                error -> failedToStart(error, runStartedAt),
                Mono::empty)
            .next();
    }

    private PipelineState openState() throws IOException {
        var now = clock.instant();
        var sessionId = config.getSessionId();
        if (sessionId != null) {
            var saved = checkpointStore.load(sessionId);
            if (saved.isPresent()) {
                return resume(saved.get(), now);
            }
            log.info("No checkpoint for session {}, starting it", sessionId);
        } else {
            sessionId = newSessionId(now);
        }
        long target = config.getMode() == PipelineMode.BACKFILL ? config.getTargetCount() : 0;
        var state = PipelineState.start(sessionId, config.getMode(), target, config.getBatchSize(), now);
        checkpointStore.save(state);
        return state;
    }

    private PipelineState resume(PipelineState saved, Instant now) {
        if (saved.mode() != config.getMode()) {
            throw new IllegalStateException("Session " + saved.sessionId() + " was started in " + saved.mode()
                + " mode and cannot be resumed in " + config.getMode() + " mode");
        }
        if (saved.batchSize() != config.getBatchSize()) {
            log.atWarn().setMessage("Session {} keeps its batch size {}, ignoring the configured {}")
                .addArgument(saved.sessionId())
                .addArgument(saved.batchSize())
                .addArgument(config.getBatchSize())
                .log();
        }
        log.atInfo().setMessage("Resuming session {} after {} processed documents at cursor {}")
            .addArgument(saved.sessionId())
            .addArgument(saved.processedCount())
            .addArgument(saved.cursor())
            .log();
        return saved.resumed(now);
    }

    static String newSessionId(Instant now) {
        return "emb_" + SESSION_TIME.format(now) + "_"
            + String.format("%06x", ThreadLocalRandom.current().nextInt(1 << 24));
    }

    private Mono<RunReport> execute(PipelineState state, Instant runStartedAt) {
        var ledger = newLedger(state);
        var client = RateLimitedEmbeddingClient.builder()
            .service(embeddingService)
            .rateLimiter(rateLimiter)
            .ledger(ledger)
            .backoff(config.getBackoff())
            .maxTextsPerCall(config.getMaxTextsPerCall())
            .maxConcurrentRequests(config.getMaxConcurrentRequests())
            .callTimeout(config.getCallTimeout())
            .expectedDimensions(config.getExpectedDimensions())
            .clock(clock)
            .build();
        var processor = new BatchProcessor(client, new EmbeddingWriter(sink, config.getBackoff()));
        var run = new Run(ledger, client, processor, new StateCommitter(checkpointStore, state, clock));

        log.atInfo().setMessage("Starting {} session {} with model {} (batch size {}, target {}, budget {}{})")
            .addArgument(state.mode())
            .addArgument(state.sessionId())
            .addArgument(embeddingService::modelId)
            .addArgument(state.batchSize())
            .addArgument(() -> state.targetCount() > 0 ? String.valueOf(state.targetCount()) : "all")
            .addArgument(() -> config.getBudgetCeiling() == null ? "unlimited" : config.getBudgetCeiling().toPlainString())
            .addArgument(dryRun ? ", dry run" : "")
            .log();

        var loop = state.mode() == PipelineMode.BACKFILL ? runBackfill(run) : runContinuous(run);
        return loop
            .onErrorResume(e -> {
                log.atError().setMessage("Session {} failed").addArgument(state.sessionId()).setCause(e).log();
                return Mono.just(new Termination(TerminationReason.FATAL_ERROR, e));
            })
            .flatMap(termination -> finish(run, termination, runStartedAt));
    }

    private CostLedger newLedger(PipelineState state) {
        if (outputDirectory == null) {
            return new CostLedger(config.getUnitCost(), config.getBudgetCeiling(), state.totalCost(), clock,
                config.getDailyCostLimit(), state.dailySpend());
        }
        return new JsonLinesCostLedger(outputDirectory, state.sessionId(), config.getUnitCost(),
            config.getBudgetCeiling(), state.totalCost(), clock, config.getDailyCostLimit(), state.dailySpend());
    }

    private Mono<Termination> runBackfill(Run run) {
        var selector = new BackfillSelector(embeddingService.modelId(), config.getMinTextLength(),
            config.isForce(), config.isReprocessFailed());
        var cursorManager = new CursorManager(source, sort, config.getBackoff());
        var halt = new AtomicReference<TerminationReason>();
        var broken = new AtomicBoolean();
        var start = run.committer().current();
        var requested = new AtomicLong(start.processedCount());
        int concurrency = batchConcurrency();
        var progress = new BatchProgress(concurrency);

        return nextPage(run, cursorManager, start.cursor(), requested, halt)
            .expand(page -> nextPage(run, cursorManager, page.cursor(), requested, halt))
            .limitRate(2)
            .flatMapSequentialDelayError(page -> Mono.defer(() -> {
                if (halt.get() != null || shouldHalt(run, halt)) {
                    return Mono.<BatchOutcome>empty();
                }
                var selection = selector.select(page.documents(), run.committer().current());
                return run.processor()
                    .process(page.cursor(), page.documents().size(), selection.toEmbed(), selection.skipped().size())
                    .elapsed()
                    .doOnNext(timed -> progress.record(Duration.ofMillis(timed.getT1())))
                    .map(Tuple2::getT2)
                    .doOnError(e -> {
                        broken.set(true);
                        halt.compareAndSet(null, TerminationReason.FATAL_ERROR);
                    });
            }), concurrency, 1)
            // the cursor of a batch behind a failed one lies past the failed documents
            .concatMapDelayError(outcome -> broken.get()
                ? Mono.<PipelineState>empty()
                : run.committer().commit(outcome, run.ledger().dailySpend())
                    .doOnError(e -> broken.set(true))
                    .doOnNext(state -> logProgress(state, progress)))
            .then(Mono.fromCallable(() -> new Termination(
                halt.get() != null ? halt.get() : TerminationReason.COMPLETED, null)));
    }

    /** Batches start one at a time under a cost limit, so at most one batch is billed past it. */
    private int batchConcurrency() {
        int configured = config.getMaxConcurrentBatches();
        if (configured > 1 && (config.getBudgetCeiling() != null || config.getDailyCostLimit() != null)) {
            log.info("A cost limit is set, running one batch at a time instead of {}", configured);
            return 1;
        }
        return configured;
    }

    private static void logProgress(PipelineState state, BatchProgress progress) {
        progress.remaining(state).ifPresent(eta -> log.atInfo()
            .setMessage("{} of {} documents processed, about {} to go")
            .addArgument(state.processedCount())
            .addArgument(state.targetCount())
            .addArgument(eta)
            .log());
    }

    private Mono<PageResult.Page> nextPage(Run run, CursorManager cursorManager, SortCursor after,
                                           AtomicLong requested, AtomicReference<TerminationReason> halt) {
        return Mono.defer(() -> {
            if (halt.get() != null || shouldHalt(run, halt)) {
                return Mono.empty();
            }
            var state = run.committer().current();
            long size = state.targetCount() > 0
                ? Math.min(state.batchSize(), state.targetCount() - requested.get())
                : state.batchSize();
            if (size <= 0) {
                return Mono.empty();
            }
            return cursorManager.fetch(after, (int) size)
                .ofType(PageResult.Page.class)
                .doOnNext(page -> requested.addAndGet(page.documents().size()));
        });
    }

    /** Records and reports whether no further batch may start. */
    private boolean shouldHalt(Run run, AtomicReference<TerminationReason> halt) {
        TerminationReason reason = null;
        if (stopSignal.isStopRequested()) {
            reason = TerminationReason.CANCELLED;
        } else {
            var budget = run.ledger().budgetStatus();
            if (budget instanceof BudgetStatus.Exhausted
                || (budget instanceof BudgetStatus.DailyLimitReached && config.getMode() == PipelineMode.BACKFILL)) {
                reason = TerminationReason.BUDGET_EXHAUSTED;
            }
        }
        if (reason != null && halt.compareAndSet(null, reason)) {
            log.info("Not starting further batches: {}", reason);
        }
        return reason != null;
    }

    private Mono<Termination> runContinuous(Run run) {
        var classifier = new PriorityClassifier(config.getPriorityRules(), embeddingService.modelId());
        var scheduler = new PriorityScheduler(classifier, config.getPerCycleCap(), config.getMinTextLength());
        var loop = new ContinuousLoop();
        return Mono.defer(() -> cycle(run, scheduler, loop))
            .repeat(() -> loop.termination == null)
            .then(Mono.fromCallable(() -> loop.termination));
    }

    private Mono<Void> cycle(Run run, PriorityScheduler scheduler, ContinuousLoop loop) {
        var halt = new AtomicReference<TerminationReason>();
        if (shouldHalt(run, halt)) {
            loop.termination = new Termination(halt.get(), null);
            return Mono.empty();
        }
        loop.cycles++;
        if (run.ledger().budgetStatus() instanceof BudgetStatus.DailyLimitReached reached) {
            log.atWarn().setMessage("Daily cost limit {} reached with {} spent on {}, skipping cycle {}")
                .addArgument(reached.dailyLimit())
                .addArgument(reached.spentToday())
                .addArgument(reached.day())
                .addArgument(loop.cycles)
                .log();
            return afterCycle(loop, config.getCycleInterval());
        }
        var cycleStart = clock.instant();
        log.info("Starting continuous cycle {}", loop.cycles);
        return runCycle(run, scheduler, cycleStart)
            .flatMap(result -> {
                loop.consecutiveFailures = 0;
                if (result.halt() != null) {
                    loop.termination = new Termination(result.halt(), null);
                    return Mono.<Void>empty();
                }
                return advanceCandidateScan(run, result)
                    .then(Mono.defer(() -> afterCycle(loop, config.getCycleInterval())));
            })
            .onErrorResume(StoreUnavailableException.class, e -> {
                loop.consecutiveFailures++;
                if (loop.consecutiveFailures >= config.getMaxConsecutiveCycleFailures()) {
                    log.atError().setMessage("Giving up after {} consecutive failed cycles")
                        .addArgument(loop.consecutiveFailures)
                        .setCause(e)
                        .log();
                    loop.termination = new Termination(TerminationReason.FATAL_ERROR, e);
                    return Mono.empty();
                }
                var cooldown = config.cooldownAfter(loop.consecutiveFailures);
                log.atWarn().setMessage("Cycle {} failed ({} in a row), cooling down for {}: {}")
                    .addArgument(loop.cycles)
                    .addArgument(loop.consecutiveFailures)
                    .addArgument(cooldown)
                    .addArgument(e::getMessage)
                    .log();
                return afterCycle(loop, cooldown);
            });
    }

    /**
     * Work left behind by the cap or the daily limit keeps the scan where it is. Otherwise a scan
     * cut off by its limit continues next cycle, and a scan that saw every candidate moves the
     * watermark to the time it started.
     */
    private Mono<PipelineState> advanceCandidateScan(Run run, CycleResult result) {
        if (result.workLeft()) {
            return Mono.empty();
        }
        if (result.scanCursor() != null) {
            log.info("Candidate scan stopped at its limit, the next cycle continues after {}", result.scanCursor());
            return run.committer().continueCandidateScan(result.scanCursor(), result.scanStartedAt());
        }
        return run.committer().completeCandidateScan(result.scanStartedAt());
    }

    private Mono<CycleResult> runCycle(Run run, PriorityScheduler scheduler, Instant cycleStart) {
        var state = run.committer().current();
        var scanStartedAt = state.candidateScanStartedAt() != null ? state.candidateScanStartedAt() : cycleStart;
        var staleAfter = config.getPriorityRules().staleAfter();
        var query = new CandidateQuery(state.continuousWatermark(),
            staleAfter == null ? null : cycleStart.minus(staleAfter),
            embeddingService.modelId(), config.getCandidateScanLimit(), state.candidateCursor());
        return Flux.defer(() -> source.readCandidates(query))
            .collectList()
            .retryWhen(config.getBackoff().toRetry(StoreFailures::isTransient, "Candidate query"))
            .onErrorMap(StoreFailures::isTransient,
                e -> new StoreUnavailableException("Candidate query kept failing", e))
            .flatMap(candidates -> {
                var scanCursor = candidates.size() >= query.limit()
                    ? candidates.get(candidates.size() - 1).sortValues()
                    : null;
                Set<String> excluded = config.isReprocessFailed() ? Set.of() : state.quarantinedDocumentIds();
                var plan = scheduler.plan(candidates, cycleStart, excluded);
                if (plan.isEmpty()) {
                    log.info("Nothing to embed this cycle");
                    return Mono.just(new CycleResult(null, false, scanCursor, scanStartedAt));
                }
                var halt = new AtomicReference<TerminationReason>();
                var paused = new AtomicBoolean();
                return Flux.fromIterable(PriorityScheduler.batches(plan.entries(), state.batchSize()))
                    .concatMap(batch -> Mono.defer(() -> {
                        if (halt.get() != null || paused.get() || shouldHalt(run, halt)) {
                            return Mono.<BatchOutcome>empty();
                        }
                        if (run.ledger().budgetStatus() instanceof BudgetStatus.DailyLimitReached reached) {
                            paused.set(true);
                            log.warn("Daily cost limit {} reached, leaving the rest of this cycle for later",
                                reached.dailyLimit());
                            return Mono.<BatchOutcome>empty();
                        }
                        var documents = batch.stream().map(PriorityQueueEntry::document).toList();
                        log.atInfo().setMessage("Embedding {} {} documents")
                            .addArgument(documents::size)
                            .addArgument(() -> batch.get(0).tier())
                            .log();
                        return run.processor().process(null, documents.size(), documents, 0);
                    }))
                    .concatMapDelayError(outcome -> run.committer().commit(outcome, run.ledger().dailySpend()))
                    .then(Mono.fromCallable(() -> new CycleResult(halt.get(), plan.truncated() || paused.get(),
                        scanCursor, scanStartedAt)));
            });
    }

    private Mono<Void> afterCycle(ContinuousLoop loop, Duration pause) {
        if (config.getMaxCycles() > 0 && loop.cycles >= config.getMaxCycles()) {
            loop.termination = new Termination(TerminationReason.COMPLETED, null);
            return Mono.empty();
        }
        log.debug("Next cycle in {}", pause);
        return Mono.delay(pause)
            .takeUntilOther(stopSignal.whenStopped())
            .then();
    }

    private Mono<RunReport> finish(Run run, Termination termination, Instant runStartedAt) {
        var refresh = dryRun ? Mono.<Void>empty() : sink.refresh()
            .onErrorResume(e -> {
                log.atWarn().setMessage("Index refresh failed, embeddings become visible with the next refresh")
                    .setCause(e)
                    .log();
                return Mono.empty();
            });
        return refresh
            .then(run.committer().terminate(termination.reason())
                .onErrorResume(e -> {
                    log.atError().setMessage("Could not save the final state, the last committed batch stays checkpointed")
                        .setCause(e)
                        .log();
                    return Mono.fromSupplier(() -> run.committer().current().terminate(termination.reason(), clock.instant()));
                }))
            .map(state -> RunReport.of(state, dryRun, config.getBudgetCeiling(), run.ledger().entries().size(),
                run.client().getStats().snapshot(), runStartedAt, clock.instant(),
                termination.error() == null ? null : String.valueOf(termination.error().getMessage())))
            .flatMap(this::writeReport);
    }

    private Mono<RunReport> failedToStart(Throwable error, Instant runStartedAt) {
        log.atError().setMessage("Could not open the session").setCause(error).log();
        var report = RunReport.failedToStart(config.getSessionId(), config.getMode(), runStartedAt, clock.instant(),
            String.valueOf(error.getMessage()));
        return writeReport(report);
    }

    private Mono<RunReport> writeReport(RunReport report) {
        return Mono.fromCallable(() -> {
            try {
                reportWriter.write(report);
            } catch (IOException e) {
                log.atError().setMessage("Could not write the run report").setCause(e).log();
            }
            return report;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private record Run(CostLedger ledger, RateLimitedEmbeddingClient client, BatchProcessor processor,
                       StateCommitter committer) {}

    private record Termination(TerminationReason reason, Throwable error) {}

    /**
     * @param workLeft   the plan was capped or cut short by the daily limit
     * @param scanCursor last candidate of a scan that hit its limit, null when the scan saw everything
     */
    private record CycleResult(TerminationReason halt, boolean workLeft, SortCursor scanCursor,
                               Instant scanStartedAt) {}

    private static class ContinuousLoop {
        int cycles;
        int consecutiveFailures;
        Termination termination;
    }
}
