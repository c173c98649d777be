package org.vectorfill.backfill;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.vectorfill.clients.http.AbstractRestClient;
import org.vectorfill.clients.http.AuthConfig;
import org.vectorfill.clients.http.ConnectionContext;
import org.vectorfill.clients.http.ReactorNettyRestClient;
import org.vectorfill.clients.openai.OpenAiEmbeddingService;
import org.vectorfill.clients.opensearch.FieldMapping;
import org.vectorfill.clients.opensearch.IndexSchemaValidator;
import org.vectorfill.clients.opensearch.OpenSearchDocumentSink;
import org.vectorfill.clients.opensearch.OpenSearchDocumentSource;
import org.vectorfill.pipeline.DocumentEventProcessor;
import org.vectorfill.pipeline.EmbeddingPipeline;
import org.vectorfill.pipeline.PipelineConfig;
import org.vectorfill.pipeline.StopSignal;
import org.vectorfill.pipeline.checkpoint.CheckpointStore;
import org.vectorfill.pipeline.checkpoint.FileCheckpointStore;
import org.vectorfill.pipeline.embedding.EmbeddingServiceCheck;
import org.vectorfill.pipeline.ir.PipelineMode;
import org.vectorfill.pipeline.ir.SortSpec;
import org.vectorfill.pipeline.report.RunReport;
import org.vectorfill.pipeline.retry.BackoffPolicy;
import org.vectorfill.pipeline.select.PriorityRules;
import org.vectorfill.pipeline.sink.DocumentSink;
import org.vectorfill.pipeline.sink.DryRunDocumentSink;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Runs an embedding backfill or continuous refresh against one index.
 *
 * <p>Every option may also be given in a properties file, keyed by the option name without its
 * dashes ({@code batch-size=200}): the file named by {@code --config}, or
 * {@code ~/.embedding-backfill.properties}.
 */
@Slf4j
@Command(
    name = "embedding-backfill",
    mixinStandardHelpOptions = true,
    version = "embedding-backfill 0.1",
    sortOptions = false,
    defaultValueProvider = CommandLine.PropertiesDefaultProvider.class,
    description = "Generates missing or outdated embeddings for the documents of a search index.")
public class EmbeddingBackfillCommand implements Callable<Integer> {

    static final String DEFAULT_SORT = "start_date:desc,last_changed:desc,uid.keyword:asc";

    @Option(names = "--config", description = "Properties file with option defaults.")
    Path configFile;

    // Run control

    @Option(names = "--mode", defaultValue = "BACKFILL",
        description = "BACKFILL walks the whole index once, CONTINUOUS refreshes new, changed and stale documents.")
    PipelineMode mode;

    @Option(names = "--resume", paramLabel = "SESSION_ID",
        description = "Resume this session, or start a new session under this id.")
    String resumeSessionId;

    @Option(names = "--resume-latest", description = "Resume the most recently updated session.")
    boolean resumeLatest;

    @Option(names = "--target", defaultValue = "0",
        description = "Documents to visit before stopping; 0 for the whole index. Ignored in continuous mode.")
    long targetCount;

    @Option(names = "--batch-size", defaultValue = "500")
    int batchSize;

    @Option(names = "--min-text-length", defaultValue = "10", description = "Shorter texts are skipped.")
    int minTextLength;

    @Option(names = "--force", description = "Re-embed documents whose embedding is current.")
    boolean force;

    @Option(names = "--reprocess-failed", description = "Include quarantined documents again.")
    boolean reprocessFailed;

    @Option(names = "--dry-run", description = "Read and embed, but write nothing to the index.")
    boolean dryRun;

    @Option(names = "--state-dir", defaultValue = "embedding_state",
        description = "Directory for checkpoints, cost ledgers and run reports.")
    Path stateDirectory;

    // Budget and rate

    @Option(names = "--budget", paramLabel = "AMOUNT", description = "Spending ceiling for the session.")
    BigDecimal budgetCeiling;

    @Option(names = "--daily-cost-limit", paramLabel = "AMOUNT",
        description = "Spending limit per calendar day. Continuous mode waits for the next day, a backfill stops.")
    BigDecimal dailyCostLimit;

    @Option(names = "--cost-day-zone", defaultValue = "UTC", description = "Time zone in which cost days start.")
    ZoneId costDayZone;

    @Option(names = "--unit-cost", defaultValue = "0.00002", description = "Price per 1,000 tokens.")
    BigDecimal unitCost;

    @Option(names = "--requests-per-minute", defaultValue = "500")
    int requestsPerMinute;

    @Option(names = "--burst", defaultValue = "1", description = "Calls that may start back to back.")
    int burst;

    @Option(names = "--max-rate-limit-wait-seconds", defaultValue = "120")
    long maxRateLimitWaitSeconds;

    @Option(names = "--texts-per-call", defaultValue = "100")
    int maxTextsPerCall;

    @Option(names = "--concurrent-requests", defaultValue = "3")
    int maxConcurrentRequests;

    @Option(names = "--concurrent-batches", defaultValue = "1")
    int maxConcurrentBatches;

    @Option(names = "--call-timeout-seconds", defaultValue = "60")
    long callTimeoutSeconds;

    @Option(names = "--max-attempts", defaultValue = "4", description = "Attempts per call, page read or bulk write.")
    int maxAttempts;

    @Option(names = "--retry-base-delay-millis", defaultValue = "2000")
    long retryBaseDelayMillis;

    @Option(names = "--retry-max-delay-millis", defaultValue = "60000")
    long retryMaxDelayMillis;

    // Document store

    @Option(names = "--store-url", defaultValue = "http://localhost:9200")
    String storeUrl;

    @Option(names = "--index", description = "Index or alias to read and update.")
    String indexName;

    @Option(names = "--store-username")
    String storeUsername;

    @Option(names = "--store-password", defaultValue = "${env:STORE_PASSWORD}")
    String storePassword;

    @Option(names = "--store-api-key", defaultValue = "${env:STORE_API_KEY}")
    String storeApiKey;

    @Option(names = "--store-insecure", description = "Trust any certificate of the store.")
    boolean storeInsecure;

    @Option(names = "--store-ca-cert", description = "PEM file of the certificate authority to trust.")
    Path storeCaCertificate;

    @Option(names = "--store-max-connections", defaultValue = "10")
    int storeMaxConnections;

    @Option(names = "--candidate-page-size", defaultValue = "500",
        description = "Page size of continuous-mode candidate queries; at most the index's max_result_window.")
    int candidatePageSize;

    @Option(names = "--text-field", defaultValue = "description")
    String textField;

    @Option(names = "--created-at-field", defaultValue = "start_date")
    String createdAtField;

    @Option(names = "--updated-at-field", defaultValue = "last_changed")
    String updatedAtField;

    @Option(names = "--tiebreaker-field", defaultValue = "uid.keyword",
        description = "Unique, sortable field that breaks sort ties.")
    String tiebreakerField;

    @Option(names = "--embedding-field", defaultValue = "description_embedding")
    String embeddingField;

    @Option(names = "--sort", defaultValue = DEFAULT_SORT, split = ",", paramLabel = "FIELD:ORDER",
        description = "Backfill sort; the last field must be unique per document.")
    List<String> sort;

    // Embedding service

    @Option(names = "--embedding-url", defaultValue = "https://api.openai.com/v1",
        description = "Base URL of an OpenAI compatible embeddings API.")
    String embeddingUrl;

    @Option(names = "--embedding-api-key", defaultValue = "${env:EMBEDDING_API_KEY}")
    String embeddingApiKey;

    @Option(names = "--model", defaultValue = "text-embedding-3-small")
    String model;

    @Option(names = "--dimensions", defaultValue = "0",
        description = "Requested vector size; 0 for the model default.")
    int dimensions;

    @Option(names = "--max-input-chars", defaultValue = "8000",
        description = "Longer texts are cut before they are sent.")
    int maxInputChars;

    @Option(names = "--skip-schema-check", description = "Do not compare the index mapping with the model.")
    boolean skipSchemaCheck;

    @Option(names = "--skip-service-check", description = "Do not embed a sample text before starting.")
    boolean skipServiceCheck;

    // Change events

    @Option(names = "--document", paramLabel = "ID",
        description = "Embed only these changed documents, then exit. May be repeated.")
    List<String> documentIds = new ArrayList<>();

    // Continuous mode

    @Option(names = "--cycle-interval-minutes", defaultValue = "60")
    long cycleIntervalMinutes;

    @Option(names = "--per-cycle-cap", defaultValue = "1000")
    int perCycleCap;

    @Option(names = "--candidate-scan-limit", defaultValue = "5000")
    int candidateScanLimit;

    @Option(names = "--max-cycles", defaultValue = "0", description = "0 runs until stopped.")
    int maxCycles;

    @Option(names = "--critical-age-hours", defaultValue = "24")
    long criticalAgeHours;

    @Option(names = "--high-age-days", defaultValue = "7")
    long highAgeDays;

    @Option(names = "--normal-age-days", defaultValue = "30")
    long normalAgeDays;

    @Option(names = "--stale-after-days", defaultValue = "0",
        description = "Refresh embeddings older than this; 0 never.")
    long staleAfterDays;

    @Option(names = "--max-failed-cycles", defaultValue = "10")
    int maxConsecutiveCycleFailures;

    private final StopSignal stopSignal = new StopSignal();
    private final CountDownLatch finished = new CountDownLatch(1);

    public static void main(String[] args) {
        var command = new EmbeddingBackfillCommand();
        var commandLine = createCommandLine(command, args);
        Runtime.getRuntime().addShutdownHook(new Thread(command::stopAndAwait, "embedding-backfill-shutdown"));
        int exitCode = commandLine.execute(args);
        command.finished.countDown();
        System.exit(exitCode);
    }

    /** A command line whose defaults come from {@code --config} when it is among the arguments. */
    static CommandLine createCommandLine(EmbeddingBackfillCommand command, String[] args) {
        var commandLine = new CommandLine(command)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setParameterExceptionHandler((e, a) -> {
                e.getCommandLine().getErr().println(e.getMessage());
                CommandLine.UnmatchedArgumentException.printSuggestions(e, e.getCommandLine().getErr());
                e.getCommandLine().usage(e.getCommandLine().getErr());
                return ExitCodes.USAGE;
            });
        configFileOf(args).ifPresent(path ->
            commandLine.setDefaultValueProvider(new CommandLine.PropertiesDefaultProvider(path.toFile())));
        return commandLine;
    }

    private static Optional<Path> configFileOf(String[] args) {
        var list = Arrays.asList(args);
        for (int i = 0; i < list.size(); i++) {
            var arg = list.get(i);
            if (arg.equals("--config") && i + 1 < list.size()) {
                return Optional.of(Path.of(list.get(i + 1)));
            }
            if (arg.startsWith("--config=")) {
                return Optional.of(Path.of(arg.substring("--config=".length())));
            }
        }
        return Optional.empty();
    }

    @Override
    public Integer call() {
        try {
            return run();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return ExitCodes.USAGE;
        } catch (RuntimeException e) {
            log.atError().setMessage("Embedding backfill failed before the pipeline could report").setCause(e).log();
            return ExitCodes.FATAL;
        } finally {
            finished.countDown();
        }
    }

    private int run() {
        var config = pipelineConfig();
        var fields = fieldMapping();
        var sortSpec = mode == PipelineMode.BACKFILL ? sortSpec() : null;
        if (indexName == null || indexName.isBlank()) {
            throw new IllegalArgumentException("No index given: set --index");
        }
        if (embeddingApiKey == null || embeddingApiKey.isBlank()) {
            throw new IllegalArgumentException("No embedding API key: set EMBEDDING_API_KEY or --embedding-api-key");
        }

        var storeClient = new ReactorNettyRestClient(storeConnection(), storeMaxConnections,
            Duration.ofSeconds(callTimeoutSeconds));
        var embeddingClient = new ReactorNettyRestClient(ConnectionContext.builder()
            .host(embeddingUrl)
            .auth(new AuthConfig.BearerAuth(embeddingApiKey))
            .build(), 0, Duration.ofSeconds(callTimeoutSeconds));
        var embeddingService = new OpenAiEmbeddingService(embeddingClient, model, dimensions, maxInputChars);

        if (!skipSchemaCheck) {
            var mappedDimensions = validateSchema(storeClient, fields);
            if (mappedDimensions > 0 && config.getExpectedDimensions() == 0) {
                config = config.toBuilder().expectedDimensions(mappedDimensions).build();
            }
        }

        if (!skipServiceCheck) {
            new EmbeddingServiceCheck(embeddingService, Duration.ofSeconds(callTimeoutSeconds))
                .verify(config.getExpectedDimensions())
                .block();
        }

        var source = new OpenSearchDocumentSource(storeClient, indexName, fields, candidatePageSize);
        DocumentSink sink = dryRun
            ? new DryRunDocumentSink()
            : new OpenSearchDocumentSink(storeClient, indexName, fields);
        if (!documentIds.isEmpty()) {
            return processDocuments(DocumentEventProcessor.builder()
                .source(source)
                .sink(sink)
                .embeddingService(embeddingService)
                .config(config)
                .clock(Clock.system(costDayZone))
                .build());
        }

        var checkpointStore = new FileCheckpointStore(stateDirectory);
        config = withSession(config, checkpointStore);

        var pipeline = EmbeddingPipeline.builder()
            .source(source)
            .sink(sink)
            .embeddingService(embeddingService)
            .checkpointStore(checkpointStore)
            .config(config)
            .sort(sortSpec)
            .outputDirectory(stateDirectory)
            .dryRun(dryRun)
            .stopSignal(stopSignal)
            .clock(Clock.system(costDayZone))
            .build();

        log.atInfo().setMessage("Starting {} of index {} at {} with model {}{}")
            .addArgument(() -> mode.name().toLowerCase(Locale.ROOT))
            .addArgument(indexName)
            .addArgument(storeUrl)
            .addArgument(model)
            .addArgument(dryRun ? " (dry run)" : "")
            .log();
        RunReport report = pipeline.run().block();
        if (report == null) {
            log.error("The pipeline finished without a report");
            return ExitCodes.FATAL;
        }
        return ExitCodes.forReason(report.terminationReason());
    }

    private int processDocuments(DocumentEventProcessor processor) {
        var outcomes = new ArrayList<DocumentEventProcessor.Outcome>();
        for (var id : documentIds) {
            var outcome = processor.process(id).block();
            log.info("Document {}: {}", id, outcome);
            outcomes.add(outcome);
        }
        return exitCodeFor(outcomes);
    }

    /** A failed document makes the run fatal, a deferred one counts as budget exhaustion. */
    static int exitCodeFor(List<DocumentEventProcessor.Outcome> outcomes) {
        if (outcomes.contains(DocumentEventProcessor.Outcome.FAILED)) {
            return ExitCodes.FATAL;
        }
        if (outcomes.contains(DocumentEventProcessor.Outcome.DEFERRED)) {
            return ExitCodes.BUDGET_EXHAUSTED;
        }
        return ExitCodes.COMPLETED;
    }

    /** Returns 0 when the mapping does not state the vector size. */
    private int validateSchema(AbstractRestClient storeClient, FieldMapping fields) {
        var mapped = new IndexSchemaValidator(storeClient, indexName, fields).validate(dimensions).block();
        return mapped == null ? 0 : mapped;
    }

    private PipelineConfig withSession(PipelineConfig config, CheckpointStore checkpointStore) {
        if (resumeSessionId != null) {
            return config.toBuilder().sessionId(resumeSessionId).build();
        }
        if (!resumeLatest) {
            return config;
        }
        try {
            var latest = checkpointStore.latestSessionId();
            if (latest.isEmpty()) {
                log.info("No session to resume in {}, starting a new one", stateDirectory);
                return config;
            }
            return config.toBuilder().sessionId(latest.get()).build();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot list the sessions in " + stateDirectory, e);
        }
    }

    /** Asks a running pipeline to stop and waits for its final checkpoint and report. */
    void stopAndAwait() {
        if (finished.getCount() == 0) {
            return;
        }
        log.warn("Stop requested, finishing the batches in flight");
        stopSignal.requestStop();
        try {
            if (!finished.await(callTimeoutSeconds * 2 + 30, TimeUnit.SECONDS)) {
                log.error("The pipeline did not stop in time; the next run resumes from the last checkpoint");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    PipelineConfig pipelineConfig() {
        var backoff = new BackoffPolicy(maxAttempts, Duration.ofMillis(retryBaseDelayMillis), 2.0,
            Duration.ofMillis(retryMaxDelayMillis));
        var rules = new PriorityRules(Duration.ofHours(criticalAgeHours), Duration.ofDays(highAgeDays),
            Duration.ofDays(normalAgeDays), staleAfterDays > 0 ? Duration.ofDays(staleAfterDays) : null);
        return PipelineConfig.builder()
            .mode(mode)
            .targetCount(targetCount)
            .batchSize(batchSize)
            .minTextLength(minTextLength)
            .force(force)
            .reprocessFailed(reprocessFailed)
            .budgetCeiling(budgetCeiling)
            .dailyCostLimit(dailyCostLimit)
            .unitCost(unitCost)
            .requestsPerMinute(requestsPerMinute)
            .burst(burst)
            .maxRateLimitWait(Duration.ofSeconds(maxRateLimitWaitSeconds))
            .maxTextsPerCall(maxTextsPerCall)
            .maxConcurrentRequests(maxConcurrentRequests)
            .maxConcurrentBatches(maxConcurrentBatches)
            .callTimeout(Duration.ofSeconds(callTimeoutSeconds))
            .expectedDimensions(dimensions)
            .backoff(backoff)
            .cycleInterval(Duration.ofMinutes(cycleIntervalMinutes))
            .perCycleCap(perCycleCap)
            .candidateScanLimit(candidateScanLimit)
            .maxCycles(maxCycles)
            .priorityRules(rules)
            .maxConsecutiveCycleFailures(maxConsecutiveCycleFailures)
            .build()
            .validate();
    }

    FieldMapping fieldMapping() {
        return new FieldMapping(textField, createdAtField, updatedAtField, tiebreakerField, embeddingField,
            FieldMapping.DEFAULT.modelField(), FieldMapping.DEFAULT.generatedAtField(),
            FieldMapping.DEFAULT.textHashField(), FieldMapping.DEFAULT.dimensionsField());
    }

    /** Parses {@code field:order} pairs; the last field is the unique tiebreaker. */
    SortSpec sortSpec() {
        var fields = new ArrayList<SortSpec.SortField>();
        for (int i = 0; i < sort.size(); i++) {
            var entry = sort.get(i).trim();
            var separator = entry.lastIndexOf(':');
            var name = separator < 0 ? entry : entry.substring(0, separator);
            var order = separator < 0 ? SortSpec.Order.ASC : parseOrder(entry.substring(separator + 1), entry);
            boolean last = i == sort.size() - 1;
            fields.add(new SortSpec.SortField(name, order, last, last ? null : "_last"));
        }
        return new SortSpec(fields);
    }

    private static SortSpec.Order parseOrder(String order, String entry) {
        switch (order.trim().toLowerCase(Locale.ROOT)) {
            case "asc":
                return SortSpec.Order.ASC;
            case "desc":
                return SortSpec.Order.DESC;
            default:
                throw new IllegalArgumentException("Sort order must be asc or desc in " + entry);
        }
    }

    ConnectionContext storeConnection() {
        AuthConfig auth;
        if (storeApiKey != null && !storeApiKey.isBlank()) {
            auth = new AuthConfig.ApiKeyAuth(storeApiKey);
        } else if (storeUsername != null) {
            auth = new AuthConfig.BasicAuth(storeUsername, storePassword != null ? storePassword : "");
        } else {
            auth = AuthConfig.NoAuth.INSTANCE;
        }
        return ConnectionContext.builder()
            .host(storeUrl)
            .insecure(storeInsecure)
            .caCertificate(storeCaCertificate)
            .auth(auth)
            .build();
    }
}
