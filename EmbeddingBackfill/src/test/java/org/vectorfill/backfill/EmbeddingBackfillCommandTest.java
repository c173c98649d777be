package org.vectorfill.backfill;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import org.vectorfill.clients.http.AuthConfig;
import org.vectorfill.clients.http.ConnectionContext;
import org.vectorfill.pipeline.DocumentEventProcessor.Outcome;
import org.vectorfill.pipeline.ir.PipelineMode;
import org.vectorfill.pipeline.ir.SortSpec;
import org.vectorfill.pipeline.ir.TerminationReason;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmbeddingBackfillCommandTest {

    @TempDir
    Path workDir;

    private static EmbeddingBackfillCommand parse(String... args) {
        var command = new EmbeddingBackfillCommand();
        EmbeddingBackfillCommand.createCommandLine(command, args).parseArgs(args);
        return command;
    }

    @Test
    void defaultsMatchThePipelineDefaults() {
        var config = parse("--index", "jobs").pipelineConfig();

        assertEquals(PipelineMode.BACKFILL, config.getMode());
        assertEquals(500, config.getBatchSize());
        assertEquals(500, config.getRequestsPerMinute());
        assertEquals(10, config.getMinTextLength());
        assertEquals(0, config.getTargetCount());
        assertEquals(new BigDecimal("0.00002"), config.getUnitCost());
        assertNull(config.getBudgetCeiling());
        assertNull(config.getSessionId());
        assertNull(config.getPriorityRules().staleAfter());
        assertFalse(config.isForce());
    }

    @Test
    void operationalControlsReachTheConfig() {
        var config = parse("--index", "jobs",
            "--mode", "continuous",
            "--target", "120",
            "--batch-size", "50",
            "--requests-per-minute", "60",
            "--budget", "12.50",
            "--force",
            "--reprocess-failed",
            "--per-cycle-cap", "200",
            "--stale-after-days", "90",
            "--cycle-interval-minutes", "15",
            "--max-attempts", "2").pipelineConfig();

        assertEquals(PipelineMode.CONTINUOUS, config.getMode());
        assertEquals(120, config.getTargetCount());
        assertEquals(50, config.getBatchSize());
        assertEquals(60, config.getRequestsPerMinute());
        assertEquals(new BigDecimal("12.50"), config.getBudgetCeiling());
        assertTrue(config.isForce());
        assertTrue(config.isReprocessFailed());
        assertEquals(200, config.getPerCycleCap());
        assertEquals(Duration.ofDays(90), config.getPriorityRules().staleAfter());
        assertEquals(Duration.ofMinutes(15), config.getCycleInterval());
        assertEquals(2, config.getBackoff().maxAttempts());
    }

    @Test
    void dailyLimitAndChangedDocumentsAreParsed() {
        var command = parse("--index", "jobs", "--daily-cost-limit", "5.00", "--cost-day-zone", "Europe/London",
            "--document", "job-1", "--document", "job-2", "--skip-service-check");

        assertEquals(new BigDecimal("5.00"), command.pipelineConfig().getDailyCostLimit());
        assertEquals(ZoneId.of("Europe/London"), command.costDayZone);
        assertEquals(List.of("job-1", "job-2"), command.documentIds);
        assertTrue(command.skipServiceCheck);
        assertNull(parse("--index", "jobs").pipelineConfig().getDailyCostLimit());
        assertTrue(parse("--index", "jobs").documentIds.isEmpty());
        assertThrows(IllegalArgumentException.class,
            () -> parse("--daily-cost-limit", "-1").pipelineConfig());
    }

    @Test
    void changedDocumentOutcomesMapToExitCodes() {
        assertEquals(ExitCodes.COMPLETED, EmbeddingBackfillCommand.exitCodeFor(
            List.of(Outcome.EMBEDDED, Outcome.UP_TO_DATE, Outcome.NOT_FOUND, Outcome.TEXT_TOO_SHORT)));
        assertEquals(ExitCodes.BUDGET_EXHAUSTED, EmbeddingBackfillCommand.exitCodeFor(
            List.of(Outcome.EMBEDDED, Outcome.DEFERRED)));
        assertEquals(ExitCodes.FATAL, EmbeddingBackfillCommand.exitCodeFor(
            List.of(Outcome.DEFERRED, Outcome.FAILED)));
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> parse("--batch-size", "0").pipelineConfig());
        assertThrows(IllegalArgumentException.class,
            () -> parse("--per-cycle-cap", "100", "--candidate-scan-limit", "10").pipelineConfig());
        assertThrows(IllegalArgumentException.class,
            () -> parse("--critical-age-hours", "480", "--high-age-days", "7").pipelineConfig());
    }

    @Test
    void theDefaultSortEndsInTheUniqueTiebreaker() {
        var sort = parse().sortSpec();

        assertEquals(List.of("start_date", "last_changed", "uid.keyword"),
            sort.fields().stream().map(SortSpec.SortField::name).toList());
        assertEquals(SortSpec.Order.DESC, sort.fields().get(0).order());
        assertEquals("_last", sort.fields().get(0).missing());
        assertEquals(SortSpec.Order.ASC, sort.tiebreaker().order());
        assertTrue(sort.tiebreaker().unique());
    }

    @Test
    void customSortsAreParsed() {
        var sort = parse("--sort", "published_at:DESC,doc_id").sortSpec();

        assertEquals("published_at", sort.fields().get(0).name());
        assertEquals(SortSpec.Order.DESC, sort.fields().get(0).order());
        assertEquals("doc_id", sort.tiebreaker().name());
        assertEquals(SortSpec.Order.ASC, sort.tiebreaker().order());

        assertThrows(IllegalArgumentException.class, () -> parse("--sort", "a:up,b:asc").sortSpec());
        assertThrows(IllegalArgumentException.class, () -> parse("--sort", "only_one:asc").sortSpec());
    }

    @Test
    void fieldNamesCanBeRemapped() {
        var fields = parse("--text-field", "body", "--embedding-field", "body_vector",
            "--tiebreaker-field", "id").fieldMapping();

        assertEquals("body", fields.textField());
        assertEquals("body_vector", fields.embeddingField());
        assertEquals("id", fields.tiebreakerField());
        assertEquals("embedding_model", fields.modelField());
    }

    @Test
    void storeCredentials() {
        assertInstanceOf(AuthConfig.ApiKeyAuth.class,
            parse("--store-url", "https://es:9200", "--store-api-key", "a2V5").storeConnection().getAuth());

        ConnectionContext basic = parse("--store-url", "https://es:9200", "--store-username", "admin",
            "--store-password", "pw", "--store-api-key=").storeConnection();
        var basicAuth = assertInstanceOf(AuthConfig.BasicAuth.class, basic.getAuth());
        assertEquals("admin", basicAuth.username);

        var insecure = parse("--store-url", "https://es:9200", "--store-insecure", "--store-api-key=")
            .storeConnection();
        assertTrue(insecure.isInsecure());
        assertEquals(AuthConfig.NoAuth.INSTANCE, insecure.getAuth());
    }

    @Test
    void optionsMayComeFromAPropertiesFile() throws Exception {
        var properties = workDir.resolve("backfill.properties");
        Files.writeString(properties, "batch-size=200\nmodel=text-embedding-3-large\nindex=jobs\nforce=true\n");

        var command = parse("--config", properties.toString(), "--requests-per-minute", "30");

        assertEquals("jobs", command.indexName);
        assertEquals("text-embedding-3-large", command.model);
        var config = command.pipelineConfig();
        assertEquals(200, config.getBatchSize());
        assertEquals(30, config.getRequestsPerMinute());
        assertTrue(config.isForce());
    }

    @Test
    void commandLineOptionsOverrideThePropertiesFile() throws Exception {
        var properties = workDir.resolve("backfill.properties");
        Files.writeString(properties, "batch-size=200\n");

        var command = parse("--config=" + properties, "--batch-size", "75");

        assertEquals(75, command.pipelineConfig().getBatchSize());
    }

    @Test
    void usageErrorsAndMissingSettingsExitWithTheUsageCode() {
        String[] unknown = {"--no-such-option"};
        assertEquals(ExitCodes.USAGE,
            EmbeddingBackfillCommand.createCommandLine(new EmbeddingBackfillCommand(), unknown).execute(unknown));

        String[] noIndex = {"--embedding-api-key", "sk-test", "--state-dir", workDir.toString()};
        assertEquals(ExitCodes.USAGE,
            EmbeddingBackfillCommand.createCommandLine(new EmbeddingBackfillCommand(), noIndex).execute(noIndex));

        String[] noKey = {"--index", "jobs", "--embedding-api-key=", "--state-dir", workDir.toString()};
        assertEquals(ExitCodes.USAGE,
            EmbeddingBackfillCommand.createCommandLine(new EmbeddingBackfillCommand(), noKey).execute(noKey));
    }

    @Test
    void terminationReasonsMapToExitCodes() {
        assertEquals(0, ExitCodes.forReason(TerminationReason.COMPLETED));
        assertEquals(2, ExitCodes.forReason(TerminationReason.BUDGET_EXHAUSTED));
        assertEquals(130, ExitCodes.forReason(TerminationReason.CANCELLED));
        assertEquals(1, ExitCodes.forReason(TerminationReason.FATAL_ERROR));
    }

    @Test
    void stoppingAfterTheRunFinishedReturnsImmediately() {
        String[] noIndex = {"--embedding-api-key", "sk-test"};
        var command = new EmbeddingBackfillCommand();
        EmbeddingBackfillCommand.createCommandLine(command, noIndex).execute(noIndex);

        assertTimeout(Duration.ofSeconds(5), command::stopAndAwait);
    }
}
