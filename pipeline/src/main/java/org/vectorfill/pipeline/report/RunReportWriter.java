package org.vectorfill.pipeline.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.vectorfill.pipeline.json.PipelineJson;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes the run report to {@code <dir>/<sessionId>.report.json} and logs a summary.
 */
@Slf4j
public class RunReportWriter {

    private final Path directory;

    /** @param directory where reports go; null only logs */
    public RunReportWriter(Path directory) {
        this.directory = directory;
    }

    public Optional<Path> write(RunReport report) throws IOException {
        logSummary(report);
        if (directory == null || report.sessionId() == null) {
            return Optional.empty();
        }
        Files.createDirectories(directory);
        var file = directory.resolve(report.sessionId() + ".report.json");
        PipelineJson.mapper().writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        log.info("Run report written to {}", file);
        return Optional.of(file);
    }

    static void logSummary(RunReport report) {
        log.atInfo().setMessage("Session {} ({}) finished: {}{}")
            .addArgument(report.sessionId())
            .addArgument(report.mode())
            .addArgument(report.terminationReason())
            .addArgument(report.dryRun() ? " [dry run]" : "")
            .log();
        log.atInfo().setMessage("  processed {}, embedded {}, skipped {}, failed {} ({} quarantined) in {} batches")
            .addArgument(report.processedCount())
            .addArgument(report.embeddedCount())
            .addArgument(report.skippedCount())
            .addArgument(report.failedCount())
            .addArgument(report.quarantinedCount())
            .addArgument(report.batchesCommitted())
            .log();
        log.atInfo().setMessage("  {} tokens, cost {} (ceiling {}), elapsed {}s, cursor {}")
            .addArgument(report.totalTokens())
            .addArgument(report.totalCost())
            .addArgument(() -> report.budgetCeiling() == null ? "none" : report.budgetCeiling().toPlainString())
            .addArgument(() -> report.elapsedMillis() / 1000)
            .addArgument(report.finalCursor())
            .log();
        if (report.errorMessage() != null) {
            log.error("  error: {}", report.errorMessage());
        }
    }
}
