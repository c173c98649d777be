package org.vectorfill.pipeline.ledger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

import org.vectorfill.pipeline.ir.CostLedgerEntry;
import org.vectorfill.pipeline.ir.DailySpend;
import org.vectorfill.pipeline.json.PipelineJson;

import lombok.Getter;

/**
 * A cost ledger that also appends every entry as one JSON line to {@code <dir>/<sessionId>.ledger.jsonl}.
 * Lines of earlier processes of the same session are kept.
 */
public class JsonLinesCostLedger extends CostLedger {

    @Getter
    private final Path file;

    public JsonLinesCostLedger(Path directory, String sessionId, BigDecimal unitCost, BigDecimal ceiling,
                               BigDecimal seededCost, Clock clock, BigDecimal dailyLimit, DailySpend seededDaily) {
        super(unitCost, ceiling, seededCost, clock, dailyLimit, seededDaily);
        this.file = directory.resolve(sessionId + ".ledger.jsonl");
    }

    public JsonLinesCostLedger(Path directory, String sessionId, BigDecimal unitCost, BigDecimal ceiling,
                               BigDecimal seededCost, Clock clock) {
        this(directory, sessionId, unitCost, ceiling, seededCost, clock, null, null);
    }

    @Override
    protected void onAppend(CostLedgerEntry entry) {
        try {
            Files.createDirectories(file.getParent());
            var line = PipelineJson.mapper().writeValueAsString(entry) + "\n";
            Files.write(file, line.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to cost ledger " + file, e);
        }
    }
}
