package org.vectorfill.pipeline.ledger;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.vectorfill.pipeline.ir.BudgetStatus;
import org.vectorfill.pipeline.ir.CostLedgerEntry;
import org.vectorfill.pipeline.ir.DailySpend;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only record of what the embedding service billed in this session. Entries are never
 * changed after they are appended; the cumulative cost only grows.
 *
 * <p>A ledger can be seeded with the cost a resumed session had already spent, so the budget
 * ceiling covers the whole session and not just the current process.
 *
 * <p>An optional daily limit caps what is spent per calendar day in the zone of the clock. The
 * day's spend starts again from zero at the first append or budget check after midnight.
 */
@Slf4j
public class CostLedger {

    private static final BigDecimal TOKENS_PER_UNIT = BigDecimal.valueOf(1000);

    @Getter
    private final BigDecimal unitCost;
    private final BigDecimal ceiling;
    private final Clock clock;
    private final BigDecimal dailyLimit;
    private final List<CostLedgerEntry> entries = new ArrayList<>();
    private BigDecimal cumulative;
    private LocalDate day;
    private BigDecimal spentToday = BigDecimal.ZERO;

    /**
     * @param unitCost    price per 1,000 tokens
     * @param ceiling     budget ceiling, null for no ceiling
     * @param seededCost  cost already spent by the session before this ledger was created
     * @param dailyLimit  spending limit per day, null for none
     * @param seededDaily what the session had spent on its last recorded day, may be null
     */
    public CostLedger(BigDecimal unitCost, BigDecimal ceiling, BigDecimal seededCost, Clock clock,
                      BigDecimal dailyLimit, DailySpend seededDaily) {
        if (unitCost == null || unitCost.signum() < 0) {
            throw new IllegalArgumentException("unitCost must be >= 0, got " + unitCost);
        }
        if (ceiling != null && ceiling.signum() < 0) {
            throw new IllegalArgumentException("budget ceiling must be >= 0, got " + ceiling);
        }
        this.unitCost = unitCost;
        this.ceiling = ceiling;
        this.clock = clock;
        if (dailyLimit != null && dailyLimit.signum() < 0) {
            throw new IllegalArgumentException("daily limit must be >= 0, got " + dailyLimit);
        }
        this.cumulative = seededCost == null ? BigDecimal.ZERO : seededCost;
        this.dailyLimit = dailyLimit;
        if (seededDaily != null) {
            this.day = seededDaily.day();
            this.spentToday = seededDaily.spent();
        }
    }

    public CostLedger(BigDecimal unitCost, BigDecimal ceiling, BigDecimal seededCost, Clock clock) {
        this(unitCost, ceiling, seededCost, clock, null, null);
    }

    public CostLedger(BigDecimal unitCost, BigDecimal ceiling) {
        this(unitCost, ceiling, BigDecimal.ZERO, Clock.systemUTC());
    }

    public static BigDecimal costOf(long tokens, BigDecimal unitCost) {
        return BigDecimal.valueOf(tokens).multiply(unitCost).divide(TOKENS_PER_UNIT);
    }

    /** Record one embedded batch. */
    public synchronized CostLedgerEntry append(int documentCount, long tokens) {
        if (documentCount < 0 || tokens < 0) {
            throw new IllegalArgumentException("Counts must be >= 0, got documents=" + documentCount
                + " tokens=" + tokens);
        }
        var batchCost = costOf(tokens, unitCost);
        var now = Instant.now(clock);
        rollDay(now);
        cumulative = cumulative.add(batchCost);
        spentToday = spentToday.add(batchCost);
        var entry = new CostLedgerEntry(now, documentCount, tokens, unitCost, batchCost, cumulative);
        entries.add(entry);
        onAppend(entry);
        log.atDebug().setMessage("Ledger: {} documents, {} tokens, batch cost {}, cumulative {}")
            .addArgument(documentCount)
            .addArgument(tokens)
            .addArgument(batchCost)
            .addArgument(cumulative)
            .log();
        return entry;
    }

    /** Hook for ledgers that mirror entries somewhere; runs under the ledger's lock. */
    protected void onAppend(CostLedgerEntry entry) {
    }

    public synchronized BigDecimal cumulativeCost() {
        return cumulative;
    }

    /** Budget left, or empty when no ceiling is configured. Never negative. */
    public synchronized Optional<BigDecimal> remainingBudget() {
        if (ceiling == null) {
            return Optional.empty();
        }
        return Optional.of(ceiling.subtract(cumulative).max(BigDecimal.ZERO));
    }

    public synchronized boolean isExhausted() {
        return ceiling != null && cumulative.compareTo(ceiling) >= 0;
    }

    public synchronized BudgetStatus budgetStatus() {
        if (isExhausted()) {
            return new BudgetStatus.Exhausted(cumulative, ceiling);
        }
        rollDay(Instant.now(clock));
        if (dailyLimit != null && spentToday.compareTo(dailyLimit) >= 0) {
            return new BudgetStatus.DailyLimitReached(day, spentToday, dailyLimit);
        }
        return new BudgetStatus.Available(remainingBudget().orElse(null));
    }

    /** Spend of the current day. */
    public synchronized DailySpend dailySpend() {
        rollDay(Instant.now(clock));
        return new DailySpend(day, spentToday);
    }

    public Optional<BigDecimal> getDailyLimit() {
        return Optional.ofNullable(dailyLimit);
    }

    private void rollDay(Instant now) {
        var today = LocalDate.ofInstant(now, clock.getZone());
        if (today.equals(day)) {
            return;
        }
        if (day != null && spentToday.signum() > 0) {
            log.info("New cost day {}, {} was spent on {}", today, spentToday, day);
        }
        day = today;
        spentToday = BigDecimal.ZERO;
    }

    public Optional<BigDecimal> getCeiling() {
        return Optional.ofNullable(ceiling);
    }

    public synchronized List<CostLedgerEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }
}
