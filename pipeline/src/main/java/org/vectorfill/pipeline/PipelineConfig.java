package org.vectorfill.pipeline;

import java.math.BigDecimal;
import java.time.Duration;

import org.vectorfill.pipeline.ir.PipelineMode;
import org.vectorfill.pipeline.retry.BackoffPolicy;
import org.vectorfill.pipeline.select.PriorityRules;

import lombok.Builder;
import lombok.Value;

/**
 * Operational settings of a run. Everything has a default; {@link #validate()} rejects
 * combinations that cannot work.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    @Builder.Default
    PipelineMode mode = PipelineMode.BACKFILL;

    /** Resume this session, or start it under this id. Null starts a new session. */
    String sessionId;

    /** Documents to visit before stopping; 0 or less means the whole corpus. Ignored in continuous mode. */
    @Builder.Default
    long targetCount = 0;

    @Builder.Default
    int batchSize = 500;

    @Builder.Default
    int minTextLength = 10;

    /** Re-embed documents even when their embedding is current. */
    @Builder.Default
    boolean force = false;

    /** Include quarantined documents again. */
    @Builder.Default
    boolean reprocessFailed = false;

    /** Spending limit for the session; null for none. */
    BigDecimal budgetCeiling;

    /** Spending limit per calendar day, in the zone of the pipeline clock; null for none. */
    BigDecimal dailyCostLimit;

    /** Price per 1,000 tokens. */
    @Builder.Default
    BigDecimal unitCost = new BigDecimal("0.00002");

    @Builder.Default
    int requestsPerMinute = 500;

    @Builder.Default
    int burst = 1;

    @Builder.Default
    Duration maxRateLimitWait = Duration.ofMinutes(2);

    @Builder.Default
    int maxTextsPerCall = 100;

    @Builder.Default
    int maxConcurrentRequests = 3;

    @Builder.Default
    int maxConcurrentBatches = 1;

    @Builder.Default
    Duration callTimeout = Duration.ofSeconds(60);

    /** Required vector length; 0 accepts whatever the model returns. */
    @Builder.Default
    int expectedDimensions = 0;

    @Builder.Default
    BackoffPolicy backoff = BackoffPolicy.DEFAULT;

    @Builder.Default
    Duration cycleInterval = Duration.ofMinutes(60);

    @Builder.Default
    int perCycleCap = 1000;

    @Builder.Default
    int candidateScanLimit = 5000;

    /** Cycles to run in continuous mode; 0 runs until stopped. */
    @Builder.Default
    int maxCycles = 0;

    @Builder.Default
    PriorityRules priorityRules = PriorityRules.DEFAULT;

    @Builder.Default
    Duration baseCooldown = Duration.ofSeconds(30);

    @Builder.Default
    Duration maxCooldown = Duration.ofMinutes(5);

    @Builder.Default
    int maxConsecutiveCycleFailures = 10;

    public PipelineConfig validate() {
        require(batchSize > 0, "batchSize must be > 0");
        require(minTextLength >= 0, "minTextLength must be >= 0");
        require(unitCost != null && unitCost.signum() >= 0, "unitCost must be >= 0");
        require(budgetCeiling == null || budgetCeiling.signum() >= 0, "budgetCeiling must be >= 0");
        require(dailyCostLimit == null || dailyCostLimit.signum() >= 0, "dailyCostLimit must be >= 0");
        require(requestsPerMinute > 0, "requestsPerMinute must be > 0");
        require(burst > 0, "burst must be > 0");
        require(maxTextsPerCall > 0, "maxTextsPerCall must be > 0");
        require(maxConcurrentRequests > 0, "maxConcurrentRequests must be > 0");
        require(maxConcurrentBatches > 0, "maxConcurrentBatches must be > 0");
        require(expectedDimensions >= 0, "expectedDimensions must be >= 0");
        require(perCycleCap > 0, "perCycleCap must be > 0");
        require(candidateScanLimit >= perCycleCap, "candidateScanLimit must be >= perCycleCap");
        require(maxCycles >= 0, "maxCycles must be >= 0");
        require(maxConsecutiveCycleFailures > 0, "maxConsecutiveCycleFailures must be > 0");
        require(!cycleInterval.isNegative() && !baseCooldown.isNegative()
            && maxCooldown.compareTo(baseCooldown) >= 0, "cool-down and interval durations are inconsistent");
        return this;
    }

    /** Cool-down after {@code failures} consecutive failed cycles: base * 2^(failures-1), capped. */
    public Duration cooldownAfter(int failures) {
        var cooldown = baseCooldown;
        for (int i = 1; i < failures && cooldown.compareTo(maxCooldown) < 0; i++) {
            cooldown = cooldown.multipliedBy(2);
        }
        return cooldown.compareTo(maxCooldown) > 0 ? maxCooldown : cooldown;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
