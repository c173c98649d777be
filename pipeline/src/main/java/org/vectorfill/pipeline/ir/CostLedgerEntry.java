package org.vectorfill.pipeline.ir;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One immutable cost record, appended once per embedded batch.
 *
 * @param unitCost       price per 1,000 tokens at the time of the call
 * @param batchCost      cost of this batch
 * @param cumulativeCost total cost of the session including this batch
 */
public record CostLedgerEntry(
    Instant timestamp,
    int documentCount,
    long tokenCount,
    BigDecimal unitCost,
    BigDecimal batchCost,
    BigDecimal cumulativeCost
) {}
