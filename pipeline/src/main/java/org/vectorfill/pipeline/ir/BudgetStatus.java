package org.vectorfill.pipeline.ir;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Answer of the cost ledger to "may another batch start?".
 */
public sealed interface BudgetStatus {

    /**
     * @param remaining budget left, or null when no ceiling is configured
     */
    record Available(BigDecimal remaining) implements BudgetStatus {
        public boolean isUnlimited() {
            return remaining == null;
        }
    }

    record Exhausted(BigDecimal spent, BigDecimal ceiling) implements BudgetStatus {}

    /** The daily limit is spent; the session may continue once {@code day} is over. */
    record DailyLimitReached(LocalDate day, BigDecimal spentToday, BigDecimal dailyLimit) implements BudgetStatus {}
}
