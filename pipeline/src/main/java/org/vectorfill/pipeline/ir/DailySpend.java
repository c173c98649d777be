package org.vectorfill.pipeline.ir;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * What a session spent on one calendar day, in the zone of the pipeline clock.
 */
public record DailySpend(LocalDate day, BigDecimal spent) {
    public DailySpend {
        Objects.requireNonNull(day, "day must not be null");
        spent = spent == null ? BigDecimal.ZERO : spent;
    }
}
