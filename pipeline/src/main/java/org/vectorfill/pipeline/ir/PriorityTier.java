package org.vectorfill.pipeline.ir;

/**
 * Processing tiers for continuous mode, highest first. Declaration order is the drain order.
 */
public enum PriorityTier {
    CRITICAL,
    HIGH,
    NORMAL,
    LOW;

    public boolean isHigherThan(PriorityTier other) {
        return ordinal() < other.ordinal();
    }

    public static PriorityTier higherOf(PriorityTier a, PriorityTier b) {
        return a.isHigherThan(b) ? a : b;
    }
}
