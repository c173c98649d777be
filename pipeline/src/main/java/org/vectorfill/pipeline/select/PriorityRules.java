package org.vectorfill.pipeline.select;

import java.time.Duration;

/**
 * Age thresholds for priority tiers, measured on a document's creation time.
 *
 * @param criticalAge documents younger than this are CRITICAL
 * @param highAge     younger than this are HIGH
 * @param normalAge   younger than this are NORMAL, older ones LOW
 * @param staleAfter  embeddings older than this are refreshed at LOW priority; null never
 */
public record PriorityRules(Duration criticalAge, Duration highAge, Duration normalAge, Duration staleAfter) {

    public static final PriorityRules DEFAULT =
        new PriorityRules(Duration.ofHours(24), Duration.ofDays(7), Duration.ofDays(30), null);

    public PriorityRules {
        if (criticalAge == null || highAge == null || normalAge == null) {
            throw new IllegalArgumentException("Tier ages must be set");
        }
        if (criticalAge.compareTo(highAge) > 0 || highAge.compareTo(normalAge) > 0) {
            throw new IllegalArgumentException("Tier ages must grow: critical=" + criticalAge
                + " high=" + highAge + " normal=" + normalAge);
        }
    }
}
