package org.vectorfill.pipeline.select;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.vectorfill.pipeline.embedding.TextHasher;
import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.EnqueueReason;
import org.vectorfill.pipeline.ir.PriorityQueueEntry;
import org.vectorfill.pipeline.ir.PriorityTier;

/**
 * Puts a continuous-mode candidate into a tier, or says it needs nothing.
 */
public class PriorityClassifier {

    private final PriorityRules rules;
    private final String currentModel;

    public PriorityClassifier(PriorityRules rules, String currentModel) {
        this.rules = rules;
        this.currentModel = currentModel;
    }

    public Optional<PriorityQueueEntry> classify(DocumentRef document, Instant now) {
        if (!document.hasEmbedding()) {
            return Optional.of(new PriorityQueueEntry(document, ageTier(document.createdAt(), now),
                EnqueueReason.NEWLY_CREATED));
        }
        if (textChanged(document)) {
            var tier = ageTier(document.createdAt(), now);
            if (isWithin(document.updatedAt(), rules.criticalAge(), now)) {
                tier = PriorityTier.higherOf(tier, PriorityTier.HIGH);
            }
            return Optional.of(new PriorityQueueEntry(document, tier, EnqueueReason.FIELD_CHANGED));
        }
        if (!document.embeddingModel().equals(currentModel) || isStale(document, now)) {
            return Optional.of(new PriorityQueueEntry(document, PriorityTier.LOW, EnqueueReason.STALE));
        }
        return Optional.empty();
    }

    PriorityTier ageTier(Instant createdAt, Instant now) {
        if (createdAt == null) {
            return PriorityTier.LOW;
        }
        if (isWithin(createdAt, rules.criticalAge(), now)) {
            return PriorityTier.CRITICAL;
        }
        if (isWithin(createdAt, rules.highAge(), now)) {
            return PriorityTier.HIGH;
        }
        if (isWithin(createdAt, rules.normalAge(), now)) {
            return PriorityTier.NORMAL;
        }
        return PriorityTier.LOW;
    }

    // Without a stored hash, a modification after the embedding counts as a change.
    private static boolean textChanged(DocumentRef document) {
        if (document.embeddedTextHash() != null) {
            return !document.embeddedTextHash().equals(TextHasher.hash(document.text()));
        }
        return document.updatedAt() != null && document.embeddedAt() != null
            && document.updatedAt().isAfter(document.embeddedAt());
    }

    private boolean isStale(DocumentRef document, Instant now) {
        return rules.staleAfter() != null && document.embeddedAt() != null
            && document.embeddedAt().isBefore(now.minus(rules.staleAfter()));
    }

    private static boolean isWithin(Instant instant, Duration age, Instant now) {
        return instant != null && instant.isAfter(now.minus(age));
    }
}
