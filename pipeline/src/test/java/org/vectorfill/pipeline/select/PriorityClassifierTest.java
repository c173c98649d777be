package org.vectorfill.pipeline.select;

import java.time.Duration;
import java.time.Instant;

import org.vectorfill.pipeline.embedding.TextHasher;
import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.EnqueueReason;
import org.vectorfill.pipeline.ir.PriorityTier;
import org.vectorfill.pipeline.ir.SortCursor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PriorityClassifierTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final String MODEL = "m1";
    private static final String TEXT = "Change of use from office to residential";

    private final PriorityClassifier classifier = new PriorityClassifier(
        new PriorityRules(Duration.ofHours(24), Duration.ofDays(7), Duration.ofDays(30), Duration.ofDays(90)), MODEL);

    private static DocumentRef unembedded(Duration age) {
        var created = NOW.minus(age);
        return new DocumentRef("d", SortCursor.of("d"), TEXT, null, null, null, created, created);
    }

    private static DocumentRef embedded(Duration age, String model, String hash, Instant embeddedAt, Instant updatedAt) {
        return new DocumentRef("d", SortCursor.of("d"), TEXT, model, hash, embeddedAt, NOW.minus(age), updatedAt);
    }

    @Test
    void newDocumentsAreTieredByAge() {
        assertEquals(PriorityTier.CRITICAL, classifier.classify(unembedded(Duration.ofHours(2)), NOW).orElseThrow().tier());
        assertEquals(PriorityTier.HIGH, classifier.classify(unembedded(Duration.ofDays(3)), NOW).orElseThrow().tier());
        assertEquals(PriorityTier.NORMAL, classifier.classify(unembedded(Duration.ofDays(20)), NOW).orElseThrow().tier());
        var old = classifier.classify(unembedded(Duration.ofDays(400)), NOW).orElseThrow();
        assertEquals(PriorityTier.LOW, old.tier());
        assertEquals(EnqueueReason.NEWLY_CREATED, old.reason());
    }

    @Test
    void aRecentFieldChangeIsAtLeastHigh() {
        var document = embedded(Duration.ofDays(100), MODEL, TextHasher.hash("earlier text"),
            NOW.minus(Duration.ofDays(99)), NOW.minus(Duration.ofHours(1)));

        var entry = classifier.classify(document, NOW).orElseThrow();

        assertEquals(PriorityTier.HIGH, entry.tier());
        assertEquals(EnqueueReason.FIELD_CHANGED, entry.reason());
    }

    @Test
    void aChangeToAFreshDocumentKeepsItsHigherTier() {
        var document = embedded(Duration.ofHours(3), MODEL, TextHasher.hash("earlier text"),
            NOW.minus(Duration.ofHours(2)), NOW.minus(Duration.ofMinutes(5)));

        assertEquals(PriorityTier.CRITICAL, classifier.classify(document, NOW).orElseThrow().tier());
    }

    @Test
    void staleOrForeignModelEmbeddingsAreLow() {
        var stale = embedded(Duration.ofHours(1), MODEL, TextHasher.hash(TEXT), NOW.minus(Duration.ofDays(120)), null);
        var foreign = embedded(Duration.ofHours(1), "m0", TextHasher.hash(TEXT), NOW.minus(Duration.ofDays(1)), null);

        var staleEntry = classifier.classify(stale, NOW).orElseThrow();
        assertEquals(PriorityTier.LOW, staleEntry.tier());
        assertEquals(EnqueueReason.STALE, staleEntry.reason());
        assertEquals(PriorityTier.LOW, classifier.classify(foreign, NOW).orElseThrow().tier());
    }

    @Test
    void currentEmbeddingsNeedNothing() {
        var current = embedded(Duration.ofDays(2), MODEL, TextHasher.hash(TEXT), NOW.minus(Duration.ofDays(1)),
            NOW.minus(Duration.ofHours(1)));

        assertTrue(classifier.classify(current, NOW).isEmpty());
    }

    @Test
    void withoutAStoredHashAnUpdateAfterEmbeddingIsAChange() {
        var touched = embedded(Duration.ofDays(10), MODEL, null, NOW.minus(Duration.ofDays(5)), NOW.minus(Duration.ofDays(2)));
        var untouched = embedded(Duration.ofDays(10), MODEL, null, NOW.minus(Duration.ofDays(5)), NOW.minus(Duration.ofDays(6)));

        assertEquals(EnqueueReason.FIELD_CHANGED, classifier.classify(touched, NOW).orElseThrow().reason());
        assertTrue(classifier.classify(untouched, NOW).isEmpty());
    }
}
