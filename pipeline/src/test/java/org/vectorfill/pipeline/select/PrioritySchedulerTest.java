package org.vectorfill.pipeline.select;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.PriorityQueueEntry;
import org.vectorfill.pipeline.ir.PriorityTier;
import org.vectorfill.pipeline.ir.SortCursor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrioritySchedulerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final PriorityScheduler scheduler =
        new PriorityScheduler(new PriorityClassifier(PriorityRules.DEFAULT, "m1"), 100, 10);

    private static DocumentRef fresh(String id, Duration age) {
        var created = NOW.minus(age);
        return new DocumentRef(id, SortCursor.of(id), "Some application text for " + id, null, null, null,
            created, created);
    }

    private static List<String> ids(List<PriorityQueueEntry> entries) {
        return entries.stream().map(e -> e.document().id()).toList();
    }

    @Test
    void everyCriticalDocumentComesBeforeAnyNormalOne() {
        var candidates = new ArrayList<DocumentRef>();
        for (int i = 0; i < 20; i++) {
            candidates.add(fresh("normal-" + i, Duration.ofDays(10 + i % 5)));
            candidates.add(fresh("critical-" + i, Duration.ofHours(1 + i % 5)));
        }

        var plan = scheduler.plan(candidates, NOW, Set.of());

        var tiers = plan.entries().stream().map(PriorityQueueEntry::tier).toList();
        assertEquals(40, tiers.size());
        assertTrue(tiers.subList(0, 20).stream().allMatch(t -> t == PriorityTier.CRITICAL));
        assertTrue(tiers.subList(20, 40).stream().allMatch(t -> t == PriorityTier.NORMAL));
        assertFalse(plan.truncated());
    }

    @Test
    void tiesInATierGoNewestFirstThenById() {
        var plan = scheduler.plan(List.of(
            fresh("b", Duration.ofHours(2)),
            fresh("a", Duration.ofHours(2)),
            fresh("c", Duration.ofHours(1))), NOW, Set.of());

        assertEquals(List.of("c", "a", "b"), ids(plan.entries()));
    }

    @Test
    void theCapStopsTheCycleAndMarksItTruncated() {
        var capped = new PriorityScheduler(new PriorityClassifier(PriorityRules.DEFAULT, "m1"), 2, 10);

        var plan = capped.plan(List.of(
            fresh("low", Duration.ofDays(365)),
            fresh("high", Duration.ofDays(3)),
            fresh("critical", Duration.ofHours(3))), NOW, Set.of());

        assertEquals(List.of("critical", "high"), ids(plan.entries()));
        assertTrue(plan.truncated());
    }

    @Test
    void excludedShortAndDuplicateCandidatesAreDropped() {
        var shortText = new DocumentRef("short", SortCursor.of("short"), "tiny", null, null, null, NOW, NOW);

        var plan = scheduler.plan(List.of(
            fresh("a", Duration.ofHours(1)),
            fresh("a", Duration.ofHours(1)),
            fresh("quarantined", Duration.ofHours(1)),
            shortText), NOW, Set.of("quarantined"));

        assertEquals(List.of("a"), ids(plan.entries()));
    }

    @Test
    void anEmptyCandidateListIsAnEmptyPlan() {
        var plan = scheduler.plan(List.of(), NOW, Set.of());

        assertTrue(plan.isEmpty());
        assertFalse(plan.truncated());
    }

    @Test
    void batchesNeverMixTiers() {
        var plan = scheduler.plan(List.of(
            fresh("c1", Duration.ofHours(1)),
            fresh("c2", Duration.ofHours(2)),
            fresh("c3", Duration.ofHours(3)),
            fresh("h1", Duration.ofDays(2))), NOW, Set.of());

        var batches = PriorityScheduler.batches(plan.entries(), 2);

        assertEquals(List.of(List.of("c1", "c2"), List.of("c3"), List.of("h1")),
            batches.stream().map(PrioritySchedulerTest::ids).toList());
    }
}
