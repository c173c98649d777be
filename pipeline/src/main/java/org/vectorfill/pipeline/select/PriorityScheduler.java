package org.vectorfill.pipeline.select;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.PriorityQueueEntry;
import org.vectorfill.pipeline.ir.PriorityTier;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds the work list of one continuous cycle. Candidates are ranked by tier; a tier is drained
 * completely before the next lower one is touched, up to the per-cycle cap. Inside a tier newer
 * documents go first, then ascending document id.
 */
@Slf4j
public class PriorityScheduler {

    static final Comparator<PriorityQueueEntry> ORDER = Comparator
        .comparing(PriorityQueueEntry::tier)
        .thenComparing(e -> e.document().createdAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(e -> e.document().id());

    private final PriorityClassifier classifier;
    private final int perCycleCap;
    private final int minTextLength;

    public PriorityScheduler(PriorityClassifier classifier, int perCycleCap, int minTextLength) {
        if (perCycleCap <= 0) {
            throw new IllegalArgumentException("perCycleCap must be > 0, got " + perCycleCap);
        }
        this.classifier = classifier;
        this.perCycleCap = perCycleCap;
        this.minTextLength = minTextLength;
    }

    /**
     * @param entries   the documents to process this cycle, in processing order
     * @param truncated whether the cap left queued work behind
     */
    public record CyclePlan(List<PriorityQueueEntry> entries, boolean truncated, Map<PriorityTier, Integer> queued) {
        public boolean isEmpty() {
            return entries.isEmpty();
        }
    }

    public CyclePlan plan(List<DocumentRef> candidates, Instant now, Set<String> excludedIds) {
        var queue = new PriorityQueue<>(ORDER);
        var seen = new HashSet<String>();
        Map<PriorityTier, Integer> queued = new EnumMap<>(PriorityTier.class);
        for (var document : candidates) {
            if (!seen.add(document.id()) || excludedIds.contains(document.id())
                || document.textLength() < minTextLength) {
                continue;
            }
            classifier.classify(document, now).ifPresent(entry -> {
                queue.add(entry);
                queued.merge(entry.tier(), 1, Integer::sum);
            });
        }
        var entries = new ArrayList<PriorityQueueEntry>(Math.min(queue.size(), perCycleCap));
        while (!queue.isEmpty() && entries.size() < perCycleCap) {
            entries.add(queue.poll());
        }
        log.atInfo().setMessage("Cycle plan: {} of {} candidates queued by tier {}, taking {}")
            .addArgument(() -> entries.size() + queue.size())
            .addArgument(candidates::size)
            .addArgument(queued)
            .addArgument(entries::size)
            .log();
        return new CyclePlan(entries, !queue.isEmpty(), queued);
    }

    /** Splits an ordered plan into batches of at most {@code batchSize} that never mix tiers. */
    public static List<List<PriorityQueueEntry>> batches(List<PriorityQueueEntry> ordered, int batchSize) {
        var batches = new ArrayList<List<PriorityQueueEntry>>();
        var current = new ArrayList<PriorityQueueEntry>();
        for (var entry : ordered) {
            if (!current.isEmpty()
                && (current.size() >= batchSize || current.get(0).tier() != entry.tier())) {
                batches.add(List.copyOf(current));
                current.clear();
            }
            current.add(entry);
        }
        if (!current.isEmpty()) {
            batches.add(List.copyOf(current));
        }
        return batches;
    }
}
