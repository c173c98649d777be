package org.vectorfill.pipeline.source;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.vectorfill.pipeline.ir.CandidateQuery;
import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.EmbeddingResult;
import org.vectorfill.pipeline.ir.PageRequest;
import org.vectorfill.pipeline.ir.SortCursor;
import org.vectorfill.pipeline.ir.SortSpec;
import org.vectorfill.pipeline.ir.WriteAck;
import org.vectorfill.pipeline.sink.DocumentSink;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A document store held in memory that behaves like a search engine towards the pipeline: it
 * only pages with search-after, refuses pages larger than its result window, and stores written
 * embeddings on the documents. Failures can be scripted for reads and writes.
 *
 * Sort fields understood: {@code created_at} (epoch millis), {@code updated_at} (epoch millis), {@code id}.
 */
public class InMemoryDocumentStore implements DocumentSource, DocumentSink {

    private final Map<String, StoredDocument> documents = new LinkedHashMap<>();
    private final int maxResultWindow;
    private final List<PageRequest> pageRequests = new CopyOnWriteArrayList<>();
    private final List<List<String>> writtenBatches = new CopyOnWriteArrayList<>();
    private final List<CandidateQuery> candidateQueries = new CopyOnWriteArrayList<>();
    private final AtomicInteger refreshes = new AtomicInteger();
    private final List<Supplier<RuntimeException>> readFailures = new CopyOnWriteArrayList<>();
    private final List<Supplier<RuntimeException>> writeFailures = new CopyOnWriteArrayList<>();
    private final Map<String, String> rejectedWrites = new HashMap<>();

    public InMemoryDocumentStore(int maxResultWindow) {
        this.maxResultWindow = maxResultWindow;
    }

    public static class StoredDocument {
        public final String id;
        public String text;
        public Instant createdAt;
        public Instant updatedAt;
        public String embeddingModel;
        public String embeddingTextHash;
        public Instant embeddedAt;
        public float[] vector;
        public int timesEmbedded;

        StoredDocument(String id, String text, Instant createdAt) {
            this.id = id;
            this.text = text;
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }
    }

    public synchronized StoredDocument add(String id, String text, Instant createdAt) {
        var document = new StoredDocument(id, text, createdAt);
        documents.put(id, document);
        return document;
    }

    public synchronized StoredDocument get(String id) {
        return documents.get(id);
    }

    public synchronized List<StoredDocument> all() {
        return new ArrayList<>(documents.values());
    }

    public synchronized long embeddedCount() {
        return documents.values().stream().filter(d -> d.vector != null).count();
    }

    public void failNextReads(int count, Supplier<RuntimeException> failure) {
        for (int i = 0; i < count; i++) {
            readFailures.add(failure);
        }
    }

    public void failNextWrites(int count, Supplier<RuntimeException> failure) {
        for (int i = 0; i < count; i++) {
            writeFailures.add(failure);
        }
    }

    public synchronized void rejectWritesOf(String id, String reason) {
        rejectedWrites.put(id, reason);
    }

    public List<PageRequest> getPageRequests() {
        return Collections.unmodifiableList(pageRequests);
    }

    public List<List<String>> getWrittenBatches() {
        return Collections.unmodifiableList(writtenBatches);
    }

    public List<CandidateQuery> getCandidateQueries() {
        return Collections.unmodifiableList(candidateQueries);
    }

    public int getRefreshes() {
        return refreshes.get();
    }

    @Override
    public Mono<List<DocumentRef>> readPage(PageRequest request) {
        return Mono.fromCallable(() -> {
            pageRequests.add(request);
            if (!readFailures.isEmpty()) {
                throw readFailures.remove(0).get();
            }
            if (request.size() > maxResultWindow) {
                throw new IllegalArgumentException("Result window is too large, size " + request.size()
                    + " exceeds " + maxResultWindow);
            }
            var comparator = comparatorFor(request.sort());
            synchronized (this) {
                var sorted = documents.values().stream()
                    .map(d -> toRef(d, request.sort()))
                    .sorted(comparator)
                    .toList();
                var page = new ArrayList<DocumentRef>();
                for (var ref : sorted) {
                    if (request.searchAfter() != null
                        && compareCursors(request.sort(), ref.sortValues(), request.searchAfter()) <= 0) {
                        continue;
                    }
                    page.add(ref);
                    if (page.size() == request.size()) {
                        break;
                    }
                }
                return page;
            }
        });
    }

    @Override
    public Flux<DocumentRef> readCandidates(CandidateQuery query) {
        return Flux.defer(() -> {
            candidateQueries.add(query);
            if (!readFailures.isEmpty()) {
                return Flux.error(readFailures.remove(0).get());
            }
            var sort = SortSpec.of("created_at", SortSpec.Order.DESC, "id");
            List<DocumentRef> matches;
            synchronized (this) {
                matches = documents.values().stream()
                    .filter(d -> d.embeddingModel == null
                        || (query.changedSince() != null && !d.updatedAt.isBefore(query.changedSince()))
                        || (query.staleBefore() != null && d.embeddedAt != null && d.embeddedAt.isBefore(query.staleBefore()))
                        || !d.embeddingModel.equals(query.currentModel()))
                    .map(d -> toRef(d, sort))
                    .filter(ref -> query.after() == null || compareCursors(sort, ref.sortValues(), query.after()) > 0)
                    .sorted(comparatorFor(sort))
                    .limit(query.limit())
                    .toList();
            }
            return Flux.fromIterable(matches);
        });
    }

    @Override
    public Mono<DocumentRef> readDocument(String id) {
        return Mono.defer(() -> {
            if (!readFailures.isEmpty()) {
                return Mono.error(readFailures.remove(0).get());
            }
            synchronized (this) {
                var document = documents.get(id);
                return document == null
                    ? Mono.<DocumentRef>empty()
                    : Mono.just(new DocumentRef(document.id, SortCursor.of(document.id), document.text,
                        document.embeddingModel, document.embeddingTextHash, document.embeddedAt,
                        document.createdAt, document.updatedAt));
            }
        });
    }

    @Override
    public Mono<WriteAck> writeBatch(List<EmbeddingResult> batch) {
        return Mono.fromCallable(() -> {
            if (!writeFailures.isEmpty()) {
                throw writeFailures.remove(0).get();
            }
            var written = new ArrayList<String>();
            var failed = new HashMap<String, String>();
            synchronized (this) {
                for (var result : batch) {
                    var document = documents.get(result.documentId());
                    if (document == null) {
                        failed.put(result.documentId(), "document_missing_exception");
                    } else if (rejectedWrites.containsKey(result.documentId())) {
                        failed.put(result.documentId(), rejectedWrites.get(result.documentId()));
                    } else {
                        document.vector = result.vector();
                        document.embeddingModel = result.model();
                        document.embeddingTextHash = result.textHash();
                        document.embeddedAt = result.generatedAt();
                        document.timesEmbedded++;
                        written.add(result.documentId());
                    }
                }
            }
            writtenBatches.add(batch.stream().map(EmbeddingResult::documentId).toList());
            return new WriteAck(written, failed);
        });
    }

    @Override
    public Mono<Void> refresh() {
        return Mono.fromRunnable(refreshes::incrementAndGet);
    }

    @Override
    public void close() {
        // nothing to release
    }

    private static DocumentRef toRef(StoredDocument d, SortSpec sort) {
        var values = new ArrayList<Object>();
        for (var field : sort.fields()) {
            values.add(valueOf(d, field.name()));
        }
        return new DocumentRef(d.id, SortCursor.of(values), d.text, d.embeddingModel, d.embeddingTextHash,
            d.embeddedAt, d.createdAt, d.updatedAt);
    }

    private static Object valueOf(StoredDocument d, String field) {
        switch (field) {
            case "created_at":
                return d.createdAt == null ? null : d.createdAt.toEpochMilli();
            case "updated_at":
                return d.updatedAt == null ? null : d.updatedAt.toEpochMilli();
            case "id":
                return d.id;
            default:
                throw new IllegalArgumentException("No mapping for sort field " + field);
        }
    }

    private static Comparator<DocumentRef> comparatorFor(SortSpec sort) {
        return (a, b) -> compareCursors(sort, a.sortValues(), b.sortValues());
    }

    /** Compares tuples the way the store sorts them; numbers compare by value whatever their boxed type. */
    static int compareCursors(SortSpec sort, SortCursor a, SortCursor b) {
        for (int i = 0; i < sort.fields().size(); i++) {
            var field = sort.fields().get(i);
            int c = compareValues(a.values().get(i), b.values().get(i));
            if (c != 0) {
                boolean missing = a.values().get(i) == null || b.values().get(i) == null;
                return missing || field.order() == SortSpec.Order.ASC ? c : -c;
            }
        }
        return 0;
    }

    // nulls sort last in either direction
    private static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        if (a instanceof Number left && b instanceof Number right) {
            return Long.compare(left.longValue(), right.longValue());
        }
        return a.toString().compareTo(b.toString());
    }

    public Set<String> ids() {
        synchronized (this) {
            return Set.copyOf(documents.keySet());
        }
    }
}
