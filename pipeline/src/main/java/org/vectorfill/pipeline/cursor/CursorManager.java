package org.vectorfill.pipeline.cursor;

import java.util.List;

import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.PageRequest;
import org.vectorfill.pipeline.ir.PageResult;
import org.vectorfill.pipeline.ir.PipelineState;
import org.vectorfill.pipeline.ir.SortCursor;
import org.vectorfill.pipeline.ir.SortSpec;
import org.vectorfill.pipeline.retry.BackoffPolicy;
import org.vectorfill.pipeline.source.DocumentSource;
import org.vectorfill.pipeline.source.StoreFailures;
import org.vectorfill.pipeline.source.StoreUnavailableException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Walks the store in sort order with search-after cursors. Every request resumes strictly after
 * the sort values of the previous page's last document, so the walk can go arbitrarily deep
 * without hitting the store's result-window limit.
 */
@Slf4j
public class CursorManager {

    private final DocumentSource source;
    @Getter
    private final SortSpec sort;
    private final BackoffPolicy backoff;

    public CursorManager(DocumentSource source, SortSpec sort, BackoffPolicy backoff) {
        this.source = source;
        this.sort = sort;
        this.backoff = backoff;
    }

    /**
     * The page following the state's checkpointed cursor, sized so that the target is not
     * overshot. Returns {@link PageResult#empty()} when the store has nothing more or the target
     * has already been reached.
     */
    public Mono<PageResult> nextPage(PipelineState state) {
        long size = Math.min(state.batchSize(), state.remainingToTarget());
        if (size <= 0) {
            return Mono.just(PageResult.empty());
        }
        return fetch(state.cursor(), (int) size);
    }

    /** One page of at most {@code size} documents after {@code after} (null for the first page). */
    public Mono<PageResult> fetch(SortCursor after, int size) {
        var request = new PageRequest(sort, size, after);
        return Mono.defer(() -> source.readPage(request))
            .retryWhen(backoff.toRetry(StoreFailures::isTransient, "Page read after " + after))
            .onErrorMap(StoreFailures::isTransient,
                e -> new StoreUnavailableException("Store did not serve the page after cursor " + after, e))
            .map(this::toPageResult)
            .doOnNext(result -> logPage(after, result));
    }

    /**
     * Pages from {@code start} until the store is exhausted, each request chained on the cursor of
     * the page before it.
     */
    public Flux<PageResult.Page> iterate(SortCursor start, int pageSize) {
        return fetch(start, pageSize)
            .expand(result -> result instanceof PageResult.Page page
                ? fetch(page.cursor(), pageSize)
                : Mono.empty())
            .ofType(PageResult.Page.class);
    }

    private PageResult toPageResult(List<DocumentRef> documents) {
        if (documents.isEmpty()) {
            return PageResult.empty();
        }
        var last = documents.get(documents.size() - 1);
        return PageResult.page(documents, last.sortValues());
    }

    private static void logPage(SortCursor after, PageResult result) {
        if (result instanceof PageResult.Page page) {
            log.atDebug().setMessage("Fetched {} documents after {}, next cursor {}")
                .addArgument(() -> page.documents().size())
                .addArgument(after)
                .addArgument(page::cursor)
                .log();
        } else {
            log.atDebug().setMessage("No documents after {}").addArgument(after).log();
        }
    }
}
