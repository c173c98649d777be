package org.vectorfill.pipeline.ir;

import java.util.List;

/**
 * Result of asking the cursor manager for the next page. An empty page means pagination is
 * complete, which is a normal end of a backfill and not an error.
 */
public sealed interface PageResult {

    static PageResult page(List<DocumentRef> documents, SortCursor cursor) {
        return new Page(documents, cursor);
    }

    static PageResult empty() {
        return PageEmpty.INSTANCE;
    }

    /**
     * @param documents ordered page contents, never empty
     * @param cursor    sort values of the last document in the page
     */
    record Page(List<DocumentRef> documents, SortCursor cursor) implements PageResult {
        public Page {
            if (documents == null || documents.isEmpty()) {
                throw new IllegalArgumentException("A page must contain at least one document");
            }
            documents = List.copyOf(documents);
            if (cursor == null) {
                throw new IllegalArgumentException("A page must carry the cursor of its last document");
            }
        }
    }

    final class PageEmpty implements PageResult {
        static final PageEmpty INSTANCE = new PageEmpty();

        private PageEmpty() {}

        @Override
        public String toString() {
            return "PageEmpty";
        }
    }
}
