package org.vectorfill.pipeline.ir;

import java.util.Objects;

/**
 * A page query against the document store. There is deliberately no offset: the store resumes
 * strictly after {@code searchAfter}, or from the beginning when it is null.
 */
public record PageRequest(SortSpec sort, int size, SortCursor searchAfter) {
    public PageRequest {
        Objects.requireNonNull(sort, "sort must not be null");
        if (size <= 0) {
            throw new IllegalArgumentException("Page size must be > 0, got " + size);
        }
    }
}
