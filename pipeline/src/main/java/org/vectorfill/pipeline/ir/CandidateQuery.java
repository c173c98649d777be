package org.vectorfill.pipeline.ir;

import java.time.Instant;

/**
 * Continuous-mode query for documents that may need a (new) embedding. A document matches when
 * any of the conditions holds: it has no embedding, it was updated at or after
 * {@code changedSince}, its embedding was generated before {@code staleBefore}, or its embedding
 * was generated by a model other than {@code currentModel}.
 *
 * @param changedSince watermark of the previous cycle, null on the first cycle
 * @param staleBefore  embeddings older than this are stale, null disables the age rule
 * @param currentModel the model the pipeline embeds with
 * @param limit        maximum number of candidates to return
 * @param after        candidates are read in creation order, newest first, with the id as
 *                     tiebreaker; a scan resumes after these sort values, null starts from the top
 */
public record CandidateQuery(Instant changedSince, Instant staleBefore, String currentModel, int limit,
                             SortCursor after) {
    public CandidateQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("Candidate limit must be > 0, got " + limit);
        }
    }

    public CandidateQuery(Instant changedSince, Instant staleBefore, String currentModel, int limit) {
        this(changedSince, staleBefore, currentModel, limit, null);
    }
}
