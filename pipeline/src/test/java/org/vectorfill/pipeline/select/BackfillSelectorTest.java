package org.vectorfill.pipeline.select;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.vectorfill.pipeline.embedding.TextHasher;
import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.PipelineMode;
import org.vectorfill.pipeline.ir.PipelineState;
import org.vectorfill.pipeline.ir.SortCursor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackfillSelectorTest {

    private static final String MODEL = "text-embedding-3-small";
    private static final String TEXT = "A planning application for a two storey extension";
    private static final PipelineState STATE = PipelineState.start("s", PipelineMode.BACKFILL, 0, 10, Instant.EPOCH);

    private static DocumentRef document(String id, String text, String model, String hash) {
        return new DocumentRef(id, SortCursor.of(id), text, model, hash, null, Instant.EPOCH, Instant.EPOCH);
    }

    private static List<String> ids(List<DocumentRef> documents) {
        return documents.stream().map(DocumentRef::id).toList();
    }

    @Test
    void selectsMissingOutdatedAndChangedEmbeddings() {
        var selector = new BackfillSelector(MODEL, 10, false, false);
        var page = List.of(
            document("missing", TEXT, null, null),
            document("current", TEXT, MODEL, TextHasher.hash(TEXT)),
            document("old-model", TEXT, "ada-002", TextHasher.hash(TEXT)),
            document("changed", TEXT, MODEL, TextHasher.hash("the text before the edit")),
            document("no-hash", TEXT, MODEL, null));

        var selection = selector.select(page, STATE);

        assertEquals(List.of("missing", "old-model", "changed"), ids(selection.toEmbed()));
        assertEquals(List.of("current", "no-hash"), ids(selection.skipped()));
    }

    @Test
    void shortTextIsAlwaysSkipped() {
        var selector = new BackfillSelector(MODEL, 10, true, false);

        var selection = selector.select(List.of(document("short", "  tiny  ", null, null),
            document("blank", null, null, null)), STATE);

        assertTrue(selection.toEmbed().isEmpty());
        assertEquals(2, selection.skipped().size());
    }

    @Test
    void quarantinedDocumentsWaitForReprocessing() {
        var state = STATE.toBuilder().quarantinedDocumentIds(Set.of("bad")).build();
        var page = List.of(document("bad", TEXT, null, null));

        assertTrue(new BackfillSelector(MODEL, 10, false, false).select(page, state).toEmbed().isEmpty());
        assertEquals(1, new BackfillSelector(MODEL, 10, false, true).select(page, state).toEmbed().size());
    }

    @Test
    void forceReembedsCurrentDocuments() {
        var selector = new BackfillSelector(MODEL, 10, true, false);
        var page = List.of(document("current", TEXT, MODEL, TextHasher.hash(TEXT)));

        assertEquals(List.of("current"), ids(selector.select(page, STATE).toEmbed()));
    }

    @Test
    void hashIgnoresSurroundingWhitespace() {
        assertTrue(BackfillSelector.isCurrent(document("d", "  " + TEXT + "\n", MODEL, TextHasher.hash(TEXT)), MODEL));
        assertFalse(BackfillSelector.isCurrent(document("d", TEXT, MODEL, TextHasher.hash(TEXT)), "other-model"));
    }
}
