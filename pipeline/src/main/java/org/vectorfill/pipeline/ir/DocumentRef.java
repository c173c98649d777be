package org.vectorfill.pipeline.ir;

import java.time.Instant;
import java.util.Objects;

/**
 * A document as the pipeline sees it: identity, the sort values used to build cursors, the text
 * to embed and whatever is known about the embedding currently stored for it.
 *
 * @param id               unique document id
 * @param sortValues       the document's own sort-key tuple; the cursor after this document
 * @param text             the text payload to embed, may be null when the field is absent
 * @param embeddingModel   model id of the stored embedding, null when there is none
 * @param embeddedTextHash hash of the text that the stored embedding was generated from
 * @param embeddedAt       when the stored embedding was generated
 * @param createdAt        document creation time, used for priority tiers
 * @param updatedAt        last modification time of the document
 */
public record DocumentRef(
    String id,
    SortCursor sortValues,
    String text,
    String embeddingModel,
    String embeddedTextHash,
    Instant embeddedAt,
    Instant createdAt,
    Instant updatedAt
) {
    public DocumentRef {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sortValues, "sortValues must not be null for document " + id);
    }

    public boolean hasEmbedding() {
        return embeddingModel != null;
    }

    public int textLength() {
        return text == null ? 0 : text.strip().length();
    }
}
