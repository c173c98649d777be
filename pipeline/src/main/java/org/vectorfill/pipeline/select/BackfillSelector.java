package org.vectorfill.pipeline.select;

import java.util.ArrayList;
import java.util.List;

import org.vectorfill.pipeline.embedding.TextHasher;
import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.PipelineState;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides which documents of a backfill page get embedded.
 *
 * A document is skipped when its text is too short to embed, when it already carries an
 * embedding of the current model for its current text, or when it is quarantined. {@code force}
 * lifts the last two rules.
 */
@Slf4j
public class BackfillSelector {

    private final String currentModel;
    private final int minTextLength;
    private final boolean force;
    private final boolean includeQuarantined;

    public BackfillSelector(String currentModel, int minTextLength, boolean force, boolean includeQuarantined) {
        this.currentModel = currentModel;
        this.minTextLength = minTextLength;
        this.force = force;
        this.includeQuarantined = includeQuarantined;
    }

    public record Selection(List<DocumentRef> toEmbed, List<DocumentRef> skipped) {}

    public Selection select(List<DocumentRef> page, PipelineState state) {
        var toEmbed = new ArrayList<DocumentRef>();
        var skipped = new ArrayList<DocumentRef>();
        for (var document : page) {
            var reason = skipReason(document, state);
            if (reason == null) {
                toEmbed.add(document);
            } else {
                log.atDebug().setMessage("Skipping {}: {}").addArgument(document::id).addArgument(reason).log();
                skipped.add(document);
            }
        }
        return new Selection(toEmbed, skipped);
    }

    private String skipReason(DocumentRef document, PipelineState state) {
        if (document.textLength() < minTextLength) {
            return "text shorter than " + minTextLength + " characters";
        }
        if (force) {
            return null;
        }
        if (!includeQuarantined && state.quarantinedDocumentIds().contains(document.id())) {
            return "quarantined";
        }
        if (isCurrent(document, currentModel)) {
            return "embedding is current";
        }
        return null;
    }

    /**
     * Whether the stored embedding was made by {@code model} from the document's present text. An
     * embedding without a stored text hash is taken as current when the model matches.
     */
    public static boolean isCurrent(DocumentRef document, String model) {
        if (!document.hasEmbedding() || !document.embeddingModel().equals(model)) {
            return false;
        }
        return document.embeddedTextHash() == null
            || document.embeddedTextHash().equals(TextHasher.hash(document.text()));
    }
}
