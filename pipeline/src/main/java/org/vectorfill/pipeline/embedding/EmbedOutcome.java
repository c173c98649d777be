package org.vectorfill.pipeline.embedding;

import java.math.BigDecimal;
import java.util.List;

import org.vectorfill.pipeline.ir.DocumentOutcome;
import org.vectorfill.pipeline.ir.EmbeddingResult;

/**
 * Result of embedding one batch: an outcome per document, in input order, and what it cost.
 */
public record EmbedOutcome(List<DocumentOutcome> outcomes, long tokens, BigDecimal cost) {

    public EmbedOutcome {
        outcomes = List.copyOf(outcomes);
    }

    public static EmbedOutcome empty() {
        return new EmbedOutcome(List.of(), 0, BigDecimal.ZERO);
    }

    public List<EmbeddingResult> embedded() {
        return outcomes.stream()
            .filter(DocumentOutcome.Embedded.class::isInstance)
            .map(DocumentOutcome.Embedded.class::cast)
            .map(DocumentOutcome.Embedded::result)
            .toList();
    }

    public List<DocumentOutcome.Failed> failed() {
        return outcomes.stream()
            .filter(DocumentOutcome.Failed.class::isInstance)
            .map(DocumentOutcome.Failed.class::cast)
            .toList();
    }
}
