package org.vectorfill.pipeline.embedding;

import java.time.Duration;
import java.util.List;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Embeds one sample sentence before a run starts, so that a wrong key, model or vector size
 * stops the run before it reads a single page.
 */
@Slf4j
public class EmbeddingServiceCheck {

    static final String SAMPLE_TEXT = "Test planning application for residential development";

    public static class ServiceCheckException extends RuntimeException {
        public ServiceCheckException(String message) {
            super(message);
        }

        public ServiceCheckException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private final EmbeddingService service;
    private final Duration timeout;

    public EmbeddingServiceCheck(EmbeddingService service, Duration timeout) {
        this.service = service;
        this.timeout = timeout;
    }

    /**
     * Emits the length of the sample vector.
     *
     * @param expectedDimensions vector size the index expects; 0 accepts any size
     */
    public Mono<Integer> verify(int expectedDimensions) {
        return Mono.defer(() -> service.embed(List.of(SAMPLE_TEXT)))
            .timeout(timeout)
            .onErrorMap(e -> new ServiceCheckException("Embedding service " + service.modelId()
                + " did not embed the sample text: " + e.getMessage(), e))
            .map(response -> dimensionsOf(response, expectedDimensions))
            .doOnNext(dimensions -> log.info("Embedding service answers with model {} and {} dimensions",
                service.modelId(), dimensions));
    }

    private int dimensionsOf(EmbeddingResponse response, int expectedDimensions) {
        if (response.items().size() != 1) {
            throw new ServiceCheckException("Embedding service returned " + response.items().size()
                + " items for one sample text");
        }
        var item = response.items().get(0);
        if (!item.isOk()) {
            throw new ServiceCheckException("Embedding service rejected the sample text: " + item.error());
        }
        int dimensions = item.vector().length;
        if (dimensions == 0) {
            throw new ServiceCheckException("Embedding service returned an empty vector");
        }
        if (expectedDimensions > 0 && dimensions != expectedDimensions) {
            throw new ServiceCheckException("Model " + service.modelId() + " returns " + dimensions
                + " dimensions but " + expectedDimensions + " are expected");
        }
        return dimensions;
    }
}
