package org.vectorfill.pipeline.embedding;

import java.time.Duration;
import java.util.List;

import org.vectorfill.pipeline.embedding.EmbeddingServiceCheck.ServiceCheckException;
import org.vectorfill.pipeline.ir.FailureKind;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmbeddingServiceCheckTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    void theSampleVectorSizeIsReported() {
        var service = new ScriptedEmbeddingService("model-a", 8, 10);

        StepVerifier.create(new EmbeddingServiceCheck(service, TIMEOUT).verify(0))
            .expectNext(8)
            .verifyComplete();
        assertEquals(List.of(List.of(EmbeddingServiceCheck.SAMPLE_TEXT)), service.getCalls());
    }

    @Test
    void aMatchingSizePasses() {
        var service = new ScriptedEmbeddingService("model-a", 8, 10);

        StepVerifier.create(new EmbeddingServiceCheck(service, TIMEOUT).verify(8))
            .expectNext(8)
            .verifyComplete();
    }

    @Test
    void anotherSizeThanTheIndexExpectsFails() {
        var service = new ScriptedEmbeddingService("model-a", 8, 10);

        StepVerifier.create(new EmbeddingServiceCheck(service, TIMEOUT).verify(1536))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(ServiceCheckException.class, e);
                assertTrue(e.getMessage().contains("1536"), e.getMessage());
            })
            .verify();
    }

    @Test
    void aFailingServiceFailsTheCheck() {
        var service = new ScriptedEmbeddingService()
            .failNext(1, () -> new EmbeddingServiceException(FailureKind.UNAUTHORIZED, "401 Unauthorized"));

        StepVerifier.create(new EmbeddingServiceCheck(service, TIMEOUT).verify(0))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(ServiceCheckException.class, e);
                assertInstanceOf(EmbeddingServiceException.class, e.getCause());
            })
            .verify();
    }

    @Test
    void aRejectedSampleOrAnEmptyVectorFailsTheCheck() {
        var rejecting = new ScriptedEmbeddingService().failItemsMatching(text -> true);
        EmbeddingService empty = new EmbeddingService() {
            @Override
            public String modelId() {
                return "model-empty";
            }

            @Override
            public Mono<EmbeddingResponse> embed(List<String> texts) {
                return Mono.just(new EmbeddingResponse(List.of(EmbeddingResponse.Item.ok(new float[0])), 1));
            }
        };

        StepVerifier.create(new EmbeddingServiceCheck(rejecting, TIMEOUT).verify(0))
            .expectError(ServiceCheckException.class)
            .verify();
        StepVerifier.create(new EmbeddingServiceCheck(empty, TIMEOUT).verify(0))
            .expectErrorMessage("Embedding service returned an empty vector")
            .verify();
    }
}
