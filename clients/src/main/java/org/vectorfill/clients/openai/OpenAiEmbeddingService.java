package org.vectorfill.clients.openai;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.vectorfill.clients.http.AbstractRestClient;
import org.vectorfill.clients.http.HttpResponse;
import org.vectorfill.pipeline.embedding.EmbeddingResponse;
import org.vectorfill.pipeline.embedding.EmbeddingService;
import org.vectorfill.pipeline.embedding.EmbeddingServiceException;
import org.vectorfill.pipeline.ir.FailureKind;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Embedding service speaking the OpenAI {@code /embeddings} API, which Azure OpenAI and most
 * self-hosted model servers also offer. The connection's base URL includes the version prefix,
 * e.g. {@code https://api.openai.com/v1}.
 */
@Slf4j
public class OpenAiEmbeddingService implements EmbeddingService {

    public static final int DEFAULT_MAX_INPUT_CHARS = 8000;

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final AbstractRestClient client;
    private final String model;
    private final int dimensions;
    private final int maxInputChars;

    /**
     * @param dimensions    requested vector size for models that can shorten their output; 0 for the model default
     * @param maxInputChars texts are cut to this many characters before they are sent
     */
    public OpenAiEmbeddingService(AbstractRestClient client, String model, int dimensions, int maxInputChars) {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("An embedding model must be named");
        }
        this.client = client;
        this.model = model;
        this.dimensions = dimensions;
        this.maxInputChars = maxInputChars;
    }

    @Override
    public String modelId() {
        return model;
    }

    @Override
    public Mono<EmbeddingResponse> embed(List<String> texts) {
        var body = requestBody(texts);
        return Mono.defer(() -> client.postAsync("embeddings", body))
            .onErrorMap(e -> !(e instanceof EmbeddingServiceException),
                e -> new EmbeddingServiceException(FailureKind.TRANSIENT, "Embedding request failed: " + e, e))
            .flatMap(response -> response.isSuccess()
                ? Mono.fromCallable(() -> parseResponse(response.body(), texts.size()))
                : Mono.error(failureOf(response)));
    }

    String requestBody(List<String> texts) {
        var body = JsonNodeFactory.instance.objectNode();
        body.put("model", model);
        var input = body.putArray("input");
        for (var text : texts) {
            input.add(truncate(text));
        }
        body.put("encoding_format", "float");
        if (dimensions > 0) {
            body.put("dimensions", dimensions);
        }
        return body.toString();
    }

    private String truncate(String text) {
        if (text.length() <= maxInputChars) {
            return text;
        }
        log.atDebug().setMessage("Cutting a text of {} characters to {}")
            .addArgument(text::length)
            .addArgument(maxInputChars)
            .log();
        return text.substring(0, maxInputChars);
    }

    EmbeddingResponse parseResponse(String responseBody, int expectedItems) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new EmbeddingServiceException(FailureKind.TRANSIENT, "Unreadable embedding response: " + e.getMessage(), e);
        }
        var items = new ArrayList<EmbeddingResponse.Item>(expectedItems);
        for (int i = 0; i < expectedItems; i++) {
            items.add(EmbeddingResponse.Item.failed("missing from the response", FailureKind.TRANSIENT));
        }
        for (var entry : root.path("data")) {
            int index = entry.path("index").asInt(-1);
            if (index < 0 || index >= expectedItems) {
                throw new EmbeddingServiceException(FailureKind.TRANSIENT,
                    "Embedding response refers to input " + index + " of " + expectedItems);
            }
            var embedding = entry.path("embedding");
            var vector = new float[embedding.size()];
            for (int d = 0; d < vector.length; d++) {
                vector[d] = (float) embedding.get(d).asDouble();
            }
            items.set(index, EmbeddingResponse.Item.ok(vector));
        }
        return new EmbeddingResponse(items, root.path("usage").path("total_tokens").asLong(0));
    }

    static EmbeddingServiceException failureOf(HttpResponse response) {
        var kind = kindOf(response.statusCode());
        var message = "Embedding service returned " + response.statusCode() + " " + response.statusText()
            + ": " + response.bodySnippet();
        return new EmbeddingServiceException(kind, message);
    }

    static FailureKind kindOf(int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return FailureKind.UNAUTHORIZED;
        }
        if (statusCode == 400 || statusCode == 413 || statusCode == 422) {
            return FailureKind.INVALID_INPUT;
        }
        // 408, 409, 429 and 5xx
        return FailureKind.TRANSIENT;
    }
}
