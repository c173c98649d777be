package org.vectorfill.clients.opensearch;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.vectorfill.clients.http.AbstractRestClient;
import org.vectorfill.pipeline.ir.EmbeddingResult;
import org.vectorfill.pipeline.ir.WriteAck;
import org.vectorfill.pipeline.sink.DocumentSink;
import org.vectorfill.pipeline.source.TransientStoreException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Writes embeddings back with {@code _bulk} partial updates, one {@code update} action per
 * document, and reports the per-item outcome.
 *
 * A batch in which the store throttled any item fails as a whole with a
 * {@link TransientStoreException} so the writer retries it; partial updates are idempotent.
 */
@Slf4j
public class OpenSearchDocumentSink implements DocumentSink {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Map<String, List<String>> NDJSON_HEADERS =
        Map.of("Content-Type", List.of(AbstractRestClient.NDJSON_CONTENT_TYPE));

    private final AbstractRestClient client;
    private final String indexName;
    private final FieldMapping fields;

    public OpenSearchDocumentSink(AbstractRestClient client, String indexName, FieldMapping fields) {
        this.client = client;
        this.indexName = indexName;
        this.fields = fields;
    }

    @Override
    public Mono<WriteAck> writeBatch(List<EmbeddingResult> batch) {
        if (batch.isEmpty()) {
            return Mono.just(WriteAck.empty());
        }
        return Mono.fromCallable(() -> BulkUpdateSection.convertToBulkRequestBody(
                batch.stream().map(r -> BulkUpdateSection.forResult(r, indexName, fields)).toList()))
            .doOnNext(body -> log.atDebug().setMessage("Bulk request with {} updates, {} bytes")
                .addArgument(batch::size)
                .addArgument(body::length)
                .log())
            .flatMap(body -> client.postAsync("_bulk", body, NDJSON_HEADERS))
            .flatMap(response -> StoreResponses.requireSuccess(response, "Bulk write"))
            .map(response -> parseBulkResponse(response.body(), batch))
            .onErrorMap(e -> StoreResponses.asStoreFailure(e, "Bulk write"));
    }

    @Override
    public Mono<Void> refresh() {
        return Mono.defer(() -> client.postAsync(indexName + "/_refresh", null))
            .flatMap(response -> StoreResponses.requireSuccess(response, "Refresh"))
            .doOnNext(response -> log.info("Refreshed index {}", indexName))
            .then();
    }

    WriteAck parseBulkResponse(String responseBody, List<EmbeddingResult> batch) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new BulkUpdateSection.DeserializationException("Unreadable bulk response: " + e.getMessage(), e);
        }
        var written = new ArrayList<String>();
        var failed = new HashMap<String, String>();
        int throttled = 0;
        for (var item : root.path("items")) {
            var result = item.path("update");
            var id = result.path("_id").asText();
            int status = result.path("status").asInt();
            if (status >= 200 && status < 300) {
                written.add(id);
            } else {
                if (status == 429) {
                    throttled++;
                }
                failed.put(id, describeError(status, result.path("error")));
            }
        }
        if (throttled > 0) {
            throw new TransientStoreException("Bulk write throttled for " + throttled + " of " + batch.size() + " documents");
        }
        if (!failed.isEmpty()) {
            log.atWarn().setMessage("Bulk write rejected {} of {} documents: {}")
                .addArgument(failed::size)
                .addArgument(batch::size)
                .addArgument(failed)
                .log();
        }
        return new WriteAck(written, failed);
    }

    private static String describeError(int status, JsonNode error) {
        if (error.isMissingNode() || error.isNull()) {
            return "status " + status;
        }
        if (error.isTextual()) {
            return error.asText();
        }
        return error.path("type").asText("error") + ": " + error.path("reason").asText("");
    }
}
