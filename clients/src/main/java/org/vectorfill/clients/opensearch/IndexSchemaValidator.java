package org.vectorfill.clients.opensearch;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.vectorfill.clients.http.AbstractRestClient;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Checks before a run that the index maps the embedding field as a vector of the expected size.
 * Understands Elasticsearch {@code dense_vector} ({@code dims}) and OpenSearch {@code knn_vector}
 * ({@code dimension}).
 */
@Slf4j
public class IndexSchemaValidator {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final AbstractRestClient client;
    private final String indexName;
    private final FieldMapping fields;

    public IndexSchemaValidator(AbstractRestClient client, String indexName, FieldMapping fields) {
        this.client = client;
        this.indexName = indexName;
        this.fields = fields;
    }

    public static class IndexSchemaException extends RuntimeException {
        public IndexSchemaException(String message) {
            super(message);
        }
    }

    /**
     * Emits the mapped vector size.
     *
     * @param expectedDimensions required size; 0 accepts any
     */
    public Mono<Integer> validate(int expectedDimensions) {
        return Mono.defer(() -> client.getAsync(indexName + "/_mapping"))
            .flatMap(response -> StoreResponses.requireSuccess(response, "Mapping lookup"))
            .map(response -> dimensionsOf(response.body()))
            .doOnNext(dimensions -> {
                if (expectedDimensions > 0 && dimensions > 0 && dimensions != expectedDimensions) {
                    throw new IndexSchemaException("Field " + fields.embeddingField() + " of index " + indexName
                        + " holds " + dimensions + " dimensions but the model produces " + expectedDimensions);
                }
                log.info("Index {} maps {} as a vector of {} dimensions", indexName, fields.embeddingField(), dimensions);
            });
    }

    int dimensionsOf(String mappingBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(mappingBody);
        } catch (IOException e) {
            throw new BulkUpdateSection.DeserializationException("Unreadable mapping response: " + e.getMessage(), e);
        }
        // the response is keyed by the concrete index name, which differs from an alias
        var indexEntry = root.has(indexName) ? root.path(indexName) : root.elements().hasNext() ? root.elements().next() : null;
        if (indexEntry == null) {
            throw new IndexSchemaException("No mapping returned for index " + indexName);
        }
        var field = indexEntry.path("mappings");
        for (var part : fields.embeddingField().split("\\.")) {
            field = field.path("properties").path(part);
        }
        if (field.isMissingNode()) {
            throw new IndexSchemaException("Index " + indexName + " has no mapping for " + fields.embeddingField());
        }
        var type = field.path("type").asText();
        switch (type) {
            case "dense_vector":
                return field.path("dims").asInt(0);
            case "knn_vector":
                return field.path("dimension").asInt(0);
            default:
                throw new IndexSchemaException("Field " + fields.embeddingField() + " of index " + indexName
                    + " is mapped as " + type + ", not as a vector");
        }
    }
}
