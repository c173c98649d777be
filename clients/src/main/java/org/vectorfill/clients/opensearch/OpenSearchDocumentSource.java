package org.vectorfill.clients.opensearch;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.vectorfill.clients.http.AbstractRestClient;
import org.vectorfill.clients.http.HttpResponse;
import org.vectorfill.pipeline.ir.CandidateQuery;
import org.vectorfill.pipeline.ir.DocumentRef;
import org.vectorfill.pipeline.ir.PageRequest;
import org.vectorfill.pipeline.ir.SortCursor;
import org.vectorfill.pipeline.ir.SortSpec;
import org.vectorfill.pipeline.source.DocumentSource;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reads documents from an OpenSearch or Elasticsearch index with {@code _search} and
 * {@code search_after}. Never uses {@code from}, so the index's result window does not limit how
 * deep a walk can go.
 */
@Slf4j
public class OpenSearchDocumentSource implements DocumentSource {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final AbstractRestClient client;
    private final String indexName;
    private final FieldMapping fields;
    private final int candidatePageSize;

    /**
     * @param candidatePageSize page size used while collecting continuous-mode candidates; must
     *                          not exceed the index's {@code max_result_window}
     */
    public OpenSearchDocumentSource(AbstractRestClient client, String indexName, FieldMapping fields,
                                    int candidatePageSize) {
        if (candidatePageSize <= 0) {
            throw new IllegalArgumentException("candidatePageSize must be > 0, got " + candidatePageSize);
        }
        this.client = client;
        this.indexName = indexName;
        this.fields = fields;
        this.candidatePageSize = candidatePageSize;
    }

    @Override
    public Mono<List<DocumentRef>> readPage(PageRequest request) {
        var query = NODES.objectNode();
        query.putObject("bool").putArray("filter").addObject().putObject("exists").put("field", fields.textField());
        return search(query, request.sort(), request.size(), request.searchAfter(), "Page read");
    }

    @Override
    public Flux<DocumentRef> readCandidates(CandidateQuery candidateQuery) {
        var sort = new SortSpec(List.of(
            new SortSpec.SortField(fields.createdAtField(), SortSpec.Order.DESC, false, "_last"),
            new SortSpec.SortField(fields.tiebreakerField(), SortSpec.Order.ASC, true, null)));
        var query = candidateQuery(candidateQuery);
        var collected = new CandidatePage(List.of(), candidateQuery.after(), 0);
        return fetchCandidates(query, sort, collected, candidateQuery.limit())
            .expand(page -> page.isLast(candidatePageSize, candidateQuery.limit())
                ? Mono.empty()
                : fetchCandidates(query, sort, page, candidateQuery.limit()))
            .concatMapIterable(CandidatePage::documents);
    }

    @Override
    public Mono<DocumentRef> readDocument(String id) {
        var path = indexName + "/_doc/" + URLEncoder.encode(id, StandardCharsets.UTF_8)
            + "?_source_includes=" + String.join(",", fields.sourceFields());
        return Mono.defer(() -> client.getAsync(path))
            .flatMap(response -> response.statusCode() == 404
                ? Mono.<HttpResponse>empty()
                : StoreResponses.requireSuccess(response, "Document read"))
            .flatMap(response -> Mono.justOrEmpty(parseDocument(response.body())))
            .onErrorMap(e -> StoreResponses.asStoreFailure(e, "Document read"))
            .doOnSuccess(document -> {
                if (document == null) {
                    log.debug("Document {} not found in {}", id, indexName);
                }
            });
    }

    DocumentRef parseDocument(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new BulkUpdateSection.DeserializationException("Unreadable document response: " + e.getMessage(), e);
        }
        if (!root.path("found").asBoolean(false)) {
            return null;
        }
        return toDocument(root, SortCursor.of(root.path("_id").asText()));
    }

    private Mono<CandidatePage> fetchCandidates(ObjectNode query, SortSpec sort, CandidatePage previous, int limit) {
        int size = Math.min(candidatePageSize, limit - previous.total());
        return search(query, sort, size, previous.after(), "Candidate query")
            .map(documents -> new CandidatePage(documents,
                documents.isEmpty() ? previous.after() : documents.get(documents.size() - 1).sortValues(),
                previous.total() + documents.size()));
    }

    private record CandidatePage(List<DocumentRef> documents, SortCursor after, int total) {
        boolean isLast(int pageSize, int limit) {
            return documents.size() < pageSize || total >= limit;
        }
    }

    /**
     * A document is a candidate when it has text and either no embedding, an embedding of another
     * model, a modification since the watermark, or an embedding older than the stale cut-off.
     */
    ObjectNode candidateQuery(CandidateQuery candidateQuery) {
        var query = NODES.objectNode();
        var bool = query.putObject("bool");
        bool.putArray("filter").addObject().putObject("exists").put("field", fields.textField());
        var should = bool.putArray("should");
        should.addObject().putObject("bool").putArray("must_not")
            .addObject().putObject("exists").put("field", fields.embeddingField());
        var otherModel = should.addObject().putObject("bool");
        otherModel.putArray("filter").addObject().putObject("exists").put("field", fields.embeddingField());
        otherModel.putArray("must_not").addObject().putObject("match_phrase")
            .put(fields.modelField(), candidateQuery.currentModel());
        if (candidateQuery.changedSince() != null) {
            should.addObject().putObject("range").putObject(fields.updatedAtField())
                .put("gte", candidateQuery.changedSince().toString());
        }
        if (candidateQuery.staleBefore() != null) {
            should.addObject().putObject("range").putObject(fields.generatedAtField())
                .put("lt", candidateQuery.staleBefore().toString());
        }
        bool.put("minimum_should_match", 1);
        return query;
    }

    ObjectNode searchBody(ObjectNode query, SortSpec sort, int size, SortCursor searchAfter) {
        var body = NODES.objectNode();
        body.put("size", size);
        body.set("query", query);
        var sortArray = body.putArray("sort");
        for (var field : sort.fields()) {
            var options = sortArray.addObject().putObject(field.name());
            options.put("order", field.order() == SortSpec.Order.ASC ? "asc" : "desc");
            if (field.missing() != null) {
                options.put("missing", field.missing());
            }
        }
        if (searchAfter != null) {
            body.set("search_after", objectMapper.valueToTree(searchAfter.values()));
        }
        var source = body.putArray("_source");
        fields.sourceFields().forEach(source::add);
        body.put("track_total_hits", false);
        return body;
    }

    private Mono<List<DocumentRef>> search(ObjectNode query, SortSpec sort, int size, SortCursor searchAfter,
                                           String operation) {
        var body = searchBody(query, sort, size, searchAfter);
        return Mono.defer(() -> client.postAsync(indexName + "/_search", body.toString()))
            .flatMap(response -> StoreResponses.requireSuccess(response, operation))
            .map(response -> parseHits(response.body()))
            .onErrorMap(e -> StoreResponses.asStoreFailure(e, operation))
            .doOnNext(documents -> log.atDebug().setMessage("{} returned {} documents after {}")
                .addArgument(operation)
                .addArgument(documents::size)
                .addArgument(searchAfter)
                .log());
    }

    List<DocumentRef> parseHits(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new BulkUpdateSection.DeserializationException("Unreadable search response: " + e.getMessage(), e);
        }
        var hits = root.path("hits").path("hits");
        var documents = new ArrayList<DocumentRef>(hits.size());
        for (var hit : hits) {
            documents.add(toDocument(hit, toCursor(hit.path("sort"))));
        }
        return documents;
    }

    private DocumentRef toDocument(JsonNode hit, SortCursor sortValues) {
        var source = hit.path("_source");
        var model = textOrNull(source.path(fields.modelField()));
        return new DocumentRef(
            hit.path("_id").asText(),
            sortValues,
            textOrNull(source.path(fields.textField())),
            model,
            textOrNull(source.path(fields.textHashField())),
            StoreDates.parse(source.path(fields.generatedAtField())),
            StoreDates.parse(source.path(fields.createdAtField())),
            StoreDates.parse(source.path(fields.updatedAtField())));
    }

    private static SortCursor toCursor(JsonNode sortValues) {
        if (!(sortValues instanceof ArrayNode) || sortValues.isEmpty()) {
            throw new BulkUpdateSection.DeserializationException("Search hit without sort values: " + sortValues);
        }
        List<Object> values = new ArrayList<>(sortValues.size());
        for (var value : sortValues) {
            values.add(objectMapper.convertValue(value, Object.class));
        }
        return SortCursor.of(values);
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
