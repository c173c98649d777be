package org.vectorfill.clients.opensearch;

import java.net.ConnectException;
import java.time.Instant;
import java.util.Arrays;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.vectorfill.clients.http.CannedHttpClientAdapter;
import org.vectorfill.pipeline.ir.CandidateQuery;
import org.vectorfill.pipeline.ir.PageRequest;
import org.vectorfill.pipeline.ir.SortCursor;
import org.vectorfill.pipeline.ir.SortSpec;
import org.vectorfill.pipeline.source.TransientStoreException;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenSearchDocumentSourceTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final SortSpec SORT = SortSpec.of("start_date", SortSpec.Order.DESC, "uid.keyword");

    private static final String TWO_HITS = "{\"hits\":{\"hits\":["
        + "{\"_id\":\"a\",\"sort\":[1717243200000,\"a\"],\"_source\":{"
        + "\"description\":\"Senior engineer\",\"start_date\":\"2024-06-01T12:00:00Z\","
        + "\"last_changed\":1717243200000,\"embedding_model\":\"text-embedding-3-small\","
        + "\"embedding_text_hash\":\"abc\",\"embedding_generated_at\":\"2024-06-02\"}},"
        + "{\"_id\":\"b\",\"sort\":[1717156800000,\"b\"],\"_source\":{"
        + "\"description\":\"Nurse\",\"start_date\":\"2024-05-31T12:00:00\"}}"
        + "]}}";

    private final CannedHttpClientAdapter adapter = new CannedHttpClientAdapter();
    private final OpenSearchDocumentSource source = new OpenSearchDocumentSource(
        CannedHttpClientAdapter.clientFor("http://localhost:9200", adapter), "jobs", FieldMapping.DEFAULT, 2);

    private JsonNode lastBody() throws Exception {
        return objectMapper.readTree(adapter.lastRequest().body());
    }

    @Test
    void pagesResumeAfterTheCursorWithoutAnOffset() throws Exception {
        adapter.respond(200, TWO_HITS);

        var page = source.readPage(new PageRequest(SORT, 2, SortCursor.of(1717329600000L, "z"))).block();

        assertEquals(2, page.size());
        assertEquals("jobs/_search", adapter.lastRequest().path());
        var body = lastBody();
        assertFalse(body.has("from"));
        assertEquals(2, body.get("size").asInt());
        assertEquals(1717329600000L, body.get("search_after").get(0).asLong());
        assertEquals("z", body.get("search_after").get(1).asText());
        assertEquals("desc", body.get("sort").get(0).get("start_date").get("order").asText());
        assertEquals("_last", body.get("sort").get(0).get("start_date").get("missing").asText());
        assertEquals("asc", body.get("sort").get(1).get("uid.keyword").get("order").asText());
        assertEquals("description",
            body.get("query").get("bool").get("filter").get(0).get("exists").get("field").asText());
        assertFalse(body.get("track_total_hits").asBoolean());
    }

    @Test
    void theFirstPageHasNoSearchAfter() throws Exception {
        adapter.respond(200, "{\"hits\":{\"hits\":[]}}");

        var page = source.readPage(new PageRequest(SORT, 50, null)).block();

        assertTrue(page.isEmpty());
        assertFalse(lastBody().has("search_after"));
    }

    @Test
    void hitsBecomeDocuments() {
        var documents = source.parseHits(TWO_HITS);

        var first = documents.get(0);
        assertEquals("a", first.id());
        assertEquals(SortCursor.of(1717243200000L, "a"), first.sortValues());
        assertEquals("Senior engineer", first.text());
        assertEquals("text-embedding-3-small", first.embeddingModel());
        assertEquals("abc", first.embeddedTextHash());
        assertEquals(Instant.parse("2024-06-01T12:00:00Z"), first.createdAt());
        assertEquals(Instant.ofEpochMilli(1717243200000L), first.updatedAt());
        assertEquals(Instant.parse("2024-06-02T00:00:00Z"), first.embeddedAt());

        var second = documents.get(1);
        assertEquals(Instant.parse("2024-05-31T12:00:00Z"), second.createdAt());
        assertNull(second.embeddingModel());
        assertNull(second.updatedAt());
        assertFalse(second.hasEmbedding());
    }

    @Test
    void overloadedStoreIsTransientAndBadQueriesAreNot() {
        adapter.respond(429, "{\"error\":\"too many requests\"}").respond(400, "{\"error\":\"parse\"}");

        StepVerifier.create(source.readPage(new PageRequest(SORT, 10, null)))
            .expectError(TransientStoreException.class)
            .verify();
        StepVerifier.create(source.readPage(new PageRequest(SORT, 10, null)))
            .expectErrorMatches(e -> e instanceof StoreRequestException failure && failure.getStatusCode() == 400)
            .verify();
    }

    @Test
    void connectionFailuresAreTransient() {
        adapter.fail(new ConnectException("Connection refused"));

        StepVerifier.create(source.readPage(new PageRequest(SORT, 10, null)))
            .expectErrorMatches(e -> e instanceof TransientStoreException && e.getMessage().contains("Page read"))
            .verify();
    }

    @Test
    void candidatesArePagedUpToTheLimit() throws Exception {
        var staleBefore = Instant.parse("2024-03-01T00:00:00Z");
        var changedSince = Instant.parse("2024-06-01T00:00:00Z");
        adapter.respond(200, TWO_HITS)
            .respond(200, "{\"hits\":{\"hits\":[{\"_id\":\"c\",\"sort\":[1,\"c\"],\"_source\":{\"description\":\"x\"}}]}}");

        StepVerifier.create(source.readCandidates(new CandidateQuery(changedSince, staleBefore, "model-b", 3)))
            .expectNextMatches(d -> d.id().equals("a"))
            .expectNextMatches(d -> d.id().equals("b"))
            .expectNextMatches(d -> d.id().equals("c"))
            .verifyComplete();

        assertEquals(2, adapter.getRequests().size());
        var second = lastBody();
        assertEquals(1, second.get("size").asInt());
        assertEquals("b", second.get("search_after").get(1).asText());

        var bool = second.get("query").get("bool");
        assertEquals(1, bool.get("minimum_should_match").asInt());
        var should = bool.get("should");
        assertEquals(4, should.size());
        assertEquals("description_embedding",
            should.get(0).get("bool").get("must_not").get(0).get("exists").get("field").asText());
        assertEquals("model-b",
            should.get(1).get("bool").get("must_not").get(0).get("match_phrase").get("embedding_model").asText());
        assertEquals(changedSince.toString(), should.get(2).get("range").get("last_changed").get("gte").asText());
        assertEquals(staleBefore.toString(),
            should.get(3).get("range").get("embedding_generated_at").get("lt").asText());
    }

    @Test
    void aCandidateScanResumesAfterItsCursor() throws Exception {
        adapter.respond(200, "{\"hits\":{\"hits\":[]}}");

        StepVerifier.create(source.readCandidates(
                new CandidateQuery(null, null, "model-b", 10, SortCursor.of(1717156800000L, "b"))))
            .verifyComplete();

        var body = lastBody();
        assertEquals(1717156800000L, body.get("search_after").get(0).asLong());
        assertEquals("b", body.get("search_after").get(1).asText());
        assertEquals("desc", body.get("sort").get(0).get("start_date").get("order").asText());
    }

    @Test
    void aShortCandidatePageEndsTheScan() {
        adapter.respond(200, "{\"hits\":{\"hits\":[{\"_id\":\"c\",\"sort\":[1,\"c\"],\"_source\":{}}]}}");

        StepVerifier.create(source.readCandidates(new CandidateQuery(null, null, "model-b", 100)))
            .expectNextCount(1)
            .verifyComplete();

        assertEquals(1, adapter.getRequests().size());
        assertEquals(2, source.candidateQuery(new CandidateQuery(null, null, "model-b", 100))
            .get("bool").get("should").size());
    }

    @Test
    void aSingleDocumentIsReadById() {
        adapter.respond(200, "{\"_index\":\"jobs\",\"_id\":\"job/7\",\"found\":true,\"_source\":{"
            + "\"description\":\"Site manager\",\"embedding_model\":\"model-a\","
            + "\"embedding_text_hash\":\"abc\"}}");

        var document = source.readDocument("job/7").block();

        assertEquals("GET", adapter.lastRequest().method());
        assertTrue(adapter.lastRequest().path().startsWith("jobs/_doc/job%2F7?_source_includes="));
        assertTrue(adapter.lastRequest().path().contains("embedding_text_hash"));
        assertEquals("job/7", document.id());
        assertEquals("Site manager", document.text());
        assertEquals("model-a", document.embeddingModel());
        assertEquals(SortCursor.of("job/7"), document.sortValues());
    }

    @Test
    void aMissingDocumentReadsAsEmpty() {
        adapter.respond(404, "{\"_index\":\"jobs\",\"_id\":\"gone\",\"found\":false}")
            .respond(503, "{\"error\":\"unavailable\"}");

        StepVerifier.create(source.readDocument("gone")).verifyComplete();
        StepVerifier.create(source.readDocument("gone"))
            .expectError(TransientStoreException.class)
            .verify();
    }

    @Test
    void hitsWithoutSortValuesAreRejected() {
        adapter.respond(200, "{\"hits\":{\"hits\":[{\"_id\":\"x\",\"_source\":{}}]}}");

        StepVerifier.create(source.readPage(new PageRequest(SORT, 10, null)))
            .expectError(BulkUpdateSection.DeserializationException.class)
            .verify();
    }

    @Test
    void documentsSortedWithoutTheDateSortLast() {
        var documents = source.parseHits("{\"hits\":{\"hits\":[{\"_id\":\"x\",\"sort\":[null,\"x\"],"
            + "\"_source\":{\"description\":\"y\",\"start_date\":\"not a date\"}}]}}");

        assertEquals(Arrays.asList(null, "x"), documents.get(0).sortValues().values());
        assertNull(documents.get(0).createdAt());
    }
}
