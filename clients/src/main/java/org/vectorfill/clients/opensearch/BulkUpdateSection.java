package org.vectorfill.clients.opensearch;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.io.SegmentedStringWriter;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.core.util.BufferRecycler;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.vectorfill.pipeline.ir.EmbeddingResult;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One {@code update} action of a bulk request: the action line naming the document and a partial
 * {@code doc} with the embedding fields.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BulkUpdateSection {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    @SuppressWarnings("unchecked")
    private static final ObjectMapper BULK_UPDATE_REQUEST_MAPPER = OBJECT_MAPPER.copy()
        .registerModule(new SimpleModule()
            .addSerializer((Class<Collection<BulkUpdateSection>>) (Class<?>) Collection.class,
                new BulkUpdateRequestCollectionSerializer()))
        .registerModule(new SimpleModule()
            .addSerializer(BulkUpdate.class, new BulkUpdate.BulkUpdateRequestSerializer()));
    private static final String NEWLINE = "\n";

    @EqualsAndHashCode.Include
    @Getter
    private final String docId;
    private final BulkUpdate bulkUpdate;

    public BulkUpdateSection(String id, String indexName, Map<String, Object> partialDoc) {
        this.docId = id;
        this.bulkUpdate = new BulkUpdate(new BulkUpdate.Metadata(id, indexName), partialDoc);
    }

    /** The partial document that stores an embedding result under the mapped field names. */
    public static BulkUpdateSection forResult(EmbeddingResult result, String indexName, FieldMapping fields) {
        var doc = new LinkedHashMap<String, Object>();
        doc.put(fields.embeddingField(), result.vector());
        doc.put(fields.modelField(), result.model());
        doc.put(fields.generatedAtField(), result.generatedAt());
        doc.put(fields.textHashField(), result.textHash());
        doc.put(fields.dimensionsField(), result.dimensions());
        return new BulkUpdateSection(result.documentId(), indexName, doc);
    }

    public static String convertToBulkRequestBody(Collection<BulkUpdateSection> bulkSections) {
        try (SegmentedStringWriter writer = new SegmentedStringWriter(new BufferRecycler())) {
            BULK_UPDATE_REQUEST_MAPPER.writeValue(writer, bulkSections);
            return writer.getAndClear();
        } catch (IOException e) {
            throw new SerializationException("Failed to serialize bulk update request: " + e.getMessage());
        }
    }

    public String asString() {
        try (SegmentedStringWriter writer = new SegmentedStringWriter(new BufferRecycler())) {
            BULK_UPDATE_REQUEST_MAPPER.writeValue(writer, this.bulkUpdate);
            return writer.getAndClear();
        } catch (IOException e) {
            throw new SerializationException("Failed to write bulk update " + this.bulkUpdate + ": " + e.getMessage());
        }
    }

    @AllArgsConstructor
    @ToString
    private static class BulkUpdate {
        private final Metadata metadata;
        @ToString.Exclude
        private final Map<String, Object> partialDoc;

        @AllArgsConstructor
        @ToString
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private static class Metadata {
            @JsonProperty("_id")
            private final String id;
            @JsonProperty("_index")
            private final String index;
        }

        public static class BulkUpdateRequestSerializer extends JsonSerializer<BulkUpdate> {
            public static final String BULK_UPDATE_COMMAND = "update";
            public static final String PARTIAL_DOC_FIELD = "doc";

            @Override
            public void serialize(BulkUpdate value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                gen.setRootValueSeparator(new SerializedString(NEWLINE));
                gen.writeStartObject();
                gen.writePOJOField(BULK_UPDATE_COMMAND, value.metadata);
                gen.writeEndObject();
                gen.writeStartObject();
                gen.writePOJOField(PARTIAL_DOC_FIELD, value.partialDoc);
                gen.writeEndObject();
            }
        }
    }

    public static class BulkUpdateRequestCollectionSerializer extends JsonSerializer<Collection<BulkUpdateSection>> {
        private static final BulkUpdate.BulkUpdateRequestSerializer INSTANCE = new BulkUpdate.BulkUpdateRequestSerializer();

        @Override
        public void serialize(Collection<BulkUpdateSection> collection, JsonGenerator gen,
                              SerializerProvider serializers) throws IOException {
            gen.setRootValueSeparator(new SerializedString(NEWLINE));
            for (BulkUpdateSection item : collection) {
                INSTANCE.serialize(item.bulkUpdate, gen, serializers);
            }
            gen.writeRaw(NEWLINE);
        }
    }

    public static class DeserializationException extends RuntimeException {
        public DeserializationException(String message) {
            super(message);
        }

        public DeserializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class SerializationException extends RuntimeException {
        public SerializationException(String message) {
            super(message);
        }
    }
}
