package org.vectorfill.clients.opensearch;

import java.util.List;

/**
 * Names of the index fields the pipeline reads and writes.
 *
 * @param textField        text to embed
 * @param createdAtField   creation date, for priority tiers
 * @param updatedAtField   last modification date, for change detection
 * @param tiebreakerField  unique, sortable field used to break sort ties
 * @param embeddingField   vector field
 * @param modelField       model id of the stored vector
 * @param generatedAtField when the vector was generated
 * @param textHashField    hash of the text the vector was generated from
 * @param dimensionsField  length of the stored vector
 */
public record FieldMapping(
    String textField,
    String createdAtField,
    String updatedAtField,
    String tiebreakerField,
    String embeddingField,
    String modelField,
    String generatedAtField,
    String textHashField,
    String dimensionsField
) {

    public static final FieldMapping DEFAULT = new FieldMapping(
        "description",
        "start_date",
        "last_changed",
        "uid.keyword",
        "description_embedding",
        "embedding_model",
        "embedding_generated_at",
        "embedding_text_hash",
        "embedding_dimensions");

    public FieldMapping {
        for (var field : new String[] {textField, createdAtField, updatedAtField, tiebreakerField, embeddingField,
            modelField, generatedAtField, textHashField, dimensionsField}) {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("All field names must be set");
            }
        }
    }

    public FieldMapping withTextField(String field) {
        return new FieldMapping(field, createdAtField, updatedAtField, tiebreakerField, embeddingField,
            modelField, generatedAtField, textHashField, dimensionsField);
    }

    public FieldMapping withEmbeddingField(String field) {
        return new FieldMapping(textField, createdAtField, updatedAtField, tiebreakerField, field,
            modelField, generatedAtField, textHashField, dimensionsField);
    }

    /** Fields fetched with each hit. The vector itself is never read back. */
    public List<String> sourceFields() {
        return List.of(textField, createdAtField, updatedAtField, modelField, generatedAtField, textHashField);
    }
}
