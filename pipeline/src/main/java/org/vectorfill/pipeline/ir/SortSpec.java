package org.vectorfill.pipeline.ir;

import java.util.List;

/**
 * Sort specification used for search-after pagination. The last field must be unique per
 * document, so that documents sharing a primary sort value are neither skipped nor repeated
 * at a page boundary.
 */
public record SortSpec(List<SortField> fields) {

    public enum Order {
        ASC,
        DESC
    }

    /**
     * @param name    store field name
     * @param order   sort direction
     * @param unique  whether the field value is unique per document
     * @param missing where documents without the field sort, e.g. {@code _last}; may be null
     */
    public record SortField(String name, Order order, boolean unique, String missing) {
        public SortField {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Sort field name must not be blank");
            }
            if (order == null) {
                throw new IllegalArgumentException("Sort order must not be null for field " + name);
            }
        }
    }

    public SortSpec {
        if (fields == null || fields.size() < 2) {
            throw new IllegalArgumentException(
                "A sort spec needs a primary field and a unique tiebreaker field, got " + fields);
        }
        if (!fields.get(fields.size() - 1).unique()) {
            throw new IllegalArgumentException(
                "The last sort field must be unique per document, got " + fields.get(fields.size() - 1).name());
        }
        fields = List.copyOf(fields);
    }

    public static SortSpec of(String primaryField, Order primaryOrder, String tiebreakerField) {
        return new SortSpec(List.of(
            new SortField(primaryField, primaryOrder, false, "_last"),
            new SortField(tiebreakerField, Order.ASC, true, null)
        ));
    }

    public SortField tiebreaker() {
        return fields.get(fields.size() - 1);
    }
}
