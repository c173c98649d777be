package org.vectorfill.pipeline.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sort-key tuple of the last document of a page. Passed back to the store as a search-after
 * value so the next page resumes strictly after it. This is never an offset.
 *
 * @param values the sort values in the same order as the fields of the {@link SortSpec}
 */
public record SortCursor(List<Object> values) {

    public SortCursor {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("A sort cursor needs at least one sort value");
        }
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SortCursor of(List<Object> values) {
        return new SortCursor(values);
    }

    public static SortCursor of(Object... values) {
        return new SortCursor(List.of(values));
    }

    @JsonValue
    @Override
    public List<Object> values() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
