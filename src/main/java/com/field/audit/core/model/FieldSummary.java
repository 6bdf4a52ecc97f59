package com.field.audit.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Flattened view of one nested item: sub-field name to normalized display string, sorted by name.
 * Labels are carried alongside so diff blocks can name sub-fields the way editors see them.
 */
public record FieldSummary(String itemId, SortedMap<String, String> values, Map<String, String> labels) {

    public FieldSummary {
        Objects.requireNonNull(itemId, "itemId is required");
        values = values != null
                ? Collections.unmodifiableSortedMap(new TreeMap<>(values))
                : Collections.emptySortedMap();
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }

    /**
     * Returns the display string for a sub-field, or an empty string when it is absent.
     */
    public String valueOf(String fieldName) {
        return values.getOrDefault(fieldName, "");
    }

    /**
     * Returns the human label for a sub-field, falling back to its machine name.
     */
    public String labelOf(String fieldName) {
        return labels.getOrDefault(fieldName, fieldName);
    }

    public boolean hasLabel(String fieldName) {
        return labels.containsKey(fieldName);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Renders every entry as a {@code label: value} line, in sub-field name order.
     */
    public String toLines() {
        return values.entrySet().stream()
                .map(e -> labelOf(e.getKey()) + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }
}
