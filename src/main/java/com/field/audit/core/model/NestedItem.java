package com.field.audit.core.model;

import com.field.audit.source.FieldSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A composite sub-record (e.g. a paragraph) embedded in a record through a nested-composite field.
 * Instances are immutable snapshots of one revision of the item.
 */
public final class NestedItem implements FieldSource {

    private final String id;
    private final String revisionId;
    private final Map<String, FieldDefinition> definitions;
    private final Map<String, List<Map<String, Object>>> values;
    private final List<String> fieldOrder;

    private NestedItem(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.revisionId = builder.revisionId;
        this.definitions = Map.copyOf(builder.definitions);
        Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
        builder.values.forEach((name, items) -> copy.put(name, List.copyOf(items)));
        this.values = copy;
        this.fieldOrder = List.copyOf(builder.definitions.keySet());
    }

    public String getId() {
        return id;
    }

    public Optional<String> getRevisionId() {
        return Optional.ofNullable(revisionId);
    }

    @Override
    public List<String> listFieldNames() {
        return fieldOrder;
    }

    @Override
    public boolean hasField(String name) {
        return definitions.containsKey(name);
    }

    @Override
    public Optional<FieldDefinition> getFieldDefinition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    @Override
    public List<Map<String, Object>> getFieldValue(String name) {
        return values.getOrDefault(name, List.of());
    }

    @Override
    public String toString() {
        return "NestedItem{id='" + id + "', revisionId='" + revisionId + "', fields=" + fieldOrder + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String revisionId;
        private final Map<String, FieldDefinition> definitions = new LinkedHashMap<>();
        private final Map<String, List<Map<String, Object>>> values = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder revisionId(String revisionId) {
            this.revisionId = revisionId;
            return this;
        }

        /**
         * Adds a field with its raw items. Items are property maps such as {@code {"value": "..."}}.
         */
        public Builder field(FieldDefinition definition, List<Map<String, Object>> items) {
            definitions.put(definition.name(), definition);
            values.put(definition.name(), items != null ? new ArrayList<>(items) : new ArrayList<>());
            return this;
        }

        /**
         * Shorthand for a single-valued field stored under the {@code value} property.
         */
        public Builder value(String name, FieldType type, String label, Object value) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("value", value);
            return field(FieldDefinition.of(name, type, label), List.of(item));
        }

        public NestedItem build() {
            return new NestedItem(this);
        }
    }
}
