package com.field.audit.source;

import com.field.audit.core.model.FieldDefinition;
import com.field.audit.core.model.FieldType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable in-memory record revision.
 * Useful for hosts that already hold values in plain maps, and for tests.
 */
public final class InMemoryRecord implements RecordSource {

    private final String entityKind;
    private final String entityId;
    private final String revisionId;
    private final Map<String, FieldDefinition> definitions;
    private final Map<String, List<Map<String, Object>>> values;
    private final List<String> fieldOrder;

    private InMemoryRecord(Builder builder) {
        this.entityKind = Objects.requireNonNull(builder.entityKind, "entityKind is required");
        this.entityId = Objects.requireNonNull(builder.entityId, "entityId is required");
        this.revisionId = builder.revisionId;
        this.definitions = Map.copyOf(builder.definitions);
        Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
        builder.values.forEach((name, items) -> copy.put(name, List.copyOf(items)));
        this.values = copy;
        this.fieldOrder = List.copyOf(builder.definitions.keySet());
    }

    @Override
    public String getEntityKind() {
        return entityKind;
    }

    @Override
    public String getEntityId() {
        return entityId;
    }

    @Override
    public String getRevisionId() {
        return revisionId;
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

    /**
     * Returns a builder pre-populated with this record's identity and fields.
     */
    public Builder toBuilder() {
        Builder builder = builder()
                .entityKind(entityKind)
                .entityId(entityId)
                .revisionId(revisionId);
        for (String name : fieldOrder) {
            builder.field(definitions.get(name), values.get(name));
        }
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityKind;
        private String entityId;
        private String revisionId;
        private final Map<String, FieldDefinition> definitions = new LinkedHashMap<>();
        private final Map<String, List<Map<String, Object>>> values = new LinkedHashMap<>();

        public Builder entityKind(String entityKind) {
            this.entityKind = entityKind;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder revisionId(String revisionId) {
            this.revisionId = revisionId;
            return this;
        }

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

        public InMemoryRecord build() {
            return new InMemoryRecord(this);
        }
    }
}
