package com.field.audit.core.model;

import java.util.Objects;

/**
 * Immutable definition of a single field on a record or nested item.
 *
 * @param name       machine name, unique within the owning record
 * @param type       classification used for stringification
 * @param label      human-readable label used in change entries
 * @param targetKind referenced entity kind for reference fields, otherwise null
 * @param computed   whether the value is derived rather than stored
 * @param readOnly   whether the value cannot be edited
 */
public record FieldDefinition(
        String name,
        FieldType type,
        String label,
        String targetKind,
        boolean computed,
        boolean readOnly
) {
    public FieldDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        if (label == null || label.isBlank()) {
            label = name;
        }
    }

    public static FieldDefinition of(String name, FieldType type, String label) {
        return new FieldDefinition(name, type, label, null, false, false);
    }

    public static FieldDefinition reference(String name, FieldType type, String label, String targetKind) {
        return new FieldDefinition(name, type, label, targetKind, false, false);
    }

    /**
     * Whether this field stores user-editable data that should be compared.
     */
    public boolean isStored() {
        return !computed && !readOnly;
    }
}
