package com.field.audit.core.model;

import java.util.Locale;

/**
 * Closed classification of field types that drives value stringification.
 * Hosts map their own machine type names onto this set via {@link #fromMachineName(String, String, String)};
 * anything unknown falls back to {@link #OTHER}.
 */
public enum FieldType {
    STRING("string"),
    TEXT("text"),
    TEXT_LONG("text_long"),
    TEXT_WITH_SUMMARY("text_with_summary"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    TIMESTAMP("timestamp"),
    DECIMAL("decimal"),
    FLOAT("float"),
    DATE("date"),
    LINK("link"),
    COMMENT("comment"),
    FILE("file"),
    IMAGE("image"),
    ENTITY_REFERENCE("entity_reference"),
    NESTED_REFERENCE("entity_reference_revisions"),
    OTHER("other");

    private final String machineName;

    FieldType(String machineName) {
        this.machineName = machineName;
    }

    public String getMachineName() {
        return machineName;
    }

    /**
     * True for the plain and rich text family.
     */
    public boolean isText() {
        return this == STRING || this == TEXT || this == TEXT_LONG || this == TEXT_WITH_SUMMARY;
    }

    /**
     * True for any type whose items point at another entity by {@code target_id}.
     */
    public boolean isReference() {
        return this == ENTITY_REFERENCE || this == NESTED_REFERENCE;
    }

    /**
     * Maps a host machine type name onto a field type.
     * Revisionable references only count as nested composites when they target the nested kind;
     * any other target degrades to a plain entity reference.
     *
     * @param machineName the host type name, e.g. {@code text_long}
     * @param targetKind  the referenced entity kind, may be null
     * @param nestedKind  the entity kind treated as a nested composite, e.g. {@code paragraph}
     */
    public static FieldType fromMachineName(String machineName, String targetKind, String nestedKind) {
        if (machineName == null || machineName.isBlank()) {
            return OTHER;
        }
        String normalized = machineName.trim().toLowerCase(Locale.ROOT);
        if (NESTED_REFERENCE.machineName.equals(normalized)) {
            return nestedKind != null && nestedKind.equals(targetKind) ? NESTED_REFERENCE : ENTITY_REFERENCE;
        }
        for (FieldType type : values()) {
            if (type.machineName.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
