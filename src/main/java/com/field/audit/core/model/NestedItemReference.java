package com.field.audit.core.model;

import com.field.audit.stringify.ItemValues;

import java.util.Map;
import java.util.Optional;

/**
 * Pointer from a nested-composite field item to the nested item it embeds.
 * Identity for matching is {@code id} alone; {@code revisionId} selects which revision to load.
 */
public record NestedItemReference(String id, String revisionId) {

    public static final String TARGET_ID = "target_id";
    public static final String TARGET_REVISION_ID = "target_revision_id";

    /**
     * Reads a reference out of a raw field item. Items without a target id yield empty.
     */
    public static Optional<NestedItemReference> fromItem(Map<String, Object> item) {
        if (item == null) {
            return Optional.empty();
        }
        String id = asText(item.get(TARGET_ID));
        if (id == null) {
            return Optional.empty();
        }
        return Optional.of(new NestedItemReference(id, asText(item.get(TARGET_REVISION_ID))));
    }

    public boolean hasRevision() {
        return revisionId != null;
    }

    private static String asText(Object value) {
        String text = ItemValues.asText(value).trim();
        return text.isEmpty() || "0".equals(text) ? null : text;
    }
}
