package com.field.audit.source;

import com.field.audit.core.model.FieldDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over a field-bearing snapshot: a record revision or a nested item revision.
 * Raw values are lists of item property maps, e.g. {@code [{"value": "Hello"}]}.
 */
public interface FieldSource {

    /**
     * Names of every defined field, in definition order.
     */
    List<String> listFieldNames();

    boolean hasField(String name);

    Optional<FieldDefinition> getFieldDefinition(String name);

    /**
     * Raw items stored for a field; an empty list when the field has no value.
     */
    List<Map<String, Object>> getFieldValue(String name);
}
