package com.field.audit.nested;

import com.field.audit.core.model.FieldDefinition;
import com.field.audit.core.model.FieldSummary;
import com.field.audit.core.model.FieldType;
import com.field.audit.core.model.NestedItem;
import com.field.audit.core.model.NestedItemReference;
import com.field.audit.rules.Canonicalizer;
import com.field.audit.rules.ValueNormalizer;
import com.field.audit.stringify.FieldStringifier;
import com.field.audit.stringify.ItemValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Flattens a nested item into a {@link FieldSummary}.
 *
 * <p>Structural and administrative sub-fields (identity, revision, parent linkage, language,
 * behaviour settings), as well as computed or read-only ones, are skipped. Remaining sub-fields
 * render as text, {@code Yes}/{@code No}, {@code Entity ID: <id>} for references, or canonical
 * JSON for anything else. Sub-fields that render to nothing are left out of the summary.</p>
 */
public class NestedSummaryBuilder {
    private static final Logger log = LoggerFactory.getLogger(NestedSummaryBuilder.class);

    public static final String ENTITY_PREFIX = "Entity ID: ";

    private final ValueNormalizer normalizer;
    private final Canonicalizer canonicalizer;
    private final Set<String> excludedFields;

    public NestedSummaryBuilder(ValueNormalizer normalizer, Canonicalizer canonicalizer, Set<String> excludedFields) {
        this.normalizer = normalizer;
        this.canonicalizer = canonicalizer;
        this.excludedFields = Set.copyOf(excludedFields);
    }

    /**
     * Builds the summary of one nested item, keyed and sorted by sub-field name.
     */
    public FieldSummary summarize(NestedItem item) {
        SortedMap<String, String> values = new TreeMap<>();
        Map<String, String> labels = new HashMap<>();

        for (String fieldName : item.listFieldNames()) {
            if (excludedFields.contains(fieldName)) {
                continue;
            }
            FieldDefinition definition = item.getFieldDefinition(fieldName).orElse(null);
            if (definition == null || !definition.isStored()) {
                continue;
            }
            labels.put(fieldName, definition.label());

            List<String> rendered = new ArrayList<>();
            for (Map<String, Object> raw : item.getFieldValue(fieldName)) {
                String value = renderItem(definition.type(), raw);
                if (value != null && !value.isEmpty()) {
                    rendered.add(value);
                }
                log.debug("nested.field itemId={} field={} raw={} normalized={}",
                        item.getId(), fieldName, raw, value != null ? value : "");
            }

            if (!rendered.isEmpty()) {
                rendered.sort(null);
                values.put(fieldName, String.join(FieldStringifier.SEPARATOR, rendered));
            }
        }

        return new FieldSummary(item.getId(), values, labels);
    }

    private String renderItem(FieldType type, Map<String, Object> item) {
        if (type.isText()) {
            return normalizer.decodeAndCollapse(ItemValues.text(item, ItemValues.VALUE));
        }
        if (type == FieldType.BOOLEAN) {
            return ItemValues.isTruthy(item, ItemValues.VALUE) ? "Yes" : "No";
        }
        if (type.isReference()) {
            return ItemValues.isTruthy(item, NestedItemReference.TARGET_ID)
                    ? ENTITY_PREFIX + ItemValues.text(item, NestedItemReference.TARGET_ID)
                    : null;
        }
        Object canonical = canonicalizer.canonicalize(item);
        if (canonical == null || canonical instanceof Map<?, ?> map && map.isEmpty()) {
            return null;
        }
        return canonicalizer.toJson(canonical);
    }
}
