package com.field.audit.source;

import com.field.audit.core.model.FieldDefinition;
import com.field.audit.core.model.FieldType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryRecord Tests")
class InMemoryRecordTest {

    private static InMemoryRecord article() {
        return InMemoryRecord.builder()
                .entityKind("node")
                .entityId("42")
                .revisionId("3")
                .value("title", FieldType.STRING, "Title", "Hello")
                .field(FieldDefinition.reference("field_tags", FieldType.ENTITY_REFERENCE, "Tags", "taxonomy_term"),
                        List.of(Map.of("target_id", "1"), Map.of("target_id", "2")))
                .build();
    }

    @Test
    @DisplayName("Should list fields in insertion order")
    void testFieldOrder() {
        assertEquals(List.of("title", "field_tags"), article().listFieldNames());
    }

    @Test
    @DisplayName("Should expose definitions and raw items")
    void testFieldAccess() {
        InMemoryRecord record = article();

        assertTrue(record.hasField("title"));
        assertFalse(record.hasField("body"));
        assertEquals("Tags", record.getFieldDefinition("field_tags").orElseThrow().label());
        assertTrue(record.getFieldDefinition("body").isEmpty());
        assertEquals("Hello", record.getFieldValue("title").get(0).get("value"));
        assertEquals(2, record.getFieldValue("field_tags").size());
        assertTrue(record.getFieldValue("body").isEmpty());
    }

    @Test
    @DisplayName("Items should not be modifiable")
    void testImmutable() {
        InMemoryRecord record = article();
        assertThrows(UnsupportedOperationException.class,
                () -> record.getFieldValue("field_tags").add(Map.of("target_id", "3")));
    }

    @Test
    @DisplayName("toBuilder should copy identity and fields")
    void testToBuilder() {
        InMemoryRecord next = article().toBuilder()
                .revisionId("4")
                .value("title", FieldType.STRING, "Title", "Hello again")
                .build();

        assertEquals("node", next.getEntityKind());
        assertEquals("42", next.getEntityId());
        assertEquals("4", next.getRevisionId());
        assertEquals("Hello again", next.getFieldValue("title").get(0).get("value"));
        assertEquals(2, next.getFieldValue("field_tags").size());
    }

    @Test
    @DisplayName("Should require identity")
    void testRequiredIdentity() {
        assertThrows(NullPointerException.class, () -> InMemoryRecord.builder().entityId("1").build());
        assertThrows(NullPointerException.class, () -> InMemoryRecord.builder().entityKind("node").build());
    }
}
