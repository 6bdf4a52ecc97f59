package com.field.audit.stringify;

import com.field.audit.core.model.FieldType;
import com.field.audit.metrics.MetricsService;
import com.field.audit.rules.Canonicalizer;
import com.field.audit.source.FileResolution;
import com.field.audit.source.FileResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FieldStringifierTest {

    @Mock
    private FileResolver fileResolver;

    @Mock
    private MetricsService metricsService;

    private FieldStringifier stringifier;

    @BeforeEach
    void setUp() {
        stringifier = new FieldStringifier(new Canonicalizer(), fileResolver, ZoneOffset.UTC, metricsService);
    }

    private static List<Map<String, Object>> values(Object... values) {
        return java.util.Arrays.stream(values)
                .map(v -> {
                    Map<String, Object> item = new HashMap<>();
                    item.put("value", v);
                    return item;
                })
                .toList();
    }

    @Test
    @DisplayName("Should return empty string for no items")
    void testNoItems() {
        assertEquals("", stringifier.stringify(FieldType.STRING, List.of()));
        assertEquals("", stringifier.stringify(FieldType.STRING, null));
    }

    @Test
    @DisplayName("Should trim text values")
    void testText() {
        assertEquals("Hello", stringifier.stringify(FieldType.TEXT_LONG, values("  Hello \n")));
        assertEquals("", stringifier.stringify(FieldType.STRING, values((Object) null)));
    }

    @ParameterizedTest
    @DisplayName("Should render booleans as Yes/No")
    @CsvSource({"1,Yes", "0,No", "true,Yes", "'',No"})
    void testBoolean(String raw, String expected) {
        assertEquals(expected, stringifier.stringify(FieldType.BOOLEAN, values(raw)));
    }

    @Test
    @DisplayName("Should render native booleans as Yes/No")
    void testNativeBoolean() {
        assertEquals("No, Yes", stringifier.stringify(FieldType.BOOLEAN, values(true, false)));
    }

    @Test
    @DisplayName("Should format integers and timestamps as date-times in the configured zone")
    void testTimestamp() {
        assertEquals("2023-11-14 22:13:20", stringifier.stringify(FieldType.TIMESTAMP, values(1_700_000_000L)));
        assertEquals("2023-11-14 22:13:20", stringifier.stringify(FieldType.INTEGER, values("1700000000")));
        assertEquals("1970-01-01 00:00:00", stringifier.stringify(FieldType.INTEGER, values("abc")));
    }

    @Test
    @DisplayName("Should render values outside the date range as plain numbers")
    void testTimestampOutOfRange() {
        assertEquals("100000000000000000",
                stringifier.stringify(FieldType.INTEGER, values(100_000_000_000_000_000L)));
        assertEquals("-100000000000000000",
                stringifier.stringify(FieldType.TIMESTAMP, values("-100000000000000000")));
        assertEquals(String.valueOf(Long.MAX_VALUE),
                stringifier.stringify(FieldType.INTEGER, values("99999999999999999999999")));
    }

    @Test
    @DisplayName("Should use the configured zone for timestamps")
    void testTimestampZone() {
        FieldStringifier plusTwo = new FieldStringifier(new Canonicalizer(), fileResolver, ZoneOffset.ofHours(2));
        assertEquals("1970-01-01 02:00:00", plusTwo.stringify(FieldType.TIMESTAMP, values(0)));
    }

    @ParameterizedTest
    @DisplayName("Should format decimals with two places")
    @CsvSource({"3.14159,3.14", "2,2.00", "'',0.00", "1.005e2,100.50"})
    void testDecimal(String raw, String expected) {
        assertEquals(expected, stringifier.stringify(FieldType.DECIMAL, values(raw)));
    }

    @Test
    @DisplayName("Should keep raw date strings")
    void testDate() {
        assertEquals("2024-02-29T10:00:00", stringifier.stringify(FieldType.DATE, values("2024-02-29T10:00:00")));
    }

    @Test
    @DisplayName("Should render links as uri (title)")
    void testLink() {
        Map<String, Object> link = new HashMap<>();
        link.put("uri", "https://example.com");
        link.put("title", "Example");
        link.put("options", Map.of());

        assertEquals("https://example.com (Example)", stringifier.stringify(FieldType.LINK, List.of(link)));
    }

    @Test
    @DisplayName("Should render comment status")
    void testComment() {
        assertEquals("2", stringifier.stringify(FieldType.COMMENT, List.of(Map.of("status", 2))));
        assertEquals("0", stringifier.stringify(FieldType.COMMENT, List.of(Map.of("cid", 5))));
    }

    @Test
    @DisplayName("Should render nested references by id")
    void testNestedReference() {
        Map<String, Object> item = Map.of("target_id", "7", "target_revision_id", "70");
        assertEquals("Paragraph ID: 7", stringifier.stringify(FieldType.NESTED_REFERENCE, List.of(item)));
    }

    @Test
    @DisplayName("Should render entity references and unknown types as canonical JSON")
    void testCanonicalJson() {
        Map<String, Object> reference = new LinkedHashMap<>();
        reference.put("target_type", "taxonomy_term");
        reference.put("target_id", "12");
        reference.put("entity", null);

        assertEquals("{\"target_id\":\"12\",\"target_type\":\"taxonomy_term\"}",
                stringifier.stringify(FieldType.ENTITY_REFERENCE, List.of(reference)));
        assertEquals("{\"lat\":1.5,\"lng\":2.5}",
                stringifier.stringify(FieldType.OTHER, List.of(Map.of("lng", 2.5, "lat", 1.5))));
    }

    @Test
    @DisplayName("Should sort multi-value items so storage order does not matter")
    void testOrderIndependence() {
        String forward = stringifier.stringify(FieldType.STRING, values("beta", "alpha"));
        String reverse = stringifier.stringify(FieldType.STRING, values("alpha", "beta"));

        assertEquals("alpha, beta", forward);
        assertEquals(forward, reverse);
    }

    @Test
    @DisplayName("Should drop empty items from the joined output")
    void testDropsEmpty() {
        assertEquals("a, b", stringifier.stringify(FieldType.STRING, values("b", " ", "a")));
    }

    @Test
    @DisplayName("Should render resolved files as their URL")
    void testFileResolved() {
        when(fileResolver.resolveUrl("5")).thenReturn(FileResolution.resolved("https://cdn.example.com/a.png"));

        assertEquals("https://cdn.example.com/a.png",
                stringifier.stringify(FieldType.IMAGE, List.of(Map.of("target_id", "5", "alt", "A"))));
    }

    @Test
    @DisplayName("Should render missing files as deleted")
    void testFileMissing() {
        when(fileResolver.resolveUrl("5")).thenReturn(FileResolution.missing());

        assertEquals("File (deleted)", stringifier.stringify(FieldType.FILE, List.of(Map.of("target_id", 5))));
        verifyNoInteractions(metricsService);
    }

    @Test
    @DisplayName("Should render failed lookups as error without aborting the field")
    void testFileFailure() {
        when(fileResolver.resolveUrl("5")).thenReturn(FileResolution.failed("storage offline"));
        when(fileResolver.resolveUrl("6")).thenThrow(new IllegalStateException("boom"));
        when(fileResolver.resolveUrl("7")).thenReturn(FileResolution.resolved("https://x/7.pdf"));

        String result = stringifier.stringify(FieldType.FILE, List.of(
                Map.of("target_id", "5"), Map.of("target_id", "6"), Map.of("target_id", "7")));

        assertEquals("File (error), File (error), https://x/7.pdf", result);
        verify(metricsService, times(2)).incrementResolutionFailure(MetricsService.FAILURE_FILE);
    }

    @Test
    @DisplayName("Should skip file items without a target id")
    void testFileWithoutTarget() {
        assertEquals("", stringifier.stringify(FieldType.FILE, List.of(Map.of("description", "x"))));
        verifyNoInteractions(fileResolver);
    }
}
