package com.field.audit.stringify;

import com.field.audit.core.model.FieldType;
import com.field.audit.core.model.NestedItemReference;
import com.field.audit.metrics.MetricsService;
import com.field.audit.metrics.NoOpMetricsService;
import com.field.audit.rules.Canonicalizer;
import com.field.audit.source.FileResolution;
import com.field.audit.source.FileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Converts the raw items of one field into a single display string.
 *
 * <p>Each item is rendered according to the field type, then the rendered strings are sorted,
 * empty ones dropped, and the rest joined with {@code ", "}. Storage order of multi-value
 * fields is not meaningful for change detection, only membership and content are.</p>
 *
 * <p>File lookups that fail degrade to a placeholder and are logged; they never abort the field.</p>
 */
public class FieldStringifier {
    private static final Logger log = LoggerFactory.getLogger(FieldStringifier.class);

    public static final String FILE_DELETED = "File (deleted)";
    public static final String FILE_ERROR = "File (error)";
    public static final String NESTED_PREFIX = "Paragraph ID: ";
    public static final String SEPARATOR = ", ";

    private static final DateTimeFormatter TIMESTAMP_PATTERN =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss", Locale.ROOT);

    private final Canonicalizer canonicalizer;
    private final FileResolver fileResolver;
    private final DateTimeFormatter timestampFormat;
    private final MetricsService metricsService;

    public FieldStringifier(Canonicalizer canonicalizer, FileResolver fileResolver, ZoneId zoneId) {
        this(canonicalizer, fileResolver, zoneId, new NoOpMetricsService());
    }

    public FieldStringifier(Canonicalizer canonicalizer, FileResolver fileResolver, ZoneId zoneId,
                            MetricsService metricsService) {
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer is required");
        this.fileResolver = Objects.requireNonNull(fileResolver, "fileResolver is required");
        this.timestampFormat = TIMESTAMP_PATTERN.withZone(Objects.requireNonNull(zoneId, "zoneId is required"));
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Renders every item of a field and joins the sorted, non-empty results.
     *
     * @param fieldType classification of the field
     * @param items     raw items in storage order, may be empty
     * @return the display string, empty when nothing renders
     */
    public String stringify(FieldType fieldType, List<Map<String, Object>> items) {
        if (items == null || items.isEmpty()) {
            return "";
        }
        List<String> rendered = new ArrayList<>(items.size());
        for (Map<String, Object> item : items) {
            String value = renderItem(fieldType, item);
            if (value != null && !value.isEmpty()) {
                rendered.add(value);
            }
        }
        rendered.sort(null);
        return String.join(SEPARATOR, rendered);
    }

    /**
     * Renders a single item. Returns null when the item contributes nothing.
     */
    String renderItem(FieldType fieldType, Map<String, Object> item) {
        return switch (fieldType) {
            case STRING, TEXT, TEXT_LONG, TEXT_WITH_SUMMARY -> ItemValues.text(item, ItemValues.VALUE).trim();
            case BOOLEAN -> ItemValues.isTruthy(item, ItemValues.VALUE) ? "Yes" : "No";
            case INTEGER, TIMESTAMP -> renderTimestamp(ItemValues.asLong(item, ItemValues.VALUE));
            case DECIMAL, FLOAT -> String.format(Locale.ROOT, "%.2f", ItemValues.asDouble(item, ItemValues.VALUE));
            case DATE -> ItemValues.text(item, ItemValues.VALUE);
            case LINK -> ItemValues.text(item, "uri") + " (" + ItemValues.text(item, "title") + ")";
            case COMMENT -> item != null && item.get("status") != null
                    ? ItemValues.text(item, "status")
                    : "0";
            case FILE, IMAGE -> renderFile(item);
            case NESTED_REFERENCE -> NESTED_PREFIX + ItemValues.text(item, NestedItemReference.TARGET_ID);
            case ENTITY_REFERENCE, OTHER -> canonicalizer.toJson(item);
        };
    }

    /**
     * Renders epoch seconds in the configured zone. Values outside the representable date range
     * render as the plain number.
     */
    private String renderTimestamp(long epochSeconds) {
        try {
            return timestampFormat.format(Instant.ofEpochSecond(epochSeconds));
        } catch (DateTimeException e) {
            log.debug("timestamp.out-of-range value={}", epochSeconds);
            return String.valueOf(epochSeconds);
        }
    }

    private String renderFile(Map<String, Object> item) {
        if (!ItemValues.isTruthy(item, NestedItemReference.TARGET_ID)) {
            return null;
        }
        String fileId = ItemValues.text(item, NestedItemReference.TARGET_ID);
        FileResolution resolution;
        try {
            resolution = fileResolver.resolveUrl(fileId);
        } catch (RuntimeException e) {
            resolution = FileResolution.failed(e.getMessage());
        }
        if (resolution == null) {
            resolution = FileResolution.missing();
        }
        return switch (resolution.status()) {
            case RESOLVED -> resolution.url();
            case MISSING -> FILE_DELETED;
            case FAILED -> {
                log.warn("file.resolve.failed fileId={} error={}", fileId, resolution.reason());
                metricsService.incrementResolutionFailure(MetricsService.FAILURE_FILE);
                yield FILE_ERROR;
            }
        };
    }
}
