package com.field.audit.detect;

import com.field.audit.audit.LogSink;
import com.field.audit.core.model.ChangeEntry;
import com.field.audit.core.model.FieldDefinition;
import com.field.audit.core.model.FieldSummary;
import com.field.audit.core.model.FieldType;
import com.field.audit.core.model.NestedItemReference;
import com.field.audit.diff.DiffEngine;
import com.field.audit.logging.LogContext;
import com.field.audit.metrics.MetricsService;
import com.field.audit.metrics.NoOpMetricsService;
import com.field.audit.nested.NestedItemLoader;
import com.field.audit.nested.NestedSummaryBuilder;
import com.field.audit.rules.Canonicalizer;
import com.field.audit.rules.ValueNormalizer;
import com.field.audit.source.ActorContext;
import com.field.audit.source.FileResolver;
import com.field.audit.source.NestedItemSource;
import com.field.audit.source.RecordSource;
import com.field.audit.stringify.FieldStringifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Main entry point: compares two revisions of a record field by field and produces change entries.
 *
 * <p>Simple fields are rendered with {@link FieldStringifier} and compared after normalization.
 * Nested-composite fields are expanded into per-item summaries, matched by item id across the two
 * revisions, and classified as changed, deleted or added. Each changed field yields exactly one
 * {@link ChangeEntry}, however many sub-changes it contains.</p>
 *
 * <p>Every pass is stateless; the detector can be shared across threads. Failures resolving files
 * or nested items are logged and degrade to placeholders or skipped items.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ChangeDetector detector = ChangeDetector.builder()
 *     .nestedItemSource(paragraphs)
 *     .fileResolver(files)
 *     .logSink(changeLog)
 *     .actorContext(() -&gt; currentUser.id())
 *     .build();
 *
 * detector.logChanges(updatedRevision, originalRevision);
 * </pre>
 */
public class ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final ChangeDetectionConfig config;
    private final FieldStringifier stringifier;
    private final NestedSummaryBuilder summaryBuilder;
    private final NestedItemLoader itemLoader;
    private final DiffEngine diffEngine;
    private final LogSink logSink;
    private final ActorContext actorContext;
    private final Clock clock;
    private final MetricsService metricsService;

    private ChangeDetector(Builder builder) {
        this.config = builder.config;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        Canonicalizer canonicalizer = builder.canonicalizer != null ? builder.canonicalizer : new Canonicalizer();
        ValueNormalizer normalizer = new ValueNormalizer(canonicalizer);
        this.stringifier = new FieldStringifier(canonicalizer, builder.fileResolver, config.zoneId(), metricsService);
        this.summaryBuilder = new NestedSummaryBuilder(normalizer, canonicalizer, config.excludedNestedFields());
        this.itemLoader = new NestedItemLoader(builder.nestedItemSource, metricsService);
        this.diffEngine = new DiffEngine(normalizer);
        this.logSink = builder.logSink;
        this.actorContext = builder.actorContext;
        this.clock = builder.clock;
    }

    /**
     * Detects field-level changes between two revisions of the same record.
     * Nothing is written; see {@link #logChanges(RecordSource, RecordSource)}.
     *
     * @param updated  the new revision
     * @param original the revision before the update
     * @return one entry per materially changed field, empty when nothing differs
     */
    public List<ChangeEntry> detectChanges(RecordSource updated, RecordSource original) {
        Objects.requireNonNull(updated, "updated record is required");
        Objects.requireNonNull(original, "original record is required");

        long startNanos = System.nanoTime();
        try (LogContext ctx = LogContext.forDetection(
                updated.getEntityKind(), updated.getEntityId(), updated.getRevisionId())) {

            String actorId = actorContext.currentActorId();
            Instant timestamp = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            List<ChangeEntry> entries = new ArrayList<>();

            for (String fieldName : updated.listFieldNames()) {
                if (config.excludedFields().contains(fieldName) || !updated.hasField(fieldName)) {
                    continue;
                }
                Optional<FieldDefinition> definition = updated.getFieldDefinition(fieldName);
                if (definition.isEmpty()) {
                    log.debug("field.skipped field={} reason=no-definition", fieldName);
                    continue;
                }

                FieldType type = definition.get().type();
                Optional<String> diff = type == FieldType.NESTED_REFERENCE
                        ? diffNestedField(updated, original, fieldName)
                        : diffSimpleField(updated, original, fieldName, type);

                diff.ifPresent(text -> {
                    entries.add(ChangeEntry.builder()
                            .entityKind(updated.getEntityKind())
                            .entityId(updated.getEntityId())
                            .revisionId(updated.getRevisionId())
                            .fieldLabel(definition.get().label())
                            .diffText(text)
                            .timestamp(timestamp)
                            .actorId(actorId)
                            .build());
                    metricsService.incrementChanges(updated.getEntityKind(), type);
                });
            }

            metricsService.recordDetectionDuration(updated.getEntityKind(),
                    Duration.ofNanos(System.nanoTime() - startNanos));
            return List.copyOf(entries);
        }
    }

    /**
     * Detects changes and appends every resulting entry to the log sink.
     * Sink failures are logged and counted; they do not stop the remaining entries.
     *
     * @return the detected entries, whether or not the sink accepted them
     */
    public List<ChangeEntry> logChanges(RecordSource updated, RecordSource original) {
        List<ChangeEntry> entries = detectChanges(updated, original);
        for (ChangeEntry entry : entries) {
            boolean stored;
            try {
                stored = logSink.append(entry);
            } catch (RuntimeException e) {
                log.warn("field-audit.append.failed field='{}' error={}", entry.fieldLabel(), e.getMessage());
                stored = false;
            }
            if (!stored) {
                log.warn("field-audit.append.rejected entityKind={} entityId={} field='{}'",
                        entry.entityKind(), entry.entityId(), entry.fieldLabel());
                metricsService.incrementSinkFailure();
            }
        }

        if (entries.isEmpty()) {
            log.debug("field-audit.unchanged entityKind={} entityId={} revisionId={}",
                    updated.getEntityKind(), updated.getEntityId(), updated.getRevisionId());
        } else {
            log.info("field-audit.logged entityKind={} entityId={} revisionId={} entries={}",
                    updated.getEntityKind(), updated.getEntityId(), updated.getRevisionId(), entries.size());
        }
        return entries;
    }

    private Optional<String> diffSimpleField(RecordSource updated, RecordSource original,
                                             String fieldName, FieldType type) {
        String originalValue = original.hasField(fieldName)
                ? stringifier.stringify(type, original.getFieldValue(fieldName))
                : "";
        String newValue = stringifier.stringify(type, updated.getFieldValue(fieldName));
        return diffEngine.diff(originalValue, newValue);
    }

    private Optional<String> diffNestedField(RecordSource updated, RecordSource original, String fieldName) {
        Map<String, FieldSummary> originalSummaries = original.hasField(fieldName)
                ? summarize(original.getFieldValue(fieldName))
                : Map.of();
        Map<String, FieldSummary> newSummaries = summarize(updated.getFieldValue(fieldName));

        List<String> blocks = new ArrayList<>();

        // Items present in both revisions: compare sub-field by sub-field.
        for (Map.Entry<String, FieldSummary> entry : newSummaries.entrySet()) {
            FieldSummary before = originalSummaries.get(entry.getKey());
            if (before == null) {
                continue;
            }
            FieldSummary after = entry.getValue();
            SortedSet<String> subFields = new TreeSet<>(before.values().keySet());
            subFields.addAll(after.values().keySet());
            for (String subField : subFields) {
                String label = after.hasLabel(subField) ? after.labelOf(subField) : before.labelOf(subField);
                diffEngine.diff(before.valueOf(subField), after.valueOf(subField))
                        .ifPresent(d -> blocks.add(
                                "Paragraph ID " + entry.getKey() + ", Field " + label + ":\n" + d));
            }
        }

        for (String id : originalSummaries.keySet()) {
            if (!newSummaries.containsKey(id)) {
                blocks.add("Paragraph ID " + id + ": Deleted");
            }
        }

        for (Map.Entry<String, FieldSummary> entry : newSummaries.entrySet()) {
            if (!originalSummaries.containsKey(entry.getKey())) {
                FieldSummary added = entry.getValue();
                String header = "Paragraph ID " + entry.getKey() + ": Added";
                blocks.add(added.isEmpty() ? header : header + "\n" + added.toLines());
            }
        }

        return blocks.isEmpty() ? Optional.empty() : Optional.of(String.join("\n\n", blocks));
    }

    /**
     * Loads and summarizes every referenced nested item, keyed by item id in field order.
     */
    private Map<String, FieldSummary> summarize(List<Map<String, Object>> items) {
        Map<String, FieldSummary> summaries = new LinkedHashMap<>();
        for (Map<String, Object> item : items) {
            NestedItemReference.fromItem(item).ifPresent(reference ->
                    itemLoader.load(reference).ifPresent(nested ->
                            summaries.put(reference.id(), summaryBuilder.summarize(nested))));
        }
        return summaries;
    }

    public ChangeDetectionConfig getConfig() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ChangeDetectionConfig config = ChangeDetectionConfig.defaults();
        private NestedItemSource nestedItemSource;
        private FileResolver fileResolver;
        private LogSink logSink;
        private ActorContext actorContext;
        private Clock clock = Clock.systemUTC();
        private MetricsService metricsService;
        private Canonicalizer canonicalizer;

        /**
         * Sets exclusions and rendering options. Defaults to {@link ChangeDetectionConfig#defaults()}.
         */
        public Builder config(ChangeDetectionConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the source nested items are loaded from.
         */
        public Builder nestedItemSource(NestedItemSource nestedItemSource) {
            this.nestedItemSource = nestedItemSource;
            return this;
        }

        /**
         * Sets the resolver used to render file and image references.
         */
        public Builder fileResolver(FileResolver fileResolver) {
            this.fileResolver = fileResolver;
            return this;
        }

        /**
         * Sets the sink change entries are appended to by {@link ChangeDetector#logChanges}.
         */
        public Builder logSink(LogSink logSink) {
            this.logSink = logSink;
            return this;
        }

        public Builder actorContext(ActorContext actorContext) {
            this.actorContext = actorContext;
            return this;
        }

        /**
         * Sets the clock entries are timestamped with. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets a custom metrics service.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets the canonicalizer used for JSON comparison encoding.
         */
        public Builder canonicalizer(Canonicalizer canonicalizer) {
            this.canonicalizer = canonicalizer;
            return this;
        }

        public ChangeDetector build() {
            if (config == null) {
                throw new IllegalStateException("ChangeDetectionConfig is required");
            }
            if (nestedItemSource == null) {
                throw new IllegalStateException("NestedItemSource is required");
            }
            if (fileResolver == null) {
                throw new IllegalStateException("FileResolver is required");
            }
            if (logSink == null) {
                throw new IllegalStateException("LogSink is required");
            }
            if (actorContext == null) {
                throw new IllegalStateException("ActorContext is required");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            return new ChangeDetector(this);
        }
    }
}
