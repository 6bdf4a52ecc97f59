package com.field.audit.detect;

import com.field.audit.core.model.FieldType;

import java.time.ZoneId;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration for change detection.
 *
 * @param excludedFields       record fields never compared (revision metadata, audit timestamps, ownership, path alias)
 * @param excludedNestedFields nested item sub-fields left out of summaries (identity, parent linkage, administrative)
 * @param zoneId               zone used to render integer and timestamp values
 * @param nestedTargetKind     entity kind treated as a nested composite when classifying host field types
 */
public record ChangeDetectionConfig(
        Set<String> excludedFields,
        Set<String> excludedNestedFields,
        ZoneId zoneId,
        String nestedTargetKind
) {

    public static final Set<String> DEFAULT_EXCLUDED_FIELDS = Set.of(
            "vid",
            "revision_timestamp",
            "changed",
            "revision_uid",
            "uid",
            "created",
            "path",
            "comment",
            "revision_translation_affected"
    );

    public static final Set<String> DEFAULT_EXCLUDED_NESTED_FIELDS = Set.of(
            "revision_id",
            "parent_id",
            "parent_type",
            "parent_field_name",
            "default_langcode",
            "behavior_settings",
            "created",
            "langcode",
            "revision_default",
            "status"
    );

    public static final String DEFAULT_NESTED_TARGET_KIND = "paragraph";

    public ChangeDetectionConfig {
        excludedFields = excludedFields != null ? Set.copyOf(excludedFields) : Set.of();
        excludedNestedFields = excludedNestedFields != null ? Set.copyOf(excludedNestedFields) : Set.of();
        Objects.requireNonNull(zoneId, "zoneId is required");
        if (nestedTargetKind == null || nestedTargetKind.isBlank()) {
            throw new IllegalArgumentException("nestedTargetKind must not be blank");
        }
    }

    /**
     * Default configuration: standard exclusions, system zone, {@code paragraph} as the nested kind.
     */
    public static ChangeDetectionConfig defaults() {
        return new ChangeDetectionConfig(DEFAULT_EXCLUDED_FIELDS, DEFAULT_EXCLUDED_NESTED_FIELDS,
                ZoneId.systemDefault(), DEFAULT_NESTED_TARGET_KIND);
    }

    /**
     * Copy of this configuration rendering timestamps in the given zone.
     */
    public ChangeDetectionConfig withZoneId(ZoneId zone) {
        return new ChangeDetectionConfig(excludedFields, excludedNestedFields, zone, nestedTargetKind);
    }

    /**
     * Maps a host machine type name onto a {@link FieldType} using this configuration's nested kind.
     */
    public FieldType classify(String machineName, String targetKind) {
        return FieldType.fromMachineName(machineName, targetKind, nestedTargetKind);
    }
}
