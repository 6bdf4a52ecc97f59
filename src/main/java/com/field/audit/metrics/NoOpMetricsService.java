package com.field.audit.metrics;

import com.field.audit.core.model.FieldType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordDetectionDuration(String entityKind, Duration duration) {
    }

    @Override
    public void incrementChanges(String entityKind, FieldType fieldType) {
    }

    @Override
    public void incrementResolutionFailure(String kind) {
    }

    @Override
    public void incrementSinkFailure() {
    }
}
