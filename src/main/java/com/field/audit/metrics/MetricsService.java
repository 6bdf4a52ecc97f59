package com.field.audit.metrics;

import com.field.audit.core.model.FieldType;

import java.time.Duration;

/**
 * Interface for recording change-detection metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    String FAILURE_FILE = "file";
    String FAILURE_NESTED = "nested";

    void recordDetectionDuration(String entityKind, Duration duration);

    void incrementChanges(String entityKind, FieldType fieldType);

    /**
     * Counts a reference that could not be resolved; {@code kind} is {@link #FAILURE_FILE} or {@link #FAILURE_NESTED}.
     */
    void incrementResolutionFailure(String kind);

    void incrementSinkFailure();
}
