package com.field.audit.metrics;

import com.field.audit.core.model.FieldType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code field.audit.detection.duration} Timer (tag: entityKind)</li>
 *   <li>{@code field.audit.changes} Counter (tags: entityKind, fieldType)</li>
 *   <li>{@code field.audit.resolution.failure} Counter (tag: kind)</li>
 *   <li>{@code field.audit.sink.failure} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter sinkFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.sinkFailureCounter = Counter.builder("field.audit.sink.failure")
                .description("Number of change entries the log sink failed to append")
                .register(registry);
    }

    @Override
    public void recordDetectionDuration(String entityKind, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(entityKind, k ->
                Timer.builder("field.audit.detection.duration")
                        .description("Duration of change detection passes")
                        .tag("entityKind", entityKind)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementChanges(String entityKind, FieldType fieldType) {
        String key = "changes:" + entityKind + ":" + fieldType.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("field.audit.changes")
                        .description("Number of change entries produced")
                        .tag("entityKind", entityKind)
                        .tag("fieldType", fieldType.getMachineName())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementResolutionFailure(String kind) {
        String key = "failure:" + kind;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("field.audit.resolution.failure")
                        .description("Number of file or nested item references that could not be resolved")
                        .tag("kind", kind)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementSinkFailure() {
        sinkFailureCounter.increment();
    }
}
