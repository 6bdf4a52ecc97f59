package com.field.audit.cdi;

import com.field.audit.audit.LogSink;
import com.field.audit.detect.ChangeDetectionConfig;
import com.field.audit.detect.ChangeDetector;
import com.field.audit.metrics.MetricsService;
import com.field.audit.metrics.MicrometerMetricsService;
import com.field.audit.metrics.NoOpMetricsService;
import com.field.audit.source.ActorContext;
import com.field.audit.source.FileResolver;
import com.field.audit.source.NestedItemSource;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * CDI producer that wires the change detector from MicroProfile Config properties.
 *
 * <p>The host application supplies the collaborators the detector reads from and writes to:
 * {@link NestedItemSource}, {@link FileResolver}, {@link LogSink} and {@link ActorContext}.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * field-audit:
 *   excluded-fields: vid,changed,uid,created,path
 *   excluded-nested-fields: revision_id,parent_id,parent_type
 *   zone-id: Europe/Paris
 *   nested-target-kind: paragraph
 *   metrics:
 *     enabled: true
 * </pre>
 */
@ApplicationScoped
public class FieldAuditProducer {

    private static final Logger log = LoggerFactory.getLogger(FieldAuditProducer.class);

    @Inject
    @ConfigProperty(name = "field-audit.excluded-fields")
    Optional<List<String>> excludedFields;

    @Inject
    @ConfigProperty(name = "field-audit.excluded-nested-fields")
    Optional<List<String>> excludedNestedFields;

    @Inject
    @ConfigProperty(name = "field-audit.zone-id")
    Optional<String> zoneId;

    @Inject
    @ConfigProperty(name = "field-audit.nested-target-kind",
            defaultValue = ChangeDetectionConfig.DEFAULT_NESTED_TARGET_KIND)
    String nestedTargetKind;

    @Inject
    @ConfigProperty(name = "field-audit.metrics.enabled", defaultValue = "false")
    boolean metricsEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Produces
    @Singleton
    public ChangeDetectionConfig changeDetectionConfig() {
        ChangeDetectionConfig config = new ChangeDetectionConfig(
                excludedFields.<Set<String>>map(Set::copyOf).orElse(ChangeDetectionConfig.DEFAULT_EXCLUDED_FIELDS),
                excludedNestedFields.<Set<String>>map(Set::copyOf)
                        .orElse(ChangeDetectionConfig.DEFAULT_EXCLUDED_NESTED_FIELDS),
                zoneId.filter(z -> !z.isBlank()).map(ZoneId::of).orElseGet(ZoneId::systemDefault),
                nestedTargetKind);
        log.info("Field audit config: excludedFields={} excludedNestedFields={} zone={} nestedKind={}",
                config.excludedFields().size(), config.excludedNestedFields().size(),
                config.zoneId(), config.nestedTargetKind());
        return config;
    }

    @Produces
    @Singleton
    public MetricsService metricsService() {
        if (metricsEnabled && meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Field audit metrics enabled");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        if (metricsEnabled) {
            log.warn("Field audit metrics enabled but no MeterRegistry is available, falling back to NoOp");
        }
        return new NoOpMetricsService();
    }

    @Produces
    @Singleton
    public ChangeDetector changeDetector(ChangeDetectionConfig config,
                                         MetricsService metricsService,
                                         NestedItemSource nestedItemSource,
                                         FileResolver fileResolver,
                                         LogSink logSink,
                                         ActorContext actorContext) {
        log.info("Producing ChangeDetector");
        return ChangeDetector.builder()
                .config(config)
                .metricsService(metricsService)
                .nestedItemSource(nestedItemSource)
                .fileResolver(fileResolver)
                .logSink(logSink)
                .actorContext(actorContext)
                .build();
    }
}
