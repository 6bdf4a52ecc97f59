package com.field.audit.nested;

import com.field.audit.core.model.NestedItem;
import com.field.audit.core.model.NestedItemReference;
import com.field.audit.metrics.MetricsService;
import com.field.audit.metrics.NoOpMetricsService;
import com.field.audit.source.NestedItemSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves nested item references against a {@link NestedItemSource}.
 * The exact revision is preferred; when it cannot be loaded the latest revision of the id is used.
 * Storage failures are logged and treated as a miss.
 */
public class NestedItemLoader {
    private static final Logger log = LoggerFactory.getLogger(NestedItemLoader.class);

    private final NestedItemSource source;
    private final MetricsService metricsService;

    public NestedItemLoader(NestedItemSource source) {
        this(source, new NoOpMetricsService());
    }

    public NestedItemLoader(NestedItemSource source, MetricsService metricsService) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Loads the item a reference points at, or empty when neither the revision nor the id resolves.
     */
    public Optional<NestedItem> load(NestedItemReference reference) {
        Optional<NestedItem> item = Optional.empty();

        if (reference.hasRevision()) {
            try {
                item = nullSafe(source.loadByRevision(reference.revisionId()));
            } catch (RuntimeException e) {
                log.warn("nested.load.revision.failed revisionId={} error={}",
                        reference.revisionId(), e.getMessage());
            }
        }

        if (item.isEmpty()) {
            try {
                item = nullSafe(source.loadLatest(reference.id()));
            } catch (RuntimeException e) {
                log.warn("nested.load.failed id={} error={}", reference.id(), e.getMessage());
            }
        }

        if (item.isEmpty()) {
            log.warn("nested.load.skipped id={} revisionId={}", reference.id(), reference.revisionId());
            metricsService.incrementResolutionFailure(MetricsService.FAILURE_NESTED);
        }
        return item;
    }

    private static Optional<NestedItem> nullSafe(Optional<NestedItem> result) {
        return result != null ? result : Optional.empty();
    }
}
