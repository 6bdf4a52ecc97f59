package com.field.audit.diff;

import com.field.audit.rules.ValueNormalizer;

import java.util.Objects;
import java.util.Optional;

/**
 * Produces a textual diff descriptor for two rendered values.
 * Materiality is judged on normalized values only, so cosmetic edits never yield a diff.
 */
public class DiffEngine {

    private final ValueNormalizer normalizer;

    public DiffEngine(ValueNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    /**
     * Returns {@code "Changed from: <original>\nTo: <updated>"} built from the normalized values,
     * or empty when they normalize identically.
     */
    public Optional<String> diff(String original, String updated) {
        String from = normalizer.normalize(original);
        String to = normalizer.normalize(updated);
        if (from.equals(to)) {
            return Optional.empty();
        }
        return Optional.of("Changed from: " + from + "\nTo: " + to);
    }

    /**
     * Whether the two values differ once normalized.
     */
    public boolean isMaterial(String original, String updated) {
        return !normalizer.areEquivalent(original, updated);
    }
}
