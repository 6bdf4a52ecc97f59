package com.field.audit.source;

import com.field.audit.core.model.NestedItem;

import java.util.Optional;

/**
 * Loads nested items by exact revision or by latest revision.
 * Implementations may throw runtime exceptions on storage failures; callers treat those as a miss.
 */
public interface NestedItemSource {

    Optional<NestedItem> loadByRevision(String revisionId);

    Optional<NestedItem> loadLatest(String id);
}
