package com.field.audit.source;

import com.field.audit.core.model.NestedItem;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of nested item revisions.
 * The most recently added revision of an id is its latest revision.
 * Thread-safe via ConcurrentHashMap.
 */
public class InMemoryNestedItemSource implements NestedItemSource {

    private final Map<String, NestedItem> byRevision = new ConcurrentHashMap<>();
    private final Map<String, NestedItem> latest = new ConcurrentHashMap<>();

    /**
     * Stores a revision and marks it as the latest for its id.
     */
    public InMemoryNestedItemSource add(NestedItem item) {
        item.getRevisionId().ifPresent(rev -> byRevision.put(rev, item));
        latest.put(item.getId(), item);
        return this;
    }

    @Override
    public Optional<NestedItem> loadByRevision(String revisionId) {
        return Optional.ofNullable(byRevision.get(revisionId));
    }

    @Override
    public Optional<NestedItem> loadLatest(String id) {
        return Optional.ofNullable(latest.get(id));
    }
}
