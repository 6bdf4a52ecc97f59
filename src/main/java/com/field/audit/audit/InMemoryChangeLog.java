package com.field.audit.audit;

import com.field.audit.core.model.ChangeEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link LogSink}.
 * Thread-safe via CopyOnWriteArrayList. Entries are never updated or removed.
 */
public class InMemoryChangeLog implements LogSink {

    private final List<ChangeEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public boolean append(ChangeEntry entry) {
        if (entry == null) {
            return false;
        }
        entries.add(entry);
        return true;
    }

    /**
     * Gets all entries in append order (immutable view).
     */
    public List<ChangeEntry> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * Gets the entries recorded for one record.
     */
    public List<ChangeEntry> findByEntity(String entityKind, String entityId) {
        return entries.stream()
                .filter(e -> entityKind.equals(e.entityKind()) && entityId.equals(e.entityId()))
                .collect(Collectors.toList());
    }

    public int count() {
        return entries.size();
    }
}
