package com.field.audit.audit;

import com.field.audit.core.model.ChangeEntry;

/**
 * Append-only destination for change entries.
 * Implementations provide their own storage backend and atomicity guarantees.
 */
@FunctionalInterface
public interface LogSink {

    /**
     * Appends an entry.
     *
     * @return true when the entry was stored
     */
    boolean append(ChangeEntry entry);
}
