package com.field.audit.source;

/**
 * One revision of a parent record whose field changes are tracked.
 * Supplied by the host entity system; never mutated by the auditor.
 */
public interface RecordSource extends FieldSource {

    /**
     * Kind of the record, e.g. {@code node}.
     */
    String getEntityKind();

    String getEntityId();

    /**
     * Identifier of the revision this snapshot represents.
     */
    String getRevisionId();
}
