package com.field.audit.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one changed field on one revision of a record.
 * This is the unit appended to the change log; it is never updated afterwards.
 */
public record ChangeEntry(
        String entityKind,
        String entityId,
        String revisionId,
        String fieldLabel,
        String diffText,
        Instant timestamp,
        String actorId
) {
    public ChangeEntry {
        Objects.requireNonNull(entityKind, "entityKind is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(fieldLabel, "fieldLabel is required");
        Objects.requireNonNull(diffText, "diffText is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (diffText.isEmpty()) {
            throw new IllegalArgumentException("diffText must not be empty");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityKind;
        private String entityId;
        private String revisionId;
        private String fieldLabel;
        private String diffText;
        private Instant timestamp;
        private String actorId;

        public Builder entityKind(String entityKind) {
            this.entityKind = entityKind;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder revisionId(String revisionId) {
            this.revisionId = revisionId;
            return this;
        }

        public Builder fieldLabel(String fieldLabel) {
            this.fieldLabel = fieldLabel;
            return this;
        }

        public Builder diffText(String diffText) {
            this.diffText = diffText;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public ChangeEntry build() {
            return new ChangeEntry(entityKind, entityId, revisionId, fieldLabel, diffText, timestamp, actorId);
        }
    }
}
