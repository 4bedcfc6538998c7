package com.registry.reconciliation.core.model;

import com.registry.reconciliation.core.AttributeValues;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Immutable record of one difference between two snapshots for one identifier.
 * Events are created only by the snapshot differ.
 *
 * <p>{@code field}, {@code oldValue} and {@code newValue} are only set for
 * {@link ChangeKind#FIELD_UPDATED}; either value may be null there (absent), but never both,
 * and the two values are never equal. {@code companyName}, {@code state} and {@code status}
 * are denormalized display attributes and may be null.</p>
 */
public record ChangeEvent(
        String identifier,
        ChangeKind kind,
        LocalDate timestamp,
        CanonicalField field,
        Object oldValue,
        Object newValue,
        String companyName,
        String state,
        String status
) {
    public ChangeEvent {
        Objects.requireNonNull(identifier, "identifier is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (kind == ChangeKind.FIELD_UPDATED) {
            Objects.requireNonNull(field, "field is required for FIELD_UPDATED");
            oldValue = AttributeValues.canonicalize(field, oldValue);
            newValue = AttributeValues.canonicalize(field, newValue);
            if (AttributeValues.equal(oldValue, newValue)) {
                throw new IllegalArgumentException("FIELD_UPDATED requires differing values for "
                        + identifier + "." + field);
            }
        } else if (field != null || oldValue != null || newValue != null) {
            throw new IllegalArgumentException(kind + " carries no field or values");
        }
    }

    public boolean isFieldUpdate() {
        return kind == ChangeKind.FIELD_UPDATED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String identifier;
        private ChangeKind kind;
        private LocalDate timestamp;
        private CanonicalField field;
        private Object oldValue;
        private Object newValue;
        private String companyName;
        private String state;
        private String status;

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder kind(ChangeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder timestamp(LocalDate timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder field(CanonicalField field) {
            this.field = field;
            return this;
        }

        public Builder oldValue(Object oldValue) {
            this.oldValue = oldValue;
            return this;
        }

        public Builder newValue(Object newValue) {
            this.newValue = newValue;
            return this;
        }

        /**
         * Copies name, state and status from the given record for display.
         */
        public Builder displayFrom(CanonicalRecord record) {
            this.companyName = asText(record.get(CanonicalField.NAME));
            this.state = asText(record.get(CanonicalField.STATE));
            this.status = asText(record.get(CanonicalField.STATUS));
            return this;
        }

        public Builder companyName(String companyName) {
            this.companyName = companyName;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public ChangeEvent build() {
            return new ChangeEvent(identifier, kind, timestamp, field, oldValue, newValue,
                    companyName, state, status);
        }

        private static String asText(Object value) {
            return value != null ? AttributeValues.render(value) : null;
        }
    }
}
