package com.registry.reconciliation.core.model;

import com.registry.reconciliation.core.AttributeValues;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One corporate entity at a point in time.
 * A field missing from {@code attributes} is absent; null values are never stored.
 *
 * @param identifier canonical identifier (registration number), the join key across sources and time
 * @param attributes canonical field to present value
 * @param sourceTag  origin batch that produced this version
 */
public record CanonicalRecord(
        String identifier,
        Map<CanonicalField, Object> attributes,
        String sourceTag
) {
    public CanonicalRecord {
        Objects.requireNonNull(identifier, "identifier is required");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
        EnumMap<CanonicalField, Object> copy = new EnumMap<>(CanonicalField.class);
        if (attributes != null) {
            attributes.forEach((field, value) -> {
                Object canonical = AttributeValues.canonicalize(field, value);
                if (canonical != null) {
                    copy.put(field, canonical);
                }
            });
        }
        attributes = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the raw attribute value, or null when absent.
     */
    public Object get(CanonicalField field) {
        return attributes.get(field);
    }

    public Optional<Object> find(CanonicalField field) {
        return Optional.ofNullable(attributes.get(field));
    }

    public boolean isPresent(CanonicalField field) {
        return attributes.containsKey(field);
    }

    /**
     * Number of canonical fields this record does not carry.
     */
    public int absentFieldCount() {
        return CanonicalField.values().length - attributes.size();
    }

    /**
     * Convenience accessor for display: renders a field as text, empty when absent.
     */
    public String display(CanonicalField field) {
        return AttributeValues.render(attributes.get(field));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String identifier;
        private final Map<CanonicalField, Object> attributes = new EnumMap<>(CanonicalField.class);
        private String sourceTag;

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder attribute(CanonicalField field, Object value) {
            if (value == null) {
                attributes.remove(field);
            } else {
                attributes.put(field, value);
            }
            return this;
        }

        public Builder attributes(Map<CanonicalField, ?> values) {
            values.forEach(this::attribute);
            return this;
        }

        public Builder sourceTag(String sourceTag) {
            this.sourceTag = sourceTag;
            return this;
        }

        public CanonicalRecord build() {
            return new CanonicalRecord(identifier, attributes, sourceTag);
        }
    }
}
