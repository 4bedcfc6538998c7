package com.registry.reconciliation.normalize;

import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.CanonicalRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of normalizing one raw row.
 *
 * @param identifier canonical identifier, or null when the row carries none
 * @param attributes present canonical values
 * @param sourceTag  source batch the row came from
 * @param lineNumber position of the row within its source
 * @param warnings   coercion warnings raised for this row
 */
public record NormalizedRecord(
        String identifier,
        Map<CanonicalField, Object> attributes,
        String sourceTag,
        long lineNumber,
        List<CoercionWarning> warnings
) {
    public NormalizedRecord {
        EnumMap<CanonicalField, Object> copy = new EnumMap<>(CanonicalField.class);
        if (attributes != null) {
            copy.putAll(attributes);
        }
        attributes = Collections.unmodifiableMap(copy);
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean hasIdentifier() {
        return identifier != null;
    }

    public int absentFieldCount() {
        return CanonicalField.values().length - attributes.size();
    }

    /**
     * Converts this row into a canonical record, taking the attributes wholesale.
     */
    public CanonicalRecord toCanonical() {
        return new CanonicalRecord(identifier, attributes, sourceTag);
    }
}
