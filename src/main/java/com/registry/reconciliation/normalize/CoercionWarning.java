package com.registry.reconciliation.normalize;

import com.registry.reconciliation.core.model.CanonicalField;

/**
 * Soft warning raised when a raw value cannot be coerced to its field's type.
 * The field is stored as absent and the row is kept.
 *
 * @param sourceTag  source batch the row came from
 * @param identifier identifier of the row, may be null
 * @param field      canonical field being populated
 * @param column     source column (or {@code "<constant>"}) the raw value came from
 * @param rawValue   offending raw text
 * @param reason     short description of the failure
 */
public record CoercionWarning(
        String sourceTag,
        String identifier,
        CanonicalField field,
        String column,
        String rawValue,
        String reason
) {
    @Override
    public String toString() {
        return sourceTag + ":" + identifier + " " + field + " <- " + column
                + "='" + rawValue + "' (" + reason + ")";
    }
}
