package com.registry.reconciliation.dedup;

import com.registry.reconciliation.core.AttributeValues;
import com.registry.reconciliation.core.model.CanonicalField;

/**
 * Two rows of one identifier disagreeing on an identity-defining field.
 */
public record IdentityConflict(
        String identifier,
        CanonicalField field,
        Object firstValue,
        String firstSource,
        Object secondValue,
        String secondSource
) {
    public String describe() {
        return identifier + "." + field + ": '" + AttributeValues.render(firstValue) + "' (" + firstSource
                + ") vs '" + AttributeValues.render(secondValue) + "' (" + secondSource + ")";
    }
}
