package com.registry.reconciliation.diff;

import com.registry.reconciliation.core.model.CanonicalField;

/**
 * One differing field between two versions of a record. Either value may be null (absent).
 */
public record FieldDifference(CanonicalField field, Object oldValue, Object newValue) {

    public boolean isAddition() {
        return oldValue == null;
    }

    public boolean isRemoval() {
        return newValue == null;
    }
}
