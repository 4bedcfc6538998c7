package com.registry.reconciliation.core.model;

/**
 * Kind of difference detected for one identifier between two snapshots.
 */
public enum ChangeKind {
    NEW_ENTITY("New Incorporation"),
    REMOVED_ENTITY("Deregistration"),
    FIELD_UPDATED("Field Update");

    private final String label;

    ChangeKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
