package com.registry.reconciliation.dedup;

/**
 * Thrown in strict mode when duplicates of one identifier disagree on an identity-defining field.
 */
public class DuplicateIdentifierConflictException extends RuntimeException {

    private final transient IdentityConflict conflict;

    public DuplicateIdentifierConflictException(IdentityConflict conflict) {
        super("Conflicting duplicate identifier " + conflict.describe());
        this.conflict = conflict;
    }

    public IdentityConflict getConflict() {
        return conflict;
    }
}
