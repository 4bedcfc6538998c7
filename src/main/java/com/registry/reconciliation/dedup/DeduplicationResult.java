package com.registry.reconciliation.dedup;

import com.registry.reconciliation.core.model.CanonicalRecord;

import java.util.List;

/**
 * Outcome of collapsing the rows of one identifier.
 *
 * @param record    the winning record, attributes taken wholesale from one row
 * @param collapsed number of losing rows
 * @param conflicts identity disagreements observed among the rows
 */
public record DeduplicationResult(
        CanonicalRecord record,
        int collapsed,
        List<IdentityConflict> conflicts
) {
    public DeduplicationResult {
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
