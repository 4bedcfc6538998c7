package com.registry.reconciliation.diff;

import com.registry.reconciliation.core.AttributeValues;
import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.CanonicalRecord;
import com.registry.reconciliation.core.model.ChangeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides what happened to one identifier between two snapshots.
 *
 * <p>Values are compared exactly: two absent values are equal, absent never equals present,
 * strings and dates compare by value, numbers by numeric value with no tolerance.</p>
 */
public class ChangeClassifier {

    /**
     * Classifies one identifier. Either side may be null when the identifier is missing from
     * that snapshot, but not both.
     *
     * @return the change and, for an update, its differing fields; empty when the record is unchanged
     */
    public Optional<Classification> classify(CanonicalRecord baseline, CanonicalRecord current) {
        if (baseline == null && current == null) {
            throw new IllegalArgumentException("at least one side is required");
        }
        if (baseline == null) {
            return Optional.of(new Classification(ChangeKind.NEW_ENTITY, List.of()));
        }
        if (current == null) {
            return Optional.of(new Classification(ChangeKind.REMOVED_ENTITY, List.of()));
        }
        List<FieldDifference> differences = compare(baseline, current);
        return differences.isEmpty()
                ? Optional.empty()
                : Optional.of(new Classification(ChangeKind.FIELD_UPDATED, differences));
    }

    /**
     * Compares every canonical field of two versions of the same record.
     *
     * @return differing fields in canonical field order; empty when the versions are equal
     */
    public List<FieldDifference> compare(CanonicalRecord baseline, CanonicalRecord current) {
        if (!baseline.identifier().equals(current.identifier())) {
            throw new IllegalArgumentException("cannot compare " + baseline.identifier()
                    + " with " + current.identifier());
        }
        List<FieldDifference> differences = new ArrayList<>();
        for (CanonicalField field : CanonicalField.values()) {
            Object oldValue = baseline.get(field);
            Object newValue = current.get(field);
            if (!AttributeValues.equal(oldValue, newValue)) {
                differences.add(new FieldDifference(field, oldValue, newValue));
            }
        }
        return differences;
    }

    /**
     * What happened to one identifier. Differences are listed only for {@link ChangeKind#FIELD_UPDATED}.
     */
    public record Classification(ChangeKind kind, List<FieldDifference> differences) {
        public Classification {
            differences = List.copyOf(differences);
        }
    }
}
