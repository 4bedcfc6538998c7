package com.registry.reconciliation.snapshot;

import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.CanonicalRecord;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary figures of one snapshot: totals by state and status and the registration date range.
 * Records without a state or status are counted under {@link #UNKNOWN}.
 */
public record SnapshotStatistics(
        LocalDate asOf,
        int totalRecords,
        Map<String, Long> byState,
        Map<String, Long> byStatus,
        LocalDate earliestRegistration,
        LocalDate latestRegistration
) {
    public static final String UNKNOWN = "UNKNOWN";

    public SnapshotStatistics {
        byState = byState != null ? Collections.unmodifiableMap(new TreeMap<>(byState)) : Map.of();
        byStatus = byStatus != null ? Collections.unmodifiableMap(new TreeMap<>(byStatus)) : Map.of();
    }

    public static SnapshotStatistics of(Snapshot snapshot) {
        Map<String, Long> byState = new TreeMap<>();
        Map<String, Long> byStatus = new TreeMap<>();
        LocalDate earliest = null;
        LocalDate latest = null;

        for (CanonicalRecord record : snapshot.records()) {
            byState.merge(labelOf(record, CanonicalField.STATE), 1L, Long::sum);
            byStatus.merge(labelOf(record, CanonicalField.STATUS), 1L, Long::sum);
            if (record.get(CanonicalField.REGISTRATION_DATE) instanceof LocalDate date) {
                if (earliest == null || date.isBefore(earliest)) {
                    earliest = date;
                }
                if (latest == null || date.isAfter(latest)) {
                    latest = date;
                }
            }
        }
        return new SnapshotStatistics(snapshot.getAsOf(), snapshot.size(), byState, byStatus, earliest, latest);
    }

    private static String labelOf(CanonicalRecord record, CanonicalField field) {
        return record.isPresent(field) ? record.display(field) : UNKNOWN;
    }
}
