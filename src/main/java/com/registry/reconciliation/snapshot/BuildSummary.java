package com.registry.reconciliation.snapshot;

import com.registry.reconciliation.dedup.IdentityConflict;
import com.registry.reconciliation.normalize.CoercionWarning;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters and non-fatal findings of one snapshot build.
 *
 * @param recordsIn                total raw rows across all batches
 * @param recordsMissingIdentifier rows dropped because no identifier column held a value
 * @param duplicatesCollapsed      rows that lost to another row with the same identifier
 * @param canonicalRecords         records in the built snapshot
 * @param recordsPerSource         raw rows per source tag, in batch order
 * @param coercionWarnings         values stored as absent because they could not be coerced
 * @param conflicts                identity-field disagreements among duplicates
 * @param mappingWarnings          mapped fields none of whose columns occur in a source
 * @param duration                 wall-clock time of the build
 */
public record BuildSummary(
        long recordsIn,
        long recordsMissingIdentifier,
        long duplicatesCollapsed,
        int canonicalRecords,
        Map<String, Long> recordsPerSource,
        List<CoercionWarning> coercionWarnings,
        List<IdentityConflict> conflicts,
        List<String> mappingWarnings,
        Duration duration
) {
    public BuildSummary {
        recordsPerSource = recordsPerSource != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(recordsPerSource)) : Map.of();
        coercionWarnings = coercionWarnings != null ? List.copyOf(coercionWarnings) : List.of();
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        mappingWarnings = mappingWarnings != null ? List.copyOf(mappingWarnings) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    /**
     * Data-quality findings of the build: dropped rows without identifier, coercion failures,
     * identity conflicts and mapping gaps.
     */
    public long warningCount() {
        return recordsMissingIdentifier + coercionWarnings.size() + conflicts.size() + mappingWarnings.size();
    }

    public boolean hasWarnings() {
        return warningCount() > 0;
    }

    @Override
    public String toString() {
        return "BuildSummary{in=" + recordsIn +
                ", missingId=" + recordsMissingIdentifier +
                ", collapsed=" + duplicatesCollapsed +
                ", canonical=" + canonicalRecords +
                ", coercionWarnings=" + coercionWarnings.size() +
                ", conflicts=" + conflicts.size() +
                ", mappingWarnings=" + mappingWarnings.size() +
                ", durationMs=" + duration.toMillis() + '}';
    }
}
