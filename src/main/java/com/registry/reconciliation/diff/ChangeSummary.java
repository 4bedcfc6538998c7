package com.registry.reconciliation.diff;

import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.ChangeEvent;
import com.registry.reconciliation.core.model.ChangeKind;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate figures over a set of change events.
 *
 * @param totalChanges number of events
 * @param byKind       events per kind
 * @param byField      field updates per field
 * @param byState      events per display state; events without a state count under {@code UNKNOWN}
 * @param earliest     earliest event date, null when there are no events
 * @param latest       latest event date, null when there are no events
 */
public record ChangeSummary(
        long totalChanges,
        Map<ChangeKind, Long> byKind,
        Map<CanonicalField, Long> byField,
        Map<String, Long> byState,
        LocalDate earliest,
        LocalDate latest
) {
    public ChangeSummary {
        byKind = byKind != null ? Collections.unmodifiableMap(copyOf(byKind, ChangeKind.class)) : Map.of();
        byField = byField != null ? Collections.unmodifiableMap(copyOf(byField, CanonicalField.class)) : Map.of();
        byState = byState != null ? Collections.unmodifiableMap(new TreeMap<>(byState)) : Map.of();
    }

    public static ChangeSummary of(Collection<ChangeEvent> events) {
        Map<ChangeKind, Long> byKind = new EnumMap<>(ChangeKind.class);
        Map<CanonicalField, Long> byField = new EnumMap<>(CanonicalField.class);
        Map<String, Long> byState = new TreeMap<>();
        LocalDate earliest = null;
        LocalDate latest = null;

        for (ChangeEvent event : events) {
            byKind.merge(event.kind(), 1L, Long::sum);
            if (event.field() != null) {
                byField.merge(event.field(), 1L, Long::sum);
            }
            byState.merge(event.state() != null ? event.state() : "UNKNOWN", 1L, Long::sum);
            if (earliest == null || event.timestamp().isBefore(earliest)) {
                earliest = event.timestamp();
            }
            if (latest == null || event.timestamp().isAfter(latest)) {
                latest = event.timestamp();
            }
        }
        return new ChangeSummary(events.size(), byKind, byField, byState, earliest, latest);
    }

    public long count(ChangeKind kind) {
        return byKind.getOrDefault(kind, 0L);
    }

    private static <K extends Enum<K>> EnumMap<K, Long> copyOf(Map<K, Long> source, Class<K> type) {
        EnumMap<K, Long> copy = new EnumMap<>(type);
        copy.putAll(source);
        return copy;
    }
}
