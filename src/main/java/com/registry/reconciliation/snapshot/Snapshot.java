package com.registry.reconciliation.snapshot;

import com.registry.reconciliation.core.model.CanonicalRecord;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable reconciled dataset at one point in time: exactly one record per identifier.
 * Iteration is in ascending identifier order. An updated view is a new snapshot.
 */
public final class Snapshot {

    private final LocalDate asOf;
    private final NavigableMap<String, CanonicalRecord> records;

    private Snapshot(LocalDate asOf, NavigableMap<String, CanonicalRecord> records) {
        this.asOf = asOf;
        this.records = Collections.unmodifiableNavigableMap(records);
    }

    /**
     * Creates a snapshot from records with distinct identifiers.
     *
     * @param asOf    logical date of the snapshot, may be null when unknown
     * @param records canonical records
     * @throws IllegalArgumentException if two records share an identifier
     */
    public static Snapshot of(LocalDate asOf, Collection<CanonicalRecord> records) {
        TreeMap<String, CanonicalRecord> byId = new TreeMap<>();
        for (CanonicalRecord record : records) {
            if (byId.putIfAbsent(record.identifier(), record) != null) {
                throw new IllegalArgumentException("duplicate identifier in snapshot: " + record.identifier());
            }
        }
        return new Snapshot(asOf, byId);
    }

    public static Snapshot of(LocalDate asOf, CanonicalRecord... records) {
        return of(asOf, List.of(records));
    }

    public static Snapshot empty(LocalDate asOf) {
        return new Snapshot(asOf, new TreeMap<>());
    }

    public LocalDate getAsOf() {
        return asOf;
    }

    public Optional<LocalDate> asOf() {
        return Optional.ofNullable(asOf);
    }

    public Optional<CanonicalRecord> get(String identifier) {
        return Optional.ofNullable(records.get(identifier));
    }

    public boolean contains(String identifier) {
        return records.containsKey(identifier);
    }

    /**
     * Identifiers in ascending order.
     */
    public Set<String> identifiers() {
        return records.navigableKeySet();
    }

    /**
     * Records in ascending identifier order.
     */
    public Collection<CanonicalRecord> records() {
        return records.values();
    }

    public Map<String, CanonicalRecord> asMap() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Returns a copy of this snapshot stamped with another logical date.
     */
    public Snapshot withAsOf(LocalDate date) {
        return new Snapshot(date, new TreeMap<>(records));
    }

    public SnapshotStatistics statistics() {
        return SnapshotStatistics.of(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Snapshot that = (Snapshot) o;
        return Objects.equals(asOf, that.asOf) && records.equals(that.records);
    }

    @Override
    public int hashCode() {
        return Objects.hash(asOf, records);
    }

    @Override
    public String toString() {
        return "Snapshot{asOf=" + asOf + ", records=" + records.size() + '}';
    }
}
