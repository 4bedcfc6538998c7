package com.registry.reconciliation.snapshot;

import com.registry.reconciliation.core.model.RawRecord;
import com.registry.reconciliation.normalize.ColumnMapping;

import java.util.List;
import java.util.Objects;

/**
 * Raw rows from one source together with the mapping that reads them.
 *
 * @param sourceTag tag identifying the origin (e.g. a state file)
 * @param records   raw rows in source order
 * @param mapping   column mapping for this source's layout
 */
public record SourceBatch(String sourceTag, List<RawRecord> records, ColumnMapping mapping) {

    public SourceBatch {
        Objects.requireNonNull(sourceTag, "sourceTag is required");
        Objects.requireNonNull(mapping, "mapping is required");
        if (sourceTag.isBlank()) {
            throw new IllegalArgumentException("sourceTag must not be blank");
        }
        records = records != null ? List.copyOf(records) : List.of();
    }

    public int size() {
        return records.size();
    }
}
