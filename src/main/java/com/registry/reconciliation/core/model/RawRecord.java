package com.registry.reconciliation.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row as read from a source, keyed by the source's own column names.
 *
 * @param columns    source column name to raw value; values may be null
 * @param lineNumber position of the row in its source (1-based), or 0 if unknown
 */
public record RawRecord(Map<String, Object> columns, long lineNumber) {

    public RawRecord {
        columns = columns != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(columns))
                : Map.of();
    }

    public static RawRecord of(Map<String, ?> columns) {
        return new RawRecord(columns != null ? new LinkedHashMap<>(columns) : null, 0);
    }

    /**
     * Returns the raw value of a column, or null if the column is not present.
     */
    public Object get(String column) {
        return columns.get(column);
    }
}
