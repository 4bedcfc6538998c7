package com.registry.reconciliation.bulk;

import com.registry.reconciliation.core.model.RawRecord;

import java.util.List;

/**
 * Result of reading a raw source file.
 *
 * @param header  column names as they appear in the header row
 * @param records rows read successfully
 * @param errors  rows that could not be read and were skipped
 */
public record ReadResult(List<String> header, List<RawRecord> records, List<ReadError> errors) {

    public ReadResult {
        header = header != null ? List.copyOf(header) : List.of();
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that could not be read.
     *
     * @param lineNumber the line number in the input (1-based)
     * @param message    the error message
     */
    public record ReadError(long lineNumber, String message) {}

    @Override
    public String toString() {
        return "ReadResult{columns=" + header.size() +
                ", records=" + records.size() +
                ", errors=" + errors.size() + '}';
    }
}
