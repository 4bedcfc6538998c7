package com.registry.reconciliation.bulk;

/**
 * Result of a change log export.
 *
 * @param format        output format
 * @param totalEvents   number of events written
 */
public record ExportResult(String format, long totalEvents) {

    @Override
    public String toString() {
        return "ExportResult{format=" + format + ", events=" + totalEvents + '}';
    }
}
