package com.registry.reconciliation.bulk;

import com.registry.reconciliation.core.model.ChangeEvent;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes change events in a persistence format.
 * Implementations keep field names and the absent/present distinction of every value.
 */
public interface ChangeLogExporter {

    /**
     * Writes events to a writer. The writer is flushed but not closed.
     *
     * @param events   events in log order
     * @param writer   destination
     * @param callback optional progress callback
     * @throws java.io.UncheckedIOException if writing fails
     */
    ExportResult export(List<ChangeEvent> events, Writer writer, ProgressCallback callback);

    default ExportResult export(List<ChangeEvent> events, OutputStream output, ProgressCallback callback) {
        return export(events, new OutputStreamWriter(output, StandardCharsets.UTF_8), callback);
    }

    /**
     * Returns the format produced by this exporter (e.g., "csv", "json").
     */
    String getFormat();
}
