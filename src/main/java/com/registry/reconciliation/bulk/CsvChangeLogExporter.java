package com.registry.reconciliation.bulk;

import com.registry.reconciliation.core.AttributeValues;
import com.registry.reconciliation.core.model.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * CSV change log exporter. Absent values are written as empty cells.
 *
 * <pre>
 * CIN,Change_Type,Field_Changed,Old_Value,New_Value,Date,Company_Name,State,Status
 * U1,Field Update,Status,ACTIVE,STRIKE OFF,2025-10-19,ACME PRIVATE LIMITED,Maharashtra,STRIKE OFF
 * U2,New Incorporation,,,,2025-10-19,NEWCO PRIVATE LIMITED,Gujarat,ACTIVE
 * </pre>
 */
public class CsvChangeLogExporter implements ChangeLogExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvChangeLogExporter.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    static final String HEADER =
            "CIN,Change_Type,Field_Changed,Old_Value,New_Value,Date,Company_Name,State,Status";

    @Override
    public ExportResult export(List<ChangeEvent> events, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long written = 0;
        try {
            BufferedWriter out = new BufferedWriter(writer);
            out.write(HEADER);
            out.newLine();
            for (ChangeEvent event : events) {
                out.write(String.join(",",
                        csvEscape(event.identifier()),
                        csvEscape(event.kind().getLabel()),
                        csvEscape(event.field() != null ? event.field().getLabel() : null),
                        csvEscape(AttributeValues.render(event.oldValue())),
                        csvEscape(AttributeValues.render(event.newValue())),
                        csvEscape(event.timestamp().toString()),
                        csvEscape(event.companyName()),
                        csvEscape(event.state()),
                        csvEscape(event.status())));
                out.newLine();
                written++;
                if (written % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(written, events.size(), "Exported " + written + " events");
                }
            }
            out.flush();
        } catch (IOException e) {
            log.error("export.failed format=csv error={}", e.getMessage());
            throw new UncheckedIOException("failed to write CSV change log", e);
        }

        ExportResult result = new ExportResult(getFormat(), written);
        cb.onProgress(written, written, "Export completed");
        log.info("export.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
