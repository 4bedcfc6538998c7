package com.registry.reconciliation.bulk;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.registry.reconciliation.core.model.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.List;

/**
 * JSON change log exporter, streaming one array of event objects through Jackson.
 * Absent values are written as JSON {@code null}; capital figures are written as numbers
 * and dates as ISO-8601 strings.
 *
 * <pre>
 * [ {
 *   "identifier" : "U1",
 *   "kind" : "FIELD_UPDATED",
 *   "changeType" : "Field Update",
 *   "date" : "2025-10-19",
 *   "field" : "Status",
 *   "oldValue" : "ACTIVE",
 *   "newValue" : "STRIKE OFF",
 *   "companyName" : "ACME PRIVATE LIMITED",
 *   "state" : "Maharashtra",
 *   "status" : "STRIKE OFF"
 * } ]
 * </pre>
 */
public class JsonChangeLogExporter implements ChangeLogExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonChangeLogExporter.class);

    private final ObjectMapper objectMapper;
    private final boolean pretty;

    public JsonChangeLogExporter() {
        this(new ObjectMapper(), true);
    }

    public JsonChangeLogExporter(ObjectMapper objectMapper, boolean pretty) {
        this.objectMapper = objectMapper;
        this.pretty = pretty;
    }

    @Override
    public ExportResult export(List<ChangeEvent> events, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long written = 0;
        try {
            JsonGenerator gen = objectMapper.getFactory().createGenerator(writer);
            gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            gen.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
            if (pretty) {
                gen.useDefaultPrettyPrinter();
            }
            gen.writeStartArray();
            for (ChangeEvent event : events) {
                gen.writeStartObject();
                gen.writeStringField("identifier", event.identifier());
                gen.writeStringField("kind", event.kind().name());
                gen.writeStringField("changeType", event.kind().getLabel());
                gen.writeStringField("date", event.timestamp().toString());
                gen.writeStringField("field", event.field() != null ? event.field().getLabel() : null);
                writeValue(gen, "oldValue", event.oldValue());
                writeValue(gen, "newValue", event.newValue());
                gen.writeStringField("companyName", event.companyName());
                gen.writeStringField("state", event.state());
                gen.writeStringField("status", event.status());
                gen.writeEndObject();
                written++;
            }
            gen.writeEndArray();
            gen.flush();
            gen.close();
        } catch (IOException e) {
            log.error("export.failed format=json error={}", e.getMessage());
            throw new UncheckedIOException("failed to write JSON change log", e);
        }

        ExportResult result = new ExportResult(getFormat(), written);
        cb.onProgress(written, written, "Export completed");
        log.info("export.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private static void writeValue(JsonGenerator gen, String name, Object value) throws IOException {
        if (value == null) {
            gen.writeNullField(name);
        } else if (value instanceof BigDecimal number) {
            gen.writeNumberField(name, number);
        } else {
            gen.writeStringField(name, value.toString());
        }
    }
}
