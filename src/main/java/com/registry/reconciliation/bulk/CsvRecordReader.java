package com.registry.reconciliation.bulk;

import com.registry.reconciliation.core.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a header-first CSV registry extract into raw records.
 *
 * <p>Fields may be quoted; quoted fields may contain commas, doubled quotes and line breaks.
 * Blank lines are skipped. A row whose field count differs from the header is reported as a
 * {@link ReadResult.ReadError} and skipped; it does not abort the read.</p>
 *
 * <pre>
 * CIN,CompanyName,CompanyStatus
 * U24299PN2019PTC181506,"ANURIUSWELL PHARMACEUTICALS PRIVATE LIMITED",Active
 * </pre>
 */
public class CsvRecordReader {
    private static final Logger log = LoggerFactory.getLogger(CsvRecordReader.class);
    private static final int PROGRESS_INTERVAL = 10_000;

    public ReadResult read(InputStream input, ProgressCallback callback) {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    /**
     * Reads all rows. The reader is closed on return.
     *
     * @throws UncheckedIOException if the underlying reader fails
     */
    public ReadResult read(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<RawRecord> records = new ArrayList<>();
        List<ReadResult.ReadError> errors = new ArrayList<>();

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            RowScanner scanner = new RowScanner(br);
            Row headerRow = scanner.next();
            if (headerRow == null) {
                return new ReadResult(List.of(), List.of(), List.of());
            }
            List<String> header = new ArrayList<>(headerRow.fields());
            if (!header.isEmpty() && header.get(0).startsWith("\uFEFF")) {
                header.set(0, header.get(0).substring(1));
            }

            Row row;
            while ((row = scanner.next()) != null) {
                if (row.isBlank()) {
                    continue;
                }
                if (row.unterminatedQuote()) {
                    errors.add(new ReadResult.ReadError(row.lineNumber(), "unterminated quoted field"));
                    log.warn("read.error line={} error=unterminated quote", row.lineNumber());
                    continue;
                }
                if (row.fields().size() != header.size()) {
                    errors.add(new ReadResult.ReadError(row.lineNumber(),
                            "expected " + header.size() + " fields but found " + row.fields().size()));
                    log.warn("read.error line={} fields={} expected={}",
                            row.lineNumber(), row.fields().size(), header.size());
                    continue;
                }
                Map<String, Object> columns = new LinkedHashMap<>();
                for (int i = 0; i < header.size(); i++) {
                    columns.put(header.get(i), row.fields().get(i));
                }
                records.add(new RawRecord(columns, row.lineNumber()));

                if (records.size() % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(records.size(), -1, "Read " + records.size() + " records");
                }
            }

            ReadResult result = new ReadResult(header, records, errors);
            cb.onProgress(records.size(), records.size(), "Read completed");
            log.info("read.completed result={}", result);
            return result;
        } catch (IOException e) {
            log.error("read.failed error={}", e.getMessage());
            throw new UncheckedIOException("failed to read CSV source", e);
        }
    }

    private record Row(List<String> fields, long lineNumber, boolean unterminatedQuote) {
        boolean isBlank() {
            return fields.size() == 1 && fields.get(0).isBlank();
        }
    }

    /**
     * Splits character input into RFC 4180 rows, tracking the line each row starts on.
     */
    private static final class RowScanner {
        private final BufferedReader reader;
        private long line = 0;

        RowScanner(BufferedReader reader) {
            this.reader = reader;
        }

        Row next() throws IOException {
            String text = reader.readLine();
            if (text == null) {
                return null;
            }
            line++;
            long startLine = line;
            List<String> fields = new ArrayList<>();
            StringBuilder field = new StringBuilder();
            boolean quoted = false;
            int i = 0;
            while (true) {
                if (i >= text.length()) {
                    if (quoted) {
                        String continuation = reader.readLine();
                        if (continuation == null) {
                            fields.add(field.toString());
                            return new Row(fields, startLine, true);
                        }
                        line++;
                        field.append('\n');
                        text = continuation;
                        i = 0;
                        continue;
                    }
                    fields.add(field.toString());
                    return new Row(fields, startLine, false);
                }
                char c = text.charAt(i);
                if (quoted) {
                    if (c == '"') {
                        if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                            field.append('"');
                            i++;
                        } else {
                            quoted = false;
                        }
                    } else {
                        field.append(c);
                    }
                } else if (c == '"' && field.length() == 0) {
                    quoted = true;
                } else if (c == ',') {
                    fields.add(field.toString());
                    field.setLength(0);
                } else {
                    field.append(c);
                }
                i++;
            }
        }
    }
}
