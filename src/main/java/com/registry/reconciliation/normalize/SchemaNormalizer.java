package com.registry.reconciliation.normalize;

import com.registry.reconciliation.core.AttributeValues;
import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.FieldType;
import com.registry.reconciliation.core.model.RawRecord;
import com.registry.reconciliation.rules.DefaultValueRules;
import com.registry.reconciliation.rules.ValueNormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps a raw source row onto the canonical field set.
 *
 * <p>Unmapped source columns are ignored. A mapped field whose value is missing or blank is
 * absent; it is never defaulted to zero or an empty string. A value that fails coercion is
 * stored as absent and reported as a {@link CoercionWarning}; it never fails the row.</p>
 *
 * <p>Instances are stateless apart from the rule engine and safe to share across threads
 * once the engine is no longer modified.</p>
 */
public class SchemaNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SchemaNormalizer.class);

    static final String CONSTANT_COLUMN = "<constant>";
    private static final Pattern ISO_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ].*");

    private final ValueNormalizationEngine valueEngine;

    public SchemaNormalizer() {
        this(DefaultValueRules.createDefaultEngine());
    }

    public SchemaNormalizer(ValueNormalizationEngine valueEngine) {
        this.valueEngine = valueEngine;
    }

    /**
     * Normalizes one raw row, tagging it with the mapping's name.
     */
    public NormalizedRecord normalize(RawRecord raw, ColumnMapping mapping) {
        return normalize(raw, mapping, mapping.getName());
    }

    /**
     * Normalizes one raw row.
     *
     * @param raw       the raw row
     * @param mapping   column mapping of the row's source
     * @param sourceTag tag of the row's source, carried into the result and warnings
     */
    public NormalizedRecord normalize(RawRecord raw, ColumnMapping mapping, String sourceTag) {
        Map<String, Object> columns = trimmedColumns(raw);
        String identifier = extractIdentifier(columns, mapping);

        Map<CanonicalField, Object> attributes = new EnumMap<>(CanonicalField.class);
        List<CoercionWarning> warnings = new ArrayList<>();

        for (CanonicalField field : CanonicalField.values()) {
            String column;
            Object value;
            String constant = mapping.getConstants().get(field);
            if (constant != null) {
                column = CONSTANT_COLUMN;
                value = constant;
            } else {
                column = null;
                value = null;
                for (String candidate : mapping.columnsFor(field)) {
                    Object rawValue = columns.get(candidate);
                    if (holdsValue(field, rawValue)) {
                        column = candidate;
                        value = rawValue;
                        break;
                    }
                }
            }
            if (value == null) {
                continue;
            }

            try {
                Object coerced = coerce(field, value, mapping);
                if (coerced != null) {
                    attributes.put(field, coerced);
                }
            } catch (CoercionException e) {
                CoercionWarning warning = new CoercionWarning(sourceTag, identifier, field, column,
                        String.valueOf(value), e.getMessage());
                warnings.add(warning);
                log.debug("normalize.coercion_failed {}", warning);
            }
        }

        return new NormalizedRecord(identifier, attributes, sourceTag, raw.lineNumber(), warnings);
    }

    /**
     * Extracts the identifier only, without normalizing the remaining fields.
     * Returns null when none of the identifier columns holds a value.
     */
    public String identifierOf(RawRecord raw, ColumnMapping mapping) {
        return extractIdentifier(trimmedColumns(raw), mapping);
    }

    private String extractIdentifier(Map<String, Object> columns, ColumnMapping mapping) {
        for (String column : mapping.getIdentifierColumns()) {
            Object value = columns.get(column);
            if (!isBlank(value)) {
                return value.toString().trim();
            }
        }
        return null;
    }

    /**
     * A candidate column holds a value when it is non-blank after clean-up; a placeholder such
     * as {@code NA} counts as blank so the next candidate column is consulted.
     */
    private boolean holdsValue(CanonicalField field, Object rawValue) {
        if (isBlank(rawValue)) {
            return false;
        }
        if (rawValue instanceof CharSequence text) {
            return valueEngine.normalize(text.toString(), field) != null;
        }
        return true;
    }

    private Object coerce(CanonicalField field, Object value, ColumnMapping mapping) {
        FieldType type = field.getType();
        if (type == FieldType.NUMBER && value instanceof Number) {
            return canonicalizeOrFail(field, value);
        }
        if (type == FieldType.DATE && value instanceof LocalDate) {
            return value;
        }

        String text = valueEngine.normalize(value.toString(), field, mapping.isUpperCase(field));
        if (text == null) {
            return null;
        }
        return switch (type) {
            case STRING -> text;
            case NUMBER -> parseNumber(field, text);
            case DATE -> parseDate(text, mapping.dateFormatters());
        };
    }

    private Object parseNumber(CanonicalField field, String text) {
        BigDecimal number;
        try {
            number = new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new CoercionException("not a number");
        }
        return AttributeValues.canonicalize(field, number);
    }

    private LocalDate parseDate(String text, List<DateTimeFormatter> formatters) {
        String candidate = ISO_DATE_TIME.matcher(text).matches() ? text.substring(0, 10) : text;
        DateTimeParseException lastFailure = null;
        for (DateTimeFormatter formatter : formatters) {
            try {
                return LocalDate.parse(candidate, formatter);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        log.trace("normalize.date_unparsed value='{}' lastError={}", text,
                lastFailure != null ? lastFailure.getMessage() : "no patterns");
        throw new CoercionException("unrecognized date");
    }

    private Object canonicalizeOrFail(CanonicalField field, Object value) {
        try {
            return AttributeValues.canonicalize(field, value);
        } catch (IllegalArgumentException e) {
            throw new CoercionException(e.getMessage());
        }
    }

    private static Map<String, Object> trimmedColumns(RawRecord raw) {
        Map<String, Object> trimmed = new HashMap<>();
        raw.columns().forEach((key, value) -> {
            if (key != null) {
                trimmed.putIfAbsent(key.trim(), value);
            }
        });
        return trimmed;
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof CharSequence cs && cs.toString().isBlank());
    }

    private static final class CoercionException extends RuntimeException {
        CoercionException(String message) {
            super(message, null, false, false);
        }
    }
}
