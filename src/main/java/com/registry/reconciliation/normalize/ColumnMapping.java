package com.registry.reconciliation.normalize;

import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.FieldType;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative mapping from one source layout onto the canonical field set.
 * Adding a source means adding a mapping, not new normalization logic.
 *
 * <p>Each canonical field lists candidate source columns; the first one holding a non-blank
 * value wins. A constant value stamps a field for every row of the source (the state of a
 * per-state file, for instance) and takes precedence over column values.</p>
 *
 * <p>Text fields listed as upper-case fields are upper-cased after clean-up; every other
 * field keeps its case.</p>
 */
public class ColumnMapping {

    public static final List<String> DEFAULT_DATE_PATTERNS = List.of(
            "uuuu-MM-dd", "dd-MM-uuuu", "dd/MM/uuuu", "uuuu/MM/dd", "dd-MMM-uuuu");

    private final String name;
    private final List<String> identifierColumns;
    private final Map<CanonicalField, List<String>> fieldColumns;
    private final Map<CanonicalField, String> constants;
    private final List<String> datePatterns;
    private final List<DateTimeFormatter> dateFormatters;
    private final Set<CanonicalField> upperCaseFields;

    private ColumnMapping(Builder builder) {
        this.name = builder.name;
        this.identifierColumns = List.copyOf(builder.identifierColumns);
        EnumMap<CanonicalField, List<String>> columns = new EnumMap<>(CanonicalField.class);
        builder.fieldColumns.forEach((field, names) -> columns.put(field, List.copyOf(names)));
        this.fieldColumns = Collections.unmodifiableMap(columns);
        EnumMap<CanonicalField, String> fixed = new EnumMap<>(CanonicalField.class);
        fixed.putAll(builder.constants);
        this.constants = Collections.unmodifiableMap(fixed);
        this.datePatterns = List.copyOf(builder.datePatterns);
        List<DateTimeFormatter> formatters = new ArrayList<>();
        for (String pattern : datePatterns) {
            formatters.add(new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern(pattern)
                    .toFormatter(Locale.ENGLISH)
                    .withResolverStyle(ResolverStyle.STRICT));
        }
        this.dateFormatters = List.copyOf(formatters);
        EnumSet<CanonicalField> upper = EnumSet.noneOf(CanonicalField.class);
        upper.addAll(builder.upperCaseFields);
        this.upperCaseFields = Collections.unmodifiableSet(upper);
    }

    public String getName() {
        return name;
    }

    public List<String> getIdentifierColumns() {
        return identifierColumns;
    }

    /**
     * Candidate source columns for a field, in lookup order; empty when the field is unmapped.
     */
    public List<String> columnsFor(CanonicalField field) {
        return fieldColumns.getOrDefault(field, List.of());
    }

    public Map<CanonicalField, List<String>> getFieldColumns() {
        return fieldColumns;
    }

    public Map<CanonicalField, String> getConstants() {
        return constants;
    }

    public List<String> getDatePatterns() {
        return datePatterns;
    }

    List<DateTimeFormatter> dateFormatters() {
        return dateFormatters;
    }

    public Set<CanonicalField> getUpperCaseFields() {
        return upperCaseFields;
    }

    /**
     * Whether values of the field are upper-cased. Only text fields are ever upper-cased.
     */
    public boolean isUpperCase(CanonicalField field) {
        return field.getType() == FieldType.STRING && upperCaseFields.contains(field);
    }

    /**
     * Every source column this mapping reads, identifier columns first.
     */
    public Set<String> referencedColumns() {
        Set<String> all = new LinkedHashSet<>(identifierColumns);
        fieldColumns.values().forEach(all::addAll);
        return all;
    }

    /**
     * Returns a copy of this mapping with an additional constant field value.
     */
    public ColumnMapping withConstant(CanonicalField field, String value) {
        return toBuilder().constant(field, value).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .name(name)
                .identifierColumns(identifierColumns.toArray(new String[0]))
                .datePatterns(datePatterns)
                .upperCase(upperCaseFields.toArray(new CanonicalField[0]));
        fieldColumns.forEach((field, columns) -> builder.map(field, columns.toArray(new String[0])));
        constants.forEach(builder::constant);
        return builder;
    }

    @Override
    public String toString() {
        return "ColumnMapping{" +
                "name='" + name + '\'' +
                ", identifier=" + identifierColumns +
                ", fields=" + fieldColumns.keySet() +
                ", constants=" + constants.keySet() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name = "default";
        private List<String> identifierColumns = new ArrayList<>();
        private final Map<CanonicalField, List<String>> fieldColumns = new EnumMap<>(CanonicalField.class);
        private final Map<CanonicalField, String> constants = new EnumMap<>(CanonicalField.class);
        private List<String> datePatterns = DEFAULT_DATE_PATTERNS;
        private final Set<CanonicalField> upperCaseFields = EnumSet.noneOf(CanonicalField.class);

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder identifierColumns(String... columns) {
            this.identifierColumns = new ArrayList<>();
            for (String column : columns) {
                this.identifierColumns.add(requireColumn(column));
            }
            return this;
        }

        public Builder map(CanonicalField field, String... columns) {
            Objects.requireNonNull(field, "field is required");
            List<String> names = fieldColumns.computeIfAbsent(field, f -> new ArrayList<>());
            for (String column : columns) {
                names.add(requireColumn(column));
            }
            return this;
        }

        public Builder constant(CanonicalField field, String value) {
            Objects.requireNonNull(field, "field is required");
            if (value == null) {
                constants.remove(field);
            } else {
                constants.put(field, value);
            }
            return this;
        }

        public Builder datePatterns(List<String> datePatterns) {
            if (datePatterns == null || datePatterns.isEmpty()) {
                throw new IllegalArgumentException("datePatterns must not be empty");
            }
            this.datePatterns = List.copyOf(datePatterns);
            return this;
        }

        public Builder upperCase(CanonicalField... fields) {
            for (CanonicalField field : fields) {
                upperCaseFields.add(Objects.requireNonNull(field, "field is required"));
            }
            return this;
        }

        /**
         * Upper-cases every text field, or none.
         */
        public Builder upperCaseText(boolean upperCaseText) {
            upperCaseFields.clear();
            if (upperCaseText) {
                for (CanonicalField field : CanonicalField.values()) {
                    if (field.getType() == FieldType.STRING) {
                        upperCaseFields.add(field);
                    }
                }
            }
            return this;
        }

        public ColumnMapping build() {
            if (identifierColumns.isEmpty()) {
                throw new IllegalArgumentException("at least one identifier column is required");
            }
            return new ColumnMapping(this);
        }

        private static String requireColumn(String column) {
            if (column == null || column.isBlank()) {
                throw new IllegalArgumentException("column name must not be blank");
            }
            return column.trim();
        }
    }
}
