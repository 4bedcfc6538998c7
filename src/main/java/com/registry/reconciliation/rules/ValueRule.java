package com.registry.reconciliation.rules;

import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.FieldType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A clean-up step applied to raw text values before type coercion.
 *
 * <p>A rewrite rule replaces every match of its pattern. An absent-marking rule has no
 * replacement: when its pattern matches the whole value, the value is reported as absent
 * and no further rules run.</p>
 *
 * <p>Rules are scoped by canonical field, by {@link FieldType}, or both; a rule with no scope
 * applies to every field.</p>
 */
public class ValueRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<CanonicalField> fields;
    private final Set<FieldType> fieldTypes;
    private final int priority;

    private ValueRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.replacement = builder.replacement;
        this.fields = builder.fields.isEmpty() ? Set.of() : EnumSet.copyOf(builder.fields);
        this.fieldTypes = builder.fieldTypes.isEmpty() ? Set.of() : EnumSet.copyOf(builder.fieldTypes);
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public boolean marksAbsent() {
        return replacement == null;
    }

    /**
     * A rule applies when the field is listed, or its type is listed, or no scope is set.
     */
    public boolean appliesTo(CanonicalField field) {
        if (fields.isEmpty() && fieldTypes.isEmpty()) {
            return true;
        }
        return fields.contains(field) || fieldTypes.contains(field.getType());
    }

    /**
     * @return the rewritten value, or null when an absent-marking rule matches the whole value
     */
    public String apply(String input) {
        if (input == null) {
            return null;
        }
        if (marksAbsent()) {
            return pattern.matcher(input).matches() ? null : input;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return "ValueRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                (marksAbsent() ? ", absent" : "") +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private boolean absent;
        private final Set<CanonicalField> fields = EnumSet.noneOf(CanonicalField.class);
        private final Set<FieldType> fieldTypes = EnumSet.noneOf(FieldType.class);
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        /**
         * Turns the rule into an absent-marking rule: a whole-value match means "no value".
         */
        public Builder marksAbsent() {
            this.absent = true;
            return this;
        }

        public Builder fields(CanonicalField... fields) {
            Collections.addAll(this.fields, fields);
            return this;
        }

        public Builder fieldTypes(FieldType... types) {
            Collections.addAll(this.fieldTypes, types);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public ValueRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            if (absent && replacement != null) {
                throw new IllegalArgumentException("absent-marking rule '" + name + "' cannot have a replacement");
            }
            if (!absent) {
                Objects.requireNonNull(replacement, "replacement is required");
            }
            return new ValueRule(this);
        }
    }
}
