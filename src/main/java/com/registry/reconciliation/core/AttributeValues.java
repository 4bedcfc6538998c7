package com.registry.reconciliation.core;

import com.registry.reconciliation.core.model.CanonicalField;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Value utilities shared by records, the differ and the exporters.
 * A present value is a {@link String}, a {@link BigDecimal} or a {@link LocalDate};
 * absence is always represented as {@code null}.
 */
public final class AttributeValues {

    private AttributeValues() {
        // Utility class
    }

    /**
     * Converts a value into the canonical representation for the given field.
     * Numbers become {@link BigDecimal} with trailing zeros stripped, so that
     * {@code 100000} and {@code 100000.00} are the same value.
     *
     * @throws IllegalArgumentException if the value does not match the field's type
     */
    public static Object canonicalize(CanonicalField field, Object value) {
        Objects.requireNonNull(field, "field is required");
        if (value == null) {
            return null;
        }
        switch (field.getType()) {
            case STRING -> {
                if (value instanceof String s) {
                    return s;
                }
            }
            case NUMBER -> {
                if (value instanceof BigDecimal d) {
                    return strip(d);
                }
                if (value instanceof BigInteger i) {
                    return strip(new BigDecimal(i));
                }
                if (value instanceof Integer || value instanceof Long
                        || value instanceof Short || value instanceof Byte) {
                    return strip(BigDecimal.valueOf(((Number) value).longValue()));
                }
                if (value instanceof Double || value instanceof Float) {
                    double d = ((Number) value).doubleValue();
                    if (Double.isNaN(d) || Double.isInfinite(d)) {
                        throw new IllegalArgumentException(field + " cannot hold " + value);
                    }
                    return strip(BigDecimal.valueOf(d));
                }
            }
            case DATE -> {
                if (value instanceof LocalDate) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException(field + " expects " + field.getType()
                + " but got " + value.getClass().getSimpleName());
    }

    /**
     * Exact equality: two absent values are equal, absent never equals present,
     * numbers compare by numeric value without tolerance.
     */
    public static boolean equal(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof BigDecimal x && b instanceof BigDecimal y) {
            return x.compareTo(y) == 0;
        }
        return a.equals(b);
    }

    /**
     * Renders a value for logs and flat exports. Absent renders as an empty string.
     */
    public static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        return value.toString();
    }

    private static BigDecimal strip(BigDecimal value) {
        return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }
}
