package com.registry.reconciliation.core.model;

/**
 * Declared value type of a canonical field.
 * Determines how raw source text is coerced during normalization.
 */
public enum FieldType {
    STRING,
    NUMBER,
    DATE
}
