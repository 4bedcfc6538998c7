package com.registry.reconciliation.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed set of canonical attributes a corporate record may carry.
 * Declaration order is the order in which fields are compared and reported.
 */
public enum CanonicalField {
    NAME(FieldType.STRING, "Company_Name"),
    STATE(FieldType.STRING, "State"),
    STATUS(FieldType.STRING, "Status"),
    AUTHORIZED_CAPITAL(FieldType.NUMBER, "Authorized_Capital"),
    PAIDUP_CAPITAL(FieldType.NUMBER, "Paidup_Capital"),
    REGISTRATION_DATE(FieldType.DATE, "Registration_Date"),
    INDUSTRIAL_CLASSIFICATION(FieldType.STRING, "Industry_Classification"),
    CATEGORY(FieldType.STRING, "Company_Category"),
    COMPANY_CLASS(FieldType.STRING, "Company_Class"),
    ADDRESS(FieldType.STRING, "Address"),
    ROC_CODE(FieldType.STRING, "Roc_Code");

    private final FieldType type;
    private final String label;

    CanonicalField(FieldType type, String label) {
        this.type = type;
        this.label = label;
    }

    public FieldType getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Looks up a field by enum name or by label, ignoring case.
     */
    public static Optional<CanonicalField> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String candidate = name.trim();
        for (CanonicalField field : values()) {
            if (field.name().equalsIgnoreCase(candidate) || field.label.equalsIgnoreCase(candidate)) {
                return Optional.of(field);
            }
        }
        String upper = candidate.toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (CanonicalField field : values()) {
            if (field.name().equals(upper)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
