package com.registry.reconciliation.normalize;

import com.registry.reconciliation.core.model.CanonicalField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ColumnMappingLoaderTest {

    private final ColumnMappingLoader loader = new ColumnMappingLoader();

    @Test
    @DisplayName("Should load the bundled registry mapping")
    void testLoadBundledMapping() {
        ColumnMapping mapping = loader.loadResource("column-mappings/mca-state.json");

        assertEquals("mca-state", mapping.getName());
        assertEquals(List.of("CIN"), mapping.getIdentifierColumns());
        assertEquals(Set.of(CanonicalField.NAME, CanonicalField.CATEGORY, CanonicalField.COMPANY_CLASS,
                CanonicalField.STATUS), mapping.getUpperCaseFields());
        assertFalse(mapping.isUpperCase(CanonicalField.STATE));
        assertFalse(mapping.isUpperCase(CanonicalField.ADDRESS));
        assertEquals(List.of("CompanyName", "Company_Name"), mapping.columnsFor(CanonicalField.NAME));
        assertEquals(List.of("CompanyRegistrationdate_date", "Registration_Date"),
                mapping.columnsFor(CanonicalField.REGISTRATION_DATE));
    }

    @Test
    @DisplayName("Should load fields and constants by name or label")
    void testLoadJson() throws Exception {
        ColumnMapping mapping = loader.load("""
                {
                  "name": "gujarat",
                  "identifier": "CIN",
                  "fields": {
                    "Company_Name": ["CompanyName"],
                    "status": "CompanyStatus"
                  },
                  "constants": { "STATE": "Gujarat" }
                }
                """);

        assertEquals("gujarat", mapping.getName());
        assertEquals(List.of("CompanyName"), mapping.columnsFor(CanonicalField.NAME));
        assertEquals(List.of("CompanyStatus"), mapping.columnsFor(CanonicalField.STATUS));
        assertEquals("Gujarat", mapping.getConstants().get(CanonicalField.STATE));
        assertTrue(mapping.getUpperCaseFields().isEmpty());
        assertEquals(ColumnMapping.DEFAULT_DATE_PATTERNS, mapping.getDatePatterns());
    }

    @Test
    @DisplayName("upperCaseText flag upper-cases every text field")
    void testUpperCaseTextFlag() throws Exception {
        ColumnMapping mapping = loader.load("""
                { "identifier": ["CIN"], "upperCaseText": true }
                """);

        assertTrue(mapping.isUpperCase(CanonicalField.STATE));
        assertTrue(mapping.isUpperCase(CanonicalField.ADDRESS));
        assertFalse(mapping.isUpperCase(CanonicalField.AUTHORIZED_CAPITAL));
    }

    @Test
    @DisplayName("Should reject unknown canonical fields")
    void testUnknownField() {
        assertThrows(IllegalArgumentException.class, () -> loader.load("""
                { "identifier": ["CIN"], "fields": { "Directors": ["DIN"] } }
                """));
    }

    @Test
    @DisplayName("Should reject mapping without identifier")
    void testMissingIdentifier() {
        assertThrows(IllegalArgumentException.class, () -> loader.load("""
                { "fields": { "NAME": ["CompanyName"] } }
                """));
    }

    @Test
    @DisplayName("Should reject non-object documents")
    void testNonObject() {
        assertThrows(IllegalArgumentException.class, () -> loader.load("[\"CIN\"]"));
    }

    @Test
    @DisplayName("Missing resource fails with IllegalArgumentException")
    void testMissingResource() {
        assertThrows(IllegalArgumentException.class,
                () -> loader.loadResource("column-mappings/does-not-exist.json"));
    }
}
