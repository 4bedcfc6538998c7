package com.registry.reconciliation.rules;

import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ValueNormalizationEngineTest {

    private ValueNormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultValueRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should trim and collapse whitespace")
    void testWhitespace() {
        assertEquals("ACME PRIVATE LIMITED",
                engine.normalize("  ACME   PRIVATE\tLIMITED ", CanonicalField.NAME));
    }

    @Test
    @DisplayName("Should upper-case only when asked")
    void testUpperCase() {
        assertEquals("Strike Off", engine.normalize("Strike Off", CanonicalField.STATUS, false));
        assertEquals("STRIKE OFF", engine.normalize("Strike Off", CanonicalField.STATUS, true));
    }

    @ParameterizedTest
    @DisplayName("Placeholder tokens normalize to absent")
    @ValueSource(strings = {"NA", "N/A", "null", "None", "nan", "-", "---", "   "})
    void testPlaceholders(String value) {
        assertNull(engine.normalize(value, CanonicalField.STATUS));
    }

    @Test
    @DisplayName("Null input stays absent")
    void testNullInput() {
        assertNull(engine.normalize(null, CanonicalField.NAME));
    }

    @ParameterizedTest
    @DisplayName("Should strip currency marks and separators from capital")
    @CsvSource(delimiter = '|', value = {
            "1,00,000|100000",
            "Rs. 5,00,000|500000",
            "INR 2500000|2500000",
            "10 00 000|1000000",
            "15000.50|15000.50"
    })
    void testNumericRules(String input, String expected) {
        assertEquals(expected, engine.normalize(input, CanonicalField.AUTHORIZED_CAPITAL));
    }

    @Test
    @DisplayName("Numeric rules do not touch text fields")
    void testNumericRulesScoped() {
        assertEquals("1,2 MAIN ROAD", engine.normalize("1,2 MAIN ROAD", CanonicalField.ADDRESS));
    }

    @Test
    @DisplayName("Should apply rules in priority order and support removal")
    void testCustomRules() {
        ValueNormalizationEngine custom = new ValueNormalizationEngine();
        custom.addRule(ValueRule.builder().name("second").pattern("PVT").replacement("PRIVATE").priority(20).build());
        custom.addRule(ValueRule.builder().name("first").pattern("\\.").replacement("").priority(10).build());

        assertEquals("first", custom.getRules().get(0).getName());
        assertEquals("ACME PRIVATE LTD", custom.normalize("ACME PVT. LTD.", CanonicalField.NAME));

        assertTrue(custom.removeRule("second"));
        assertEquals("ACME PVT LTD", custom.normalize("ACME PVT. LTD.", CanonicalField.NAME));
    }

    @Test
    @DisplayName("Field-scoped rule applies only to its fields")
    void testFieldScopedRule() {
        ValueRule rule = ValueRule.builder()
                .name("status-strike")
                .pattern("STRIKE\\s*OFF")
                .replacement("STRIKE OFF")
                .fields(CanonicalField.STATUS)
                .build();

        assertTrue(rule.appliesTo(CanonicalField.STATUS));
        assertFalse(rule.appliesTo(CanonicalField.NAME));
    }

    @Test
    @DisplayName("Type-scoped rule applies to every field of that type")
    void testTypeScopedRule() {
        ValueRule rule = ValueRule.builder()
                .name("numeric-lakh")
                .pattern("LAKH")
                .replacement("")
                .fieldTypes(FieldType.NUMBER)
                .build();

        assertTrue(rule.appliesTo(CanonicalField.AUTHORIZED_CAPITAL));
        assertTrue(rule.appliesTo(CanonicalField.PAIDUP_CAPITAL));
        assertFalse(rule.appliesTo(CanonicalField.REGISTRATION_DATE));
    }

    @Test
    @DisplayName("Absent-marking rule stops the chain on a whole-value match only")
    void testAbsentMarkingRule() {
        ValueNormalizationEngine custom = new ValueNormalizationEngine();
        custom.addRule(ValueRule.builder().name("unknown").pattern("UNKNOWN").marksAbsent()
                .fields(CanonicalField.STATUS).priority(10).build());
        custom.addRule(ValueRule.builder().name("suffix").pattern("$").replacement("!").priority(20).build());

        assertNull(custom.normalize("Unknown", CanonicalField.STATUS));
        assertEquals("UNKNOWN ENTITY!", custom.normalize("UNKNOWN ENTITY", CanonicalField.STATUS));
        assertEquals("Unknown!", custom.normalize("Unknown", CanonicalField.NAME));
        assertTrue(custom.getRules().get(0).marksAbsent());
    }

    @Test
    @DisplayName("Rule builder requires name, pattern and a replacement unless marking absent")
    void testRuleBuilderValidation() {
        assertThrows(NullPointerException.class,
                () -> ValueRule.builder().pattern("x").replacement("").build());
        assertThrows(NullPointerException.class,
                () -> ValueRule.builder().name("x").replacement("").build());
        assertThrows(NullPointerException.class,
                () -> ValueRule.builder().name("x").pattern("x").build());
        assertThrows(IllegalArgumentException.class,
                () -> ValueRule.builder().name("x").pattern("x").replacement("").marksAbsent().build());
    }
}
