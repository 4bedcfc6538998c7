package com.registry.reconciliation.api;

import com.registry.reconciliation.core.model.CanonicalField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationOptionsTest {

    @Test
    @DisplayName("Defaults are lenient and sequential")
    void testDefaults() {
        ReconciliationOptions options = ReconciliationOptions.defaults();

        assertFalse(options.isStrictMode());
        assertTrue(options.getSourcePriority().isEmpty());
        assertEquals(Set.of(CanonicalField.REGISTRATION_DATE), options.getIdentityFields());
        assertEquals(0, options.getDateToleranceDays());
        assertEquals(1, options.getParallelism());
    }

    @Test
    @DisplayName("Strict factory enables strict mode")
    void testStrict() {
        assertTrue(ReconciliationOptions.strict().isStrictMode());
    }

    @Test
    @DisplayName("Should build custom options")
    void testCustom() {
        ReconciliationOptions options = ReconciliationOptions.builder()
                .sourcePriority("Gujarat", "Maharashtra")
                .identityFields(Set.of(CanonicalField.REGISTRATION_DATE, CanonicalField.ROC_CODE))
                .dateToleranceDays(3)
                .parallelism(8)
                .progressInterval(500)
                .build();

        assertEquals(List.of("Gujarat", "Maharashtra"), options.getSourcePriority());
        assertTrue(options.getIdentityFields().contains(CanonicalField.ROC_CODE));
        assertEquals(3, options.getDateToleranceDays());
        assertEquals(8, options.getParallelism());
        assertEquals(500, options.getProgressInterval());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> ReconciliationOptions.builder().sourcePriority("Goa", "Goa"));
        assertThrows(IllegalArgumentException.class,
                () -> ReconciliationOptions.builder().dateToleranceDays(-1));
        assertThrows(IllegalArgumentException.class,
                () -> ReconciliationOptions.builder().parallelism(0));
        assertThrows(IllegalArgumentException.class,
                () -> ReconciliationOptions.builder().progressInterval(0));
        assertThrows(IllegalArgumentException.class,
                () -> ReconciliationOptions.builder().identityFields(null));
    }

    @Test
    @DisplayName("Empty identity fields disable conflict detection")
    void testNoIdentityFields() {
        assertTrue(ReconciliationOptions.builder().identityFields(Set.of()).build().getIdentityFields().isEmpty());
    }
}
