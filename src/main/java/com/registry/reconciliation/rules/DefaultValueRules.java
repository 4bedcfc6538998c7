package com.registry.reconciliation.rules;

import com.registry.reconciliation.core.model.FieldType;

import java.util.List;

/**
 * Built-in clean-up rules for registry extracts.
 */
public final class DefaultValueRules {

    private DefaultValueRules() {
        // Utility class
    }

    /**
     * Creates an engine with the common and numeric rules.
     */
    public static ValueNormalizationEngine createDefaultEngine() {
        ValueNormalizationEngine engine = new ValueNormalizationEngine();
        engine.addRules(getCommonRules());
        engine.addRules(getNumericRules());
        return engine;
    }

    /**
     * Rules that apply to every field.
     */
    public static List<ValueRule> getCommonRules() {
        return List.of(
                // Non-printing characters left behind by spreadsheet exports
                ValueRule.builder()
                        .name("common-control-chars")
                        .pattern("[\\p{Cntrl}\\u00A0\\uFEFF]")
                        .replacement(" ")
                        .priority(10)
                        .build(),

                // Placeholder tokens mean "unknown"
                ValueRule.builder()
                        .name("common-placeholder")
                        .pattern("\\s*(N/?A|NULL|NONE|NAN|-+)\\s*")
                        .marksAbsent()
                        .priority(20)
                        .build(),

                ValueRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }

    /**
     * Rules for capital figures: drop currency marks and thousands separators.
     */
    public static List<ValueRule> getNumericRules() {
        return List.of(
                ValueRule.builder()
                        .name("numeric-currency")
                        .pattern("(INR|Rs\\.?|\\u20B9|\\$)")
                        .replacement("")
                        .fieldTypes(FieldType.NUMBER)
                        .priority(50)
                        .build(),

                ValueRule.builder()
                        .name("numeric-thousands-separator")
                        .pattern("(?<=\\d),(?=\\d)")
                        .replacement("")
                        .fieldTypes(FieldType.NUMBER)
                        .priority(50)
                        .build(),

                ValueRule.builder()
                        .name("numeric-inner-spaces")
                        .pattern("(?<=\\d)\\s+(?=\\d)")
                        .replacement("")
                        .fieldTypes(FieldType.NUMBER)
                        .priority(60)
                        .build()
        );
    }
}
