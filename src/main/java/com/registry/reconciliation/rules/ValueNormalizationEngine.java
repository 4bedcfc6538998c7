package com.registry.reconciliation.rules;

import com.registry.reconciliation.core.model.CanonicalField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link ValueRule}s to raw text values.
 * Rules are applied in priority order (lower priority number = higher precedence).
 * A value that is blank after all rules is reported as null, i.e. absent.
 */
public class ValueNormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(ValueNormalizationEngine.class);

    private final List<ValueRule> rules;

    public ValueNormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public ValueNormalizationEngine(List<ValueRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(ValueRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<ValueRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<ValueRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Cleans a raw value for the given field.
     *
     * @param value     raw text, may be null
     * @param field     target field, used to select field-scoped rules
     * @param upperCase whether to upper-case the cleaned value
     * @return cleaned text, or null when nothing meaningful remains
     */
    public String normalize(String value, CanonicalField field, boolean upperCase) {
        if (value == null || value.isBlank()) {
            return null;
        }

        String result = value;
        for (ValueRule rule : rules) {
            if (field == null || rule.appliesTo(field)) {
                String before = result;
                result = rule.apply(result);
                if (result == null) {
                    log.trace("Rule '{}' marked '{}' absent", rule.getName(), before);
                    return null;
                }
                if (!before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }

        result = result.trim().replaceAll("\\s+", " ");
        if (upperCase) {
            result = result.toUpperCase(Locale.ROOT);
        }
        return result.isEmpty() ? null : result;
    }

    public String normalize(String value, CanonicalField field) {
        return normalize(value, field, false);
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(ValueRule::getPriority));
    }
}
