package com.storyarchitect.validation;

import java.util.List;

/**
 * Decides whether two values asserted for the same attribute say the same
 * thing. Values no rule reconciles are reported as contradictions.
 */
@FunctionalInterface
public interface EquivalenceRule {

    boolean equivalent(String attribute, String priorValue, String newValue);

    static EquivalenceRule anyOf(List<EquivalenceRule> rules) {
        List<EquivalenceRule> copy = List.copyOf(rules);
        return (attribute, prior, next) -> {
            for (EquivalenceRule rule : copy) {
                if (rule.equivalent(attribute, prior, next)) {
                    return true;
                }
            }
            return false;
        };
    }

    /**
     * Normalized text equality plus name-alias folding.
     */
    static EquivalenceRule defaults() {
        return anyOf(List.of(new NormalizedTextRule(), new NameAliasRule()));
    }
}
