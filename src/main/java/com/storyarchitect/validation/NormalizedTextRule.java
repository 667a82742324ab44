package com.storyarchitect.validation;

import java.util.Locale;
import java.util.Set;

/**
 * Equal after case, punctuation, whitespace and leading articles are ignored:
 * "Blue." and "blue" agree, "brown eyes" and "hazel eyes" do not.
 */
public class NormalizedTextRule implements EquivalenceRule {

    private static final Set<String> ARTICLES = Set.of("a", "an", "the");

    @Override
    public boolean equivalent(String attribute, String priorValue, String newValue) {
        if (priorValue == null || newValue == null) {
            return priorValue == null && newValue == null;
        }
        return normalize(priorValue).equals(normalize(newValue));
    }

    static String normalize(String value) {
        String cleaned = value.toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
            .trim()
            .replaceAll("\\s+", " ");
        int space = cleaned.indexOf(' ');
        if (space > 0 && ARTICLES.contains(cleaned.substring(0, space))) {
            cleaned = cleaned.substring(space + 1);
        }
        return cleaned;
    }
}
