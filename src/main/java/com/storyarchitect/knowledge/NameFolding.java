package com.storyarchitect.knowledge;

import java.util.Locale;
import java.util.Set;

/**
 * Canonical forms used to match names, attribute keys and event keys that
 * the model spells inconsistently.
 */
public final class NameFolding {

    private static final Set<String> HONORIFICS = Set.of(
        "dr", "doctor", "mr", "mrs", "ms", "miss", "mx", "sir", "dame", "lady", "lord",
        "captain", "capt", "professor", "prof", "king", "queen", "prince", "princess",
        "master", "madam", "madame", "father", "sister", "brother", "uncle", "aunt"
    );

    private NameFolding() {
    }

    /**
     * "Dr. Smith", "smith" and "SMITH," fold to the same form; leading
     * honorifics are dropped unless nothing else is left.
     */
    public static String foldName(String name) {
        if (name == null) {
            return "";
        }
        String cleaned = name.toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N}\\s'-]", " ")
            .trim()
            .replaceAll("\\s+", " ");
        if (cleaned.isEmpty()) {
            return "";
        }
        String[] tokens = cleaned.split(" ");
        int start = 0;
        while (start < tokens.length - 1 && HONORIFICS.contains(tokens[start])) {
            start++;
        }
        StringBuilder folded = new StringBuilder();
        for (int i = start; i < tokens.length; i++) {
            if (folded.length() > 0) {
                folded.append(' ');
            }
            folded.append(tokens[i]);
        }
        return folded.toString();
    }

    public static boolean sameName(String a, String b) {
        String foldedA = foldName(a);
        return !foldedA.isEmpty() && foldedA.equals(foldName(b));
    }

    /**
     * True when the value, past any leading honorifics, is a capitalized
     * name such as "Smith" or "Jane Smith". "of Bob" and "Smith's daughter"
     * are not.
     */
    public static boolean isProperName(String value) {
        if (value == null) {
            return false;
        }
        String cleaned = value.replaceAll("[^\\p{L}\\p{N}\\s'-]", " ").trim();
        if (cleaned.isEmpty()) {
            return false;
        }
        String[] tokens = cleaned.split("\\s+");
        int start = 0;
        while (start < tokens.length - 1 && HONORIFICS.contains(tokens[start].toLowerCase(Locale.ROOT))) {
            start++;
        }
        for (int i = start; i < tokens.length; i++) {
            if (!Character.isUpperCase(tokens[i].codePointAt(0))) {
                return false;
            }
        }
        return true;
    }

    /**
     * "eyeColor", "eye_color" and "Eye Color" all fold to "eyecolor".
     */
    public static String foldAttribute(String attribute) {
        if (attribute == null) {
            return "";
        }
        return attribute.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
    }

    /**
     * Event and thread keys: lowercase, separators collapsed to single hyphens.
     */
    public static String foldKey(String key) {
        if (key == null) {
            return "";
        }
        return key.toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N}]+", "-")
            .replaceAll("^-+|-+$", "");
    }
}
