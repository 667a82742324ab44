package com.storyarchitect.models;

import java.util.Locale;

/**
 * Ordered from least to most serious.
 */
public enum Severity {
    MINOR,
    MAJOR,
    CRITICAL;

    public boolean atLeast(Severity threshold) {
        return threshold != null && compareTo(threshold) >= 0;
    }

    /**
     * Parses a blocking threshold; {@code none} or blank means nothing blocks.
     */
    public static Severity parseThreshold(String value) {
        if (value == null || value.isBlank() || "none".equalsIgnoreCase(value.trim())) {
            return null;
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
