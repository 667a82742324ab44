package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum EntityCategory {
    CHARACTER,
    LOCATION,
    OBJECT;

    /**
     * Lenient parse for model output; anything unrecognised is treated as an object.
     */
    @JsonCreator
    public static EntityCategory fromString(String value) {
        if (value == null || value.isBlank()) {
            return CHARACTER;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "CHARACTER":
            case "CHARACTERS":
            case "PERSON":
                return CHARACTER;
            case "LOCATION":
            case "LOCATIONS":
            case "PLACE":
            case "SETTING":
                return LOCATION;
            default:
                return OBJECT;
        }
    }
}
