package com.storyarchitect.models;

public enum ValidationOutcome {
    PASS,
    FLAGGED
}
