package com.storyarchitect.models;

public enum ContradictionKind {
    ATTRIBUTE,
    TIMELINE,
    PLOT_THREAD
}
