package com.storyarchitect.models;

public enum PlotThreadStatus {
    OPEN,
    RESOLVED
}
