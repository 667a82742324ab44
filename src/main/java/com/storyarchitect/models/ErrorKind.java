package com.storyarchitect.models;

/**
 * Why a stage ended in {@link PipelineStatus#FAILED}.
 */
public enum ErrorKind {
    CONFIGURATION,
    AUTH,
    CONTENT_POLICY,
    RATE_LIMIT,
    TRANSIENT,
    BLOCKING_CONTRADICTION,
    STORAGE
}
