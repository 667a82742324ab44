package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Last error of a project in {@link PipelineStatus#FAILED}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FailureInfo {

    private final StageKind stage;
    private final ErrorKind kind;
    private final String message;
    private final int attempts;
    private final List<Contradiction> contradictions;
    private final long failedAt;

    @JsonCreator
    public FailureInfo(@JsonProperty("stage") StageKind stage,
                       @JsonProperty("kind") ErrorKind kind,
                       @JsonProperty("message") String message,
                       @JsonProperty("attempts") int attempts,
                       @JsonProperty("contradictions") List<Contradiction> contradictions,
                       @JsonProperty("failedAt") long failedAt) {
        this.stage = stage;
        this.kind = kind;
        this.message = message;
        this.attempts = attempts;
        this.contradictions = contradictions == null ? Collections.emptyList() : List.copyOf(contradictions);
        this.failedAt = failedAt;
    }

    public StageKind getStage() {
        return stage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * The contradictions that blocked the stage, when {@link #getKind()} is
     * {@link ErrorKind#BLOCKING_CONTRADICTION}.
     */
    public List<Contradiction> getContradictions() {
        return contradictions;
    }

    public long getFailedAt() {
        return failedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FailureInfo)) return false;
        FailureInfo that = (FailureInfo) o;
        return attempts == that.attempts
            && failedAt == that.failedAt
            && Objects.equals(stage, that.stage)
            && kind == that.kind
            && Objects.equals(message, that.message)
            && Objects.equals(contradictions, that.contradictions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, kind, message, attempts, contradictions, failedAt);
    }
}
