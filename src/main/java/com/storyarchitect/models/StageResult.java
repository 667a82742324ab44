package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one completed pipeline stage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StageResult {

    private final String id;
    private final StageKind stage;
    private final String text;
    private final String summary;
    private final ExtractedFacts facts;
    private final ValidationOutcome outcome;
    private final List<Contradiction> contradictions;
    private final String provider;
    private final String model;
    private final int attempts;
    private final long createdAt;

    @JsonCreator
    public StageResult(@JsonProperty("id") String id,
                       @JsonProperty("stage") StageKind stage,
                       @JsonProperty("text") String text,
                       @JsonProperty("summary") String summary,
                       @JsonProperty("facts") ExtractedFacts facts,
                       @JsonProperty("outcome") ValidationOutcome outcome,
                       @JsonProperty("contradictions") List<Contradiction> contradictions,
                       @JsonProperty("provider") String provider,
                       @JsonProperty("model") String model,
                       @JsonProperty("attempts") int attempts,
                       @JsonProperty("createdAt") long createdAt) {
        this.id = id;
        this.stage = stage;
        this.text = text;
        this.summary = summary;
        this.facts = facts != null ? facts : ExtractedFacts.empty();
        this.contradictions = contradictions == null ? Collections.emptyList() : List.copyOf(contradictions);
        this.outcome = outcome != null ? outcome
            : (this.contradictions.isEmpty() ? ValidationOutcome.PASS : ValidationOutcome.FLAGGED);
        this.provider = provider;
        this.model = model;
        this.attempts = attempts;
        this.createdAt = createdAt;
    }

    public static String newId() {
        return "sr_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /**
     * Copy of this result carrying the validator's verdict.
     */
    public StageResult withContradictions(List<Contradiction> found) {
        List<Contradiction> list = found == null ? Collections.emptyList() : found;
        return new StageResult(id, stage, text, summary, facts,
            list.isEmpty() ? ValidationOutcome.PASS : ValidationOutcome.FLAGGED,
            list, provider, model, attempts, createdAt);
    }

    public String getId() {
        return id;
    }

    public StageKind getStage() {
        return stage;
    }

    public String getText() {
        return text;
    }

    public String getSummary() {
        return summary;
    }

    public ExtractedFacts getFacts() {
        return facts;
    }

    public ValidationOutcome getOutcome() {
        return outcome;
    }

    public List<Contradiction> getContradictions() {
        return contradictions;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public int getAttempts() {
        return attempts;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StageResult)) return false;
        StageResult that = (StageResult) o;
        return attempts == that.attempts
            && createdAt == that.createdAt
            && Objects.equals(id, that.id)
            && Objects.equals(stage, that.stage)
            && Objects.equals(text, that.text)
            && Objects.equals(summary, that.summary)
            && Objects.equals(facts, that.facts)
            && outcome == that.outcome
            && Objects.equals(contradictions, that.contradictions)
            && Objects.equals(provider, that.provider)
            && Objects.equals(model, that.model);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, stage, text, summary, facts, outcome, contradictions,
            provider, model, attempts, createdAt);
    }
}
