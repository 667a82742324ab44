package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * History entry written when a stage is regenerated: the results that were
 * discarded and, once the replacement commits, a unified diff of the stage text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StageRevision {

    private StageKind stage;
    private List<StageResult> discarded = new ArrayList<>();
    private String replacementResultId;
    private List<String> diff = new ArrayList<>();
    private long createdAt;

    public StageRevision() {
    }

    public StageRevision(StageKind stage, List<StageResult> discarded, long createdAt) {
        this.stage = stage;
        this.discarded = new ArrayList<>(discarded);
        this.createdAt = createdAt;
    }

    public StageKind getStage() {
        return stage;
    }

    public void setStage(StageKind stage) {
        this.stage = stage;
    }

    public List<StageResult> getDiscarded() {
        return discarded;
    }

    public void setDiscarded(List<StageResult> discarded) {
        this.discarded = discarded != null ? discarded : new ArrayList<>();
    }

    public String getReplacementResultId() {
        return replacementResultId;
    }

    public void setReplacementResultId(String replacementResultId) {
        this.replacementResultId = replacementResultId;
    }

    public List<String> getDiff() {
        return diff;
    }

    public void setDiff(List<String> diff) {
        this.diff = diff != null ? diff : new ArrayList<>();
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StageRevision)) return false;
        StageRevision that = (StageRevision) o;
        return createdAt == that.createdAt
            && Objects.equals(stage, that.stage)
            && Objects.equals(discarded, that.discarded)
            && Objects.equals(replacementResultId, that.replacementResultId)
            && Objects.equals(diff, that.diff);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, discarded, replacementResultId, diff, createdAt);
    }
}
