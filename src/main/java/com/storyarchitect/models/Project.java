package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A story project: its concept, pipeline position, committed stage results
 * and the knowledge extracted from them. Persisted as a single document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Project {

    private String id;
    private String title;
    private long createdAt;
    private long updatedAt;
    private StoryConcept concept;
    private ProviderConfig providerConfig;
    private int chapterCount;
    private PipelineStatus status = PipelineStatus.IDLE;
    private StageKind nextStage;
    private List<StageResult> stageResults = new ArrayList<>();
    private StoryKnowledge knowledge = new StoryKnowledge();
    private FailureInfo lastFailure;
    private List<StageRevision> revisions = new ArrayList<>();

    public static String newId() {
        return "story_" + UUID.randomUUID();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public StoryConcept getConcept() {
        return concept;
    }

    public void setConcept(StoryConcept concept) {
        this.concept = concept;
    }

    public ProviderConfig getProviderConfig() {
        return providerConfig;
    }

    public void setProviderConfig(ProviderConfig providerConfig) {
        this.providerConfig = providerConfig;
    }

    public int getChapterCount() {
        return chapterCount;
    }

    public void setChapterCount(int chapterCount) {
        this.chapterCount = chapterCount;
    }

    public PipelineStatus getStatus() {
        return status;
    }

    public void setStatus(PipelineStatus status) {
        this.status = status;
    }

    /**
     * The stage the next advance will generate; null once the project is complete.
     */
    public StageKind getNextStage() {
        return nextStage;
    }

    public void setNextStage(StageKind nextStage) {
        this.nextStage = nextStage;
    }

    public List<StageResult> getStageResults() {
        return stageResults;
    }

    public void setStageResults(List<StageResult> stageResults) {
        this.stageResults = stageResults != null ? stageResults : new ArrayList<>();
    }

    public StoryKnowledge getKnowledge() {
        return knowledge;
    }

    public void setKnowledge(StoryKnowledge knowledge) {
        this.knowledge = knowledge != null ? knowledge : new StoryKnowledge();
    }

    public FailureInfo getLastFailure() {
        return lastFailure;
    }

    public void setLastFailure(FailureInfo lastFailure) {
        this.lastFailure = lastFailure;
    }

    public List<StageRevision> getRevisions() {
        return revisions;
    }

    public void setRevisions(List<StageRevision> revisions) {
        this.revisions = revisions != null ? revisions : new ArrayList<>();
    }

    @JsonIgnore
    public StageResult resultFor(StageKind stage) {
        for (StageResult result : stageResults) {
            if (result.getStage().equals(stage)) {
                return result;
            }
        }
        return null;
    }

    @JsonIgnore
    public int indexOf(StageKind stage) {
        for (int i = 0; i < stageResults.size(); i++) {
            if (stageResults.get(i).getStage().equals(stage)) {
                return i;
            }
        }
        return -1;
    }

    @JsonIgnore
    public boolean isComplete() {
        return status == PipelineStatus.COMPLETE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Project)) return false;
        Project project = (Project) o;
        return createdAt == project.createdAt
            && updatedAt == project.updatedAt
            && chapterCount == project.chapterCount
            && Objects.equals(id, project.id)
            && Objects.equals(title, project.title)
            && Objects.equals(concept, project.concept)
            && Objects.equals(providerConfig, project.providerConfig)
            && status == project.status
            && Objects.equals(nextStage, project.nextStage)
            && Objects.equals(stageResults, project.stageResults)
            && Objects.equals(knowledge, project.knowledge)
            && Objects.equals(lastFailure, project.lastFailure)
            && Objects.equals(revisions, project.revisions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, createdAt, updatedAt, concept, providerConfig, chapterCount,
            status, nextStage, stageResults, knowledge, lastFailure, revisions);
    }
}
