package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Lightweight listing entry for a stored project.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectSummary {

    private String id;
    private String title;
    private long createdAt;
    private PipelineStatus status;
    private StageKind nextStage;

    public ProjectSummary() {
    }

    public static ProjectSummary of(Project project) {
        ProjectSummary summary = new ProjectSummary();
        summary.setId(project.getId());
        summary.setTitle(project.getTitle());
        summary.setCreatedAt(project.getCreatedAt());
        summary.setStatus(project.getStatus());
        summary.setNextStage(project.getNextStage());
        return summary;
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

    public PipelineStatus getStatus() {
        return status;
    }

    public void setStatus(PipelineStatus status) {
        this.status = status;
    }

    public StageKind getNextStage() {
        return nextStage;
    }

    public void setNextStage(StageKind nextStage) {
        this.nextStage = nextStage;
    }
}
