package com.storyarchitect.pipeline;

import com.storyarchitect.models.StageKind;

/**
 * A stage was cancelled between generation attempts. Nothing was persisted.
 */
public class StageCancelledException extends Exception {

    private final String projectId;
    private final StageKind stage;

    public StageCancelledException(String projectId, StageKind stage) {
        super("Generation of " + stage + " was cancelled for project " + projectId);
        this.projectId = projectId;
        this.stage = stage;
    }

    public String getProjectId() {
        return projectId;
    }

    public StageKind getStage() {
        return stage;
    }
}
