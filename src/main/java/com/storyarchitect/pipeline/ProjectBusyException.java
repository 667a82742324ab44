package com.storyarchitect.pipeline;

/**
 * Another command is already running on the project.
 */
public class ProjectBusyException extends RuntimeException {

    private final String projectId;

    public ProjectBusyException(String projectId) {
        super("Project is busy: " + projectId);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
