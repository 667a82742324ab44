package com.storyarchitect.storage;

public class ProjectNotFoundException extends Exception {

    private final String projectId;

    public ProjectNotFoundException(String projectId) {
        super("Project not found: " + projectId);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
