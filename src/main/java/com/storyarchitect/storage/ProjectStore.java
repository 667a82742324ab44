package com.storyarchitect.storage;

import com.storyarchitect.models.Project;
import com.storyarchitect.models.ProjectSummary;

import java.io.IOException;
import java.util.List;

/**
 * Durable project persistence. A save replaces the whole project; callers
 * never write partial stage results.
 */
public interface ProjectStore {

    Project load(String projectId) throws ProjectNotFoundException, IOException;

    void save(Project project) throws IOException;

    /**
     * Summaries of every stored project, newest first.
     */
    List<ProjectSummary> list() throws IOException;

    void delete(String projectId) throws ProjectNotFoundException, IOException;
}
