package com.storyarchitect.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.AppLogger;
import com.storyarchitect.models.Project;
import com.storyarchitect.models.ProjectSummary;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * One pretty-printed JSON document per project:
 *   {projectsDir}/{projectId}.json
 */
public class JsonProjectStore implements ProjectStore {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String EXTENSION = ".json";

    private final Path projectsDir;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public JsonProjectStore(Path projectsDir, ObjectMapper objectMapper) {
        this.projectsDir = projectsDir;
        this.objectMapper = objectMapper;
    }

    public Path getProjectsDir() {
        return projectsDir;
    }

    @Override
    public Project load(String projectId) throws ProjectNotFoundException, IOException {
        Path file = fileFor(projectId);
        if (file == null || !Files.isRegularFile(file)) {
            throw new ProjectNotFoundException(projectId);
        }
        return JsonStorage.read(objectMapper, file, Project.class);
    }

    @Override
    public void save(Project project) throws IOException {
        Path file = fileFor(project.getId());
        if (file == null) {
            throw new IOException("Invalid project id: " + project.getId());
        }
        JsonStorage.writeAtomic(objectMapper, file, project);
    }

    @Override
    public List<ProjectSummary> list() throws IOException {
        List<ProjectSummary> summaries = new ArrayList<>();
        if (!Files.isDirectory(projectsDir)) {
            return summaries;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(projectsDir, "*" + EXTENSION)) {
            for (Path file : stream) {
                try {
                    summaries.add(ProjectSummary.of(JsonStorage.read(objectMapper, file, Project.class)));
                } catch (IOException e) {
                    logger.warn("Failed to read project file: " + file.getFileName() + " (" + e.getMessage() + ")");
                }
            }
        }
        summaries.sort(Comparator.comparingLong(ProjectSummary::getCreatedAt).reversed());
        return summaries;
    }

    @Override
    public void delete(String projectId) throws ProjectNotFoundException, IOException {
        Path file = fileFor(projectId);
        if (file == null || !Files.deleteIfExists(file)) {
            throw new ProjectNotFoundException(projectId);
        }
        logger.info("Project deleted: " + projectId);
    }

    private Path fileFor(String projectId) {
        if (projectId == null || !SAFE_ID.matcher(projectId).matches()) {
            return null;
        }
        return projectsDir.resolve(projectId + EXTENSION);
    }
}
