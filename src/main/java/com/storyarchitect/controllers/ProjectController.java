package com.storyarchitect.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.AppLogger;
import com.storyarchitect.knowledge.KnowledgeFilter;
import com.storyarchitect.models.EntityCategory;
import com.storyarchitect.models.Project;
import com.storyarchitect.models.ProviderConfig;
import com.storyarchitect.models.StageKind;
import com.storyarchitect.models.StoryConcept;
import com.storyarchitect.pipeline.PipelineOrchestrator;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * REST controller for story projects.
 *
 * Endpoints:
 *   POST   /api/projects                      Start a project (generates the concept)
 *   GET    /api/projects                      List projects, newest first
 *   GET    /api/projects/{id}                 Full project
 *   DELETE /api/projects/{id}                 Delete a project (204, no body)
 *   POST   /api/projects/{id}/advance         Generate the next stage
 *   POST   /api/projects/{id}/regenerate      Regenerate ?stage=... and discard later stages
 *   POST   /api/projects/{id}/cancel          Cancel the in-flight stage
 *   GET    /api/projects/{id}/knowledge       Query story knowledge
 *
 * Generation endpoints read the provider key from the X-Api-Key header.
 */
public class ProjectController implements Controller {

    private final PipelineOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public ProjectController(PipelineOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/projects", this::startProject);
        app.get("/api/projects", this::listProjects);
        app.get("/api/projects/{id}", this::getProject);
        app.delete("/api/projects/{id}", this::deleteProject);
        app.post("/api/projects/{id}/advance", this::advance);
        app.post("/api/projects/{id}/regenerate", this::regenerate);
        app.post("/api/projects/{id}/cancel", this::cancel);
        app.get("/api/projects/{id}/knowledge", this::knowledge);
    }

    /**
     * POST /api/projects
     * Body: { "title": "...", "concept": { "genre", "theme", "coreIdea", "style", "premise" },
     *         "provider": { "provider", "model", "baseUrl", ... }, "chapterCount": 10 }
     * Concept fields may also be given at the top level.
     */
    private void startProject(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            JsonNode conceptNode = body.path("concept").isObject() ? body.get("concept") : body;
            StoryConcept concept = objectMapper.treeToValue(conceptNode, StoryConcept.class);
            ProviderConfig providerConfig = body.path("provider").isObject()
                ? objectMapper.treeToValue(body.get("provider"), ProviderConfig.class)
                : new ProviderConfig(body.path("provider").asText(null), body.path("model").asText(null));
            Integer chapterCount = body.hasNonNull("chapterCount") ? body.get("chapterCount").asInt() : null;

            Project project = orchestrator.startProject(body.path("title").asText(null), concept,
                providerConfig, chapterCount, Controller.credential(ctx));
            ctx.status(201).json(project);
        } catch (Exception e) {
            respondError(ctx, "start project", e);
        }
    }

    private void listProjects(Context ctx) {
        try {
            ctx.json(orchestrator.listProjects());
        } catch (Exception e) {
            respondError(ctx, "list projects", e);
        }
    }

    private void getProject(Context ctx) {
        try {
            ctx.json(orchestrator.getProject(ctx.pathParam("id")));
        } catch (Exception e) {
            respondError(ctx, "load project", e);
        }
    }

    private void deleteProject(Context ctx) {
        try {
            String projectId = ctx.pathParam("id");
            orchestrator.deleteProject(projectId);
            ctx.status(204);
        } catch (Exception e) {
            respondError(ctx, "delete project", e);
        }
    }

    private void advance(Context ctx) {
        try {
            ctx.json(orchestrator.advanceStage(ctx.pathParam("id"), Controller.credential(ctx)));
        } catch (Exception e) {
            respondError(ctx, "advance project", e);
        }
    }

    /**
     * POST /api/projects/{id}/regenerate?stage=chapter-3
     */
    private void regenerate(Context ctx) {
        try {
            String stage = ctx.queryParam("stage");
            if (stage == null || stage.isBlank()) {
                ctx.status(400).json(Map.of("error", "stage is required"));
                return;
            }
            ctx.json(orchestrator.regenerateStage(ctx.pathParam("id"), StageKind.parse(stage),
                Controller.credential(ctx)));
        } catch (Exception e) {
            respondError(ctx, "regenerate stage", e);
        }
    }

    private void cancel(Context ctx) {
        boolean cancelled = orchestrator.cancel(ctx.pathParam("id"));
        ctx.json(Map.of("cancelled", cancelled));
    }

    /**
     * GET /api/projects/{id}/knowledge?category=&name=&sinceChapter=&openThreadsOnly=
     */
    private void knowledge(Context ctx) {
        try {
            KnowledgeFilter filter = KnowledgeFilter.all();
            String category = ctx.queryParam("category");
            if (category != null && !category.isBlank()) {
                filter.category(EntityCategory.fromString(category));
            }
            filter.name(ctx.queryParam("name"));
            String since = ctx.queryParam("sinceChapter");
            if (since != null && !since.isBlank()) {
                filter.touchedSinceChapter(Integer.parseInt(since.trim()));
            }
            filter.openThreadsOnly(Boolean.parseBoolean(ctx.queryParam("openThreadsOnly")));
            ctx.json(orchestrator.queryKnowledge(ctx.pathParam("id"), filter));
        } catch (Exception e) {
            respondError(ctx, "query knowledge", e);
        }
    }

    private void respondError(Context ctx, String action, Exception e) {
        int status = Controller.statusFor(e);
        if (status >= 500) {
            logger.error("Failed to " + action + ": " + e.getMessage(), e);
        } else {
            logger.warn("Failed to " + action + ": " + e.getMessage());
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        ctx.status(status).json(Controller.errorBody(e));
    }
}
