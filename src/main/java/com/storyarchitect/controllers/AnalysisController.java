package com.storyarchitect.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.AppLogger;
import com.storyarchitect.models.ProviderConfig;
import com.storyarchitect.pipeline.PipelineOrchestrator;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * POST /api/analyze-chapter
 * Body: { "text": "...", "provider": { "provider", "model", ... } }
 */
public class AnalysisController implements Controller {

    private final PipelineOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public AnalysisController(PipelineOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/analyze-chapter", this::analyze);
    }

    private void analyze(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            String text = body.path("text").asText(body.path("chapterText").asText(null));
            if (text == null || text.isBlank()) {
                ctx.status(400).json(Map.of("error", "text is required"));
                return;
            }
            ProviderConfig providerConfig = body.path("provider").isObject()
                ? objectMapper.treeToValue(body.get("provider"), ProviderConfig.class)
                : new ProviderConfig(body.path("provider").asText(null), body.path("model").asText(null));
            ctx.json(orchestrator.analyzeChapter(text, providerConfig, Controller.credential(ctx)));
        } catch (Exception e) {
            int status = Controller.statusFor(e);
            logger.warn("Chapter analysis failed: " + e.getMessage());
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ctx.status(status).json(Controller.errorBody(e));
        }
    }
}
