package com.storyarchitect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.controllers.AnalysisController;
import com.storyarchitect.controllers.Controller;
import com.storyarchitect.controllers.ProjectController;
import com.storyarchitect.knowledge.JsonFactExtractor;
import com.storyarchitect.knowledge.KnowledgeStore;
import com.storyarchitect.pipeline.PipelineOrchestrator;
import com.storyarchitect.pipeline.PipelineSettings;
import com.storyarchitect.pipeline.Sleeper;
import com.storyarchitect.prompt.OutlineParser;
import com.storyarchitect.prompt.PromptBudget;
import com.storyarchitect.prompt.PromptComposer;
import com.storyarchitect.providers.ProviderRegistry;
import com.storyarchitect.storage.JsonProjectStore;
import com.storyarchitect.validation.ConsistencyValidator;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();
            printBanner(config);

            PipelineOrchestrator orchestrator = createOrchestrator(config);

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                new ProjectController(orchestrator, objectMapper),
                new AnalysisController(orchestrator, objectMapper)
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }
            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Projects: " + config.getProjectsPath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Story Architect: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static PipelineOrchestrator createOrchestrator(AppConfig config) {
        PipelineSettings settings = config.getPipelineSettings();
        ProviderRegistry registry = ProviderRegistry.withDefaults(objectMapper);
        logger.info("Providers registered: " + String.join(", ", registry.providerNames()));
        return new PipelineOrchestrator(
            new JsonProjectStore(config.getProjectsPath(), objectMapper),
            registry,
            new PromptComposer(new PromptBudget(settings.getPromptBudgetTokens()), new OutlineParser(objectMapper)),
            new KnowledgeStore(new JsonFactExtractor(objectMapper), objectMapper),
            new ConsistencyValidator(),
            settings,
            Sleeper.system(),
            objectMapper
        );
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Story Architect v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
        PipelineSettings settings = config.getPipelineSettings();
        logger.info("Pipeline: " + settings.getDefaultChapterCount() + " chapters by default, "
            + settings.getRetryPolicy().getMaxAttempts() + " attempts per stage, prompt budget "
            + settings.getPromptBudgetTokens() + " tokens, blocking on "
            + (settings.getBlockingSeverity() != null ? settings.getBlockingSeverity() : "nothing"));
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(Controller.statusFor(e)).json(Controller.errorBody(e));
        });
    }
}
