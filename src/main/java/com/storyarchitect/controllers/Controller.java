package com.storyarchitect.controllers;

import com.storyarchitect.pipeline.ProjectBusyException;
import com.storyarchitect.pipeline.StageCancelledException;
import com.storyarchitect.providers.Credential;
import com.storyarchitect.providers.GenerationException;
import com.storyarchitect.storage.ProjectNotFoundException;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    String API_KEY_HEADER = "X-Api-Key";

    /**
     * Register this controller's routes with the Javalin app.
     */
    void registerRoutes(Javalin app);

    /**
     * Safe error body helper that handles null exception messages.
     * Use this instead of Map.of("error", e.getMessage()) to prevent NPE.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        if (e instanceof GenerationException) {
            return Map.of("error", m, "kind", ((GenerationException) e).getKind().name());
        }
        return Map.of("error", m);
    }

    static int statusFor(Exception e) {
        if (e instanceof ProjectNotFoundException) {
            return 404;
        }
        if (e instanceof ProjectBusyException || e instanceof StageCancelledException) {
            return 409;
        }
        if (e instanceof IllegalArgumentException || e instanceof IllegalStateException) {
            return 400;
        }
        if (e instanceof GenerationException) {
            switch (((GenerationException) e).getKind()) {
                case CONFIGURATION:
                    return 400;
                case AUTH:
                    return 401;
                case CONTENT_POLICY:
                    return 422;
                case RATE_LIMIT:
                case TRANSIENT:
                    return 503;
                default:
                    return 500;
            }
        }
        return 500;
    }

    /**
     * The per-request provider key. Never logged or stored.
     */
    static Credential credential(Context ctx) {
        return Credential.of(ctx.header(API_KEY_HEADER));
    }
}
