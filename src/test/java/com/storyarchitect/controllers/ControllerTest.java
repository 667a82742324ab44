package com.storyarchitect.controllers;

import com.storyarchitect.models.StageKind;
import com.storyarchitect.pipeline.ProjectBusyException;
import com.storyarchitect.pipeline.StageCancelledException;
import com.storyarchitect.providers.AuthException;
import com.storyarchitect.providers.ConfigurationException;
import com.storyarchitect.providers.ContentPolicyException;
import com.storyarchitect.providers.RateLimitException;
import com.storyarchitect.storage.ProjectNotFoundException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ControllerTest {

    @Test
    void mapsFailuresToHttpStatus() {
        assertEquals(404, Controller.statusFor(new ProjectNotFoundException("story_1")));
        assertEquals(409, Controller.statusFor(new ProjectBusyException("story_1")));
        assertEquals(409, Controller.statusFor(new StageCancelledException("story_1", StageKind.OUTLINE)));
        assertEquals(400, Controller.statusFor(new IllegalArgumentException("bad stage")));
        assertEquals(400, Controller.statusFor(new ConfigurationException("Provider is required")));
        assertEquals(401, Controller.statusFor(new AuthException("Invalid key")));
        assertEquals(422, Controller.statusFor(new ContentPolicyException("blocked")));
        assertEquals(503, Controller.statusFor(new RateLimitException("429")));
        assertEquals(500, Controller.statusFor(new IOException("disk full")));
    }

    @Test
    void errorBodyNamesTheGenerationKind() {
        Map<String, Object> body = Controller.errorBody(new AuthException("Invalid key"));

        assertEquals("Invalid key", body.get("error"));
        assertEquals("AUTH", body.get("kind"));
        assertEquals("NullPointerException", Controller.errorBody(new NullPointerException()).get("error"));
    }
}
