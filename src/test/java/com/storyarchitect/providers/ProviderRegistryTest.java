package com.storyarchitect.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.providers.chat.ChatProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProviderRegistryTest {

    static class RecordingProvider implements ChatProvider {
        final List<String> prompts = new ArrayList<>();
        Credential lastCredential;

        @Override
        public String getProviderName() {
            return "fake";
        }

        @Override
        public String chat(Credential credential, GenerationOptions options, String prompt) {
            lastCredential = credential;
            prompts.add(prompt);
            return "reply from " + options.getModel();
        }
    }

    @Test
    void dispatchesToTheNamedProvider() throws Exception {
        RecordingProvider fake = new RecordingProvider();
        ProviderRegistry registry = new ProviderRegistry.Builder()
            .register(fake)
            .alias("pretend", "fake")
            .build();

        String reply = registry.generate(new GenerationRequest("Pretend", Credential.of("key"), "Hello",
            new GenerationOptions().setModel("m1")));

        assertEquals("reply from m1", reply);
        assertEquals(List.of("Hello"), fake.prompts);
        assertEquals("key", fake.lastCredential.reveal());
    }

    @Test
    void unknownProviderIsAConfigurationError() {
        ProviderRegistry registry = ProviderRegistry.withDefaults(new ObjectMapper());

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> registry.generate(new GenerationRequest("nope", Credential.none(), "Hello", null)));
        assertTrue(e.getMessage().contains("Unknown provider: nope"));
    }

    @Test
    void blankPromptIsRejectedBeforeAnyCall() {
        RecordingProvider fake = new RecordingProvider();
        ProviderRegistry registry = new ProviderRegistry.Builder().register(fake).build();

        assertThrows(ConfigurationException.class,
            () -> registry.generate(new GenerationRequest("fake", Credential.none(), "  ", null)));
        assertTrue(fake.prompts.isEmpty());
    }

    @Test
    void defaultsCoverTheBuiltInProvidersAndAliases() {
        ProviderRegistry registry = ProviderRegistry.withDefaults(new ObjectMapper());

        assertTrue(registry.supports("openai"));
        assertTrue(registry.supports("anthropic"));
        assertTrue(registry.supports("ollama"));
        assertTrue(registry.supports("lmstudio"));
        assertTrue(registry.supports("Google"));
        assertEquals("gemini", assertDoesNotThrow(() -> registry.resolve("google")).getProviderName());
        assertFalse(registry.supports(null));
    }
}
