package com.storyarchitect.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storyarchitect.providers.Credential;
import com.storyarchitect.providers.GenerationException;
import com.storyarchitect.providers.GenerationOptions;
import com.storyarchitect.providers.TransientException;

import java.net.http.HttpClient;
import java.util.Map;

/**
 * Local Ollama server; no credential.
 */
public class OllamaChatProvider extends AbstractChatProvider {

    public OllamaChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }

    @Override
    public String chat(Credential credential, GenerationOptions options, String prompt)
        throws GenerationException, InterruptedException {
        String url = normalizeBaseUrl(options.getBaseUrl(), "http://localhost:11434") + "/api/chat";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", requireModel(options));
        payload.put("stream", false);
        if (options.isJsonOutput()) {
            payload.put("format", "json");
        }
        ObjectNode modelOptions = payload.putObject("options");
        if (options.getTemperature() != null) {
            modelOptions.put("temperature", options.getTemperature());
        }
        if (options.getMaxOutputTokens() != null) {
            modelOptions.put("num_predict", options.getMaxOutputTokens());
        }

        ArrayNode messages = payload.putArray("messages");
        if (options.getSystemInstruction() != null && !options.getSystemInstruction().isBlank()) {
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", options.getSystemInstruction());
        }
        ObjectNode msg = messages.addObject();
        msg.put("role", "user");
        msg.put("content", prompt);

        JsonNode response = sendJsonPost(url, payload, Map.of(), credential, options.getTimeoutMs());
        JsonNode content = response.path("message").path("content");
        if (!content.isMissingNode()) {
            return content.asText();
        }
        JsonNode text = response.path("response");
        if (!text.isMissingNode()) {
            return text.asText();
        }
        throw new TransientException("ollama response contained no message");
    }
}
