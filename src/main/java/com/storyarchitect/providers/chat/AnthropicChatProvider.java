package com.storyarchitect.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storyarchitect.providers.AuthException;
import com.storyarchitect.providers.ContentPolicyException;
import com.storyarchitect.providers.Credential;
import com.storyarchitect.providers.GenerationException;
import com.storyarchitect.providers.GenerationOptions;
import com.storyarchitect.providers.TransientException;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

public class AnthropicChatProvider extends AbstractChatProvider {

    private static final int DEFAULT_MAX_TOKENS = 4096;

    public AnthropicChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public String getProviderName() {
        return "anthropic";
    }

    @Override
    public String chat(Credential credential, GenerationOptions options, String prompt)
        throws GenerationException, InterruptedException {
        if (!credential.isPresent()) {
            throw new AuthException("API key required for anthropic");
        }
        String url = normalizeBaseUrl(options.getBaseUrl(), "https://api.anthropic.com") + "/v1/messages";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", requireModel(options));
        payload.put("max_tokens", options.getMaxOutputTokens() != null
            ? options.getMaxOutputTokens()
            : DEFAULT_MAX_TOKENS);
        if (options.getTemperature() != null) {
            payload.put("temperature", options.getTemperature());
        }
        // Anthropic takes the system prompt separately from the messages
        if (options.getSystemInstruction() != null && !options.getSystemInstruction().isBlank()) {
            payload.put("system", options.getSystemInstruction());
        }

        ArrayNode messages = payload.putArray("messages");
        ObjectNode msg = messages.addObject();
        msg.put("role", "user");
        msg.put("content", prompt);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-api-key", credential.reveal());
        headers.put("anthropic-version", "2023-06-01");
        JsonNode response = sendJsonPost(url, payload, headers, credential, options.getTimeoutMs());

        if ("refusal".equals(response.path("stop_reason").asText())) {
            throw new ContentPolicyException("anthropic refused the request");
        }
        JsonNode content = response.path("content");
        if (content.isArray() && content.size() > 0) {
            JsonNode text = content.get(0).path("text");
            if (!text.isMissingNode()) {
                return text.asText();
            }
        }
        throw new TransientException("anthropic response contained no text");
    }
}
