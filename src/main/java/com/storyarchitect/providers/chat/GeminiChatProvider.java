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
import java.util.Map;
import java.util.Set;

/**
 * Google Gemini generateContent API. The key travels in the
 * {@code x-goog-api-key} header, never in the URL.
 */
public class GeminiChatProvider extends AbstractChatProvider {

    private static final Set<String> BLOCKED_FINISH_REASONS = Set.of(
        "SAFETY", "PROHIBITED_CONTENT", "BLOCKLIST", "SPII", "RECITATION"
    );

    public GeminiChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public String getProviderName() {
        return "gemini";
    }

    @Override
    public String chat(Credential credential, GenerationOptions options, String prompt)
        throws GenerationException, InterruptedException {
        if (!credential.isPresent()) {
            throw new AuthException("API key required for gemini");
        }
        String url = normalizeGeminiBaseUrl(options.getBaseUrl(), "https://generativelanguage.googleapis.com")
            + "/v1beta/models/" + requireModel(options) + ":generateContent";

        ObjectNode payload = mapper.createObjectNode();
        if (options.getSystemInstruction() != null && !options.getSystemInstruction().isBlank()) {
            payload.putObject("systemInstruction")
                .putArray("parts")
                .addObject()
                .put("text", options.getSystemInstruction());
        }
        ArrayNode contents = payload.putArray("contents");
        ObjectNode content = contents.addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", prompt);

        ObjectNode generationConfig = payload.putObject("generationConfig");
        if (options.getTemperature() != null) {
            generationConfig.put("temperature", options.getTemperature());
        }
        if (options.getMaxOutputTokens() != null) {
            generationConfig.put("maxOutputTokens", options.getMaxOutputTokens());
        }
        if (options.isJsonOutput()) {
            generationConfig.put("responseMimeType", "application/json");
        }

        JsonNode response = sendJsonPost(url, payload,
            Map.of("x-goog-api-key", credential.reveal()), credential, options.getTimeoutMs());

        String blockReason = response.path("promptFeedback").path("blockReason").asText("");
        if (!blockReason.isEmpty()) {
            throw new ContentPolicyException("gemini blocked the prompt: " + blockReason);
        }
        JsonNode candidates = response.path("candidates");
        if (candidates.isArray() && candidates.size() > 0) {
            JsonNode first = candidates.get(0);
            String finishReason = first.path("finishReason").asText("");
            if (BLOCKED_FINISH_REASONS.contains(finishReason)) {
                throw new ContentPolicyException("gemini stopped generation: " + finishReason);
            }
            JsonNode partsNode = first.path("content").path("parts");
            if (partsNode.isArray() && partsNode.size() > 0) {
                StringBuilder text = new StringBuilder();
                for (JsonNode part : partsNode) {
                    text.append(part.path("text").asText(""));
                }
                return text.toString();
            }
        }
        throw new TransientException("gemini response contained no candidates");
    }

    private String normalizeGeminiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1beta/models")) {
            url = url.substring(0, url.length() - 14);
        }
        if (url.endsWith("/v1beta")) {
            url = url.substring(0, url.length() - 7);
        }
        return url;
    }
}
