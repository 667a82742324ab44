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
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * OpenAI-compatible chat completions provider.
 * Handles: openai, moonshot, zhipu, alibaba, togetherai, lmstudio, custom
 */
public class OpenAiCompatibleChatProvider extends AbstractChatProvider {

    public static final Set<String> SUPPORTED_PROVIDERS = Set.of(
        "openai", "moonshot", "zhipu", "alibaba", "togetherai", "lmstudio", "custom"
    );

    private static final Set<String> KEY_REQUIRED = Set.of(
        "openai", "moonshot", "zhipu", "alibaba", "togetherai"
    );

    private static final Pattern VERSION_SUFFIX = Pattern.compile(".*/v\\d+$");
    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final String providerName;

    public OpenAiCompatibleChatProvider(ObjectMapper mapper, HttpClient httpClient, String providerName) {
        super(mapper, httpClient);
        this.providerName = providerName;
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    public static boolean supportsProvider(String provider) {
        return SUPPORTED_PROVIDERS.contains(provider);
    }

    @Override
    public String chat(Credential credential, GenerationOptions options, String prompt)
        throws GenerationException, InterruptedException {
        if (KEY_REQUIRED.contains(providerName) && !credential.isPresent()) {
            throw new AuthException("API key required for " + providerName);
        }
        String url = completionsUrl(options.getBaseUrl());

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", requireModel(options));

        ArrayNode messages = payload.putArray("messages");
        if (options.getSystemInstruction() != null && !options.getSystemInstruction().isBlank()) {
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", options.getSystemInstruction());
        }
        ObjectNode msg = messages.addObject();
        msg.put("role", "user");
        msg.put("content", prompt);

        if (options.isJsonOutput()) {
            payload.putObject("response_format").put("type", "json_object");
        }
        if (options.getTemperature() != null) {
            payload.put("temperature", options.getTemperature());
        }
        if (options.getMaxOutputTokens() != null) {
            payload.put("max_tokens", options.getMaxOutputTokens());
        }

        Map<String, String> headers = new HashMap<>();
        if (credential.isPresent()) {
            headers.put("Authorization", "Bearer " + credential.reveal());
        }
        JsonNode response = sendJsonPost(url, payload, headers, credential, options.getTimeoutMs());

        JsonNode choices = response.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode choice = choices.get(0);
            if ("content_filter".equals(choice.path("finish_reason").asText())) {
                throw new ContentPolicyException(providerName + " filtered the response");
            }
            JsonNode messageNode = choice.path("message");
            JsonNode refusal = messageNode.path("refusal");
            if (refusal.isTextual() && !refusal.asText().isBlank()) {
                throw new ContentPolicyException(providerName + " refused the request");
            }
            JsonNode content = messageNode.path("content");
            if (!content.isMissingNode() && !content.asText().isBlank()) {
                return content.asText();
            }
            JsonNode text = choice.path("text");
            if (!text.isMissingNode()) {
                return text.asText();
            }
        }
        throw new TransientException(providerName + " response contained no choices");
    }

    String completionsUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return defaultCompletionsUrl(providerName);
        }
        String url = normalizeBaseUrl(baseUrl, baseUrl);
        if (url.endsWith(COMPLETIONS_PATH)) {
            return url;
        }
        if (VERSION_SUFFIX.matcher(url).matches()) {
            return url + COMPLETIONS_PATH;
        }
        return url + "/v1" + COMPLETIONS_PATH;
    }

    private static String defaultCompletionsUrl(String provider) {
        switch (provider) {
            case "openai":
                return "https://api.openai.com/v1" + COMPLETIONS_PATH;
            case "moonshot":
                return "https://api.moonshot.cn/v1" + COMPLETIONS_PATH;
            case "zhipu":
                return "https://open.bigmodel.cn/api/paas/v4" + COMPLETIONS_PATH;
            case "alibaba":
                return "https://dashscope.aliyuncs.com/compatible-mode/v1" + COMPLETIONS_PATH;
            case "togetherai":
                return "https://api.together.xyz/v1" + COMPLETIONS_PATH;
            case "lmstudio":
            case "custom":
            default:
                return "http://localhost:1234/v1" + COMPLETIONS_PATH;
        }
    }
}
