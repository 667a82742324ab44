package com.storyarchitect.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.providers.AuthException;
import com.storyarchitect.providers.ConfigurationException;
import com.storyarchitect.providers.ContentPolicyException;
import com.storyarchitect.providers.Credential;
import com.storyarchitect.providers.GenerationException;
import com.storyarchitect.providers.GenerationOptions;
import com.storyarchitect.providers.RateLimitException;
import com.storyarchitect.providers.TransientException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Abstract base class for chat providers with shared HTTP logic and the
 * mapping from HTTP failures to {@link GenerationException} kinds.
 */
public abstract class AbstractChatProvider implements ChatProvider {

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 300;

    private static final int MAX_ERROR_DETAIL = 300;
    private static final List<String> POLICY_MARKERS = List.of(
        "content_policy", "content policy", "content_filter", "safety", "policy_violation",
        "responsible ai", "prohibited_content"
    );

    protected AbstractChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    /**
     * Send a JSON POST request and return the parsed response. Exactly one
     * attempt; failures are classified, not retried. The credential is only
     * used to mask itself out of error messages.
     */
    protected JsonNode sendJsonPost(String url, JsonNode payload, Map<String, String> headers,
                                    Credential credential, Integer timeoutMs)
        throws GenerationException, InterruptedException {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(resolveTimeout(timeoutMs))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));
            if (headers != null) {
                for (Map.Entry<String, String> header : headers.entrySet()) {
                    if (header.getValue() != null && !header.getValue().isBlank()) {
                        builder.header(header.getKey(), header.getValue());
                    }
                }
            }
            request = builder.build();
        } catch (IllegalArgumentException | IOException e) {
            throw new ConfigurationException(getProviderName() + " request could not be built: "
                + mask(e.getMessage(), credential));
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientException(getProviderName() + " request failed: " + e.getClass().getSimpleName(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            Long retryAfterMs = response.headers().firstValue("retry-after")
                .map(AbstractChatProvider::parseRetryAfter)
                .orElse(null);
            throw classifyFailure(getProviderName(), status, response.body(), retryAfterMs, credential);
        }
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new TransientException(getProviderName() + " returned an unreadable response", e);
        }
    }

    /**
     * Map a non-2xx response to the exception kind the orchestrator's retry policy expects.
     */
    static GenerationException classifyFailure(String provider, int status, String body, Long retryAfterMs,
                                               Credential credential) {
        String detail = mask(errorDetail(body), credential);
        String message = provider + " request failed (" + status + ")" + (detail.isEmpty() ? "" : ": " + detail);
        if (status == 401 || status == 403) {
            return new AuthException(message);
        }
        if (status == 429) {
            return new RateLimitException(message, retryAfterMs);
        }
        if (status == 408 || status >= 500) {
            return new TransientException(message);
        }
        if (mentionsPolicy(body)) {
            return new ContentPolicyException(message);
        }
        return new ConfigurationException(message);
    }

    /**
     * Replace every occurrence of the secret with {@code ****}.
     */
    static String mask(String text, Credential credential) {
        if (text == null || credential == null || !credential.isPresent()) {
            return text;
        }
        return text.replace(credential.reveal(), "****");
    }

    static boolean mentionsPolicy(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : POLICY_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String raw = body.trim();
        JsonNode node;
        try {
            node = new ObjectMapper().readTree(raw);
        } catch (IOException e) {
            return truncate(raw);
        }
        JsonNode message = node.path("error").path("message");
        if (message.isTextual()) {
            return truncate(message.asText());
        }
        if (node.path("error").isTextual()) {
            return truncate(node.path("error").asText());
        }
        return truncate(raw);
    }

    private static String truncate(String detail) {
        return detail.length() > MAX_ERROR_DETAIL ? detail.substring(0, MAX_ERROR_DETAIL) + "..." : detail;
    }

    private static Long parseRetryAfter(String value) {
        try {
            return Long.parseLong(value.trim()) * 1000L;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected Duration resolveTimeout(Integer timeoutMs) {
        if (timeoutMs != null && timeoutMs > 0) {
            return Duration.ofMillis(timeoutMs);
        }
        return Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    protected String requireModel(GenerationOptions options) throws ConfigurationException {
        String model = options.getModel();
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("Model is required for " + getProviderName());
        }
        return model;
    }
}
