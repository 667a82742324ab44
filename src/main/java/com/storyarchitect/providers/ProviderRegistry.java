package com.storyarchitect.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.AppLogger;
import com.storyarchitect.providers.chat.AnthropicChatProvider;
import com.storyarchitect.providers.chat.ChatProvider;
import com.storyarchitect.providers.chat.GeminiChatProvider;
import com.storyarchitect.providers.chat.OllamaChatProvider;
import com.storyarchitect.providers.chat.OpenAiCompatibleChatProvider;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static registry of chat providers, built once at startup. All providers
 * share one {@link HttpClient}, which is safe for concurrent use across
 * projects. Unknown provider keys fail fast with {@link ConfigurationException}.
 */
public class ProviderRegistry implements GenerationGateway {

    private final Map<String, ChatProvider> providers;
    private final Map<String, String> aliases;

    private ProviderRegistry(Map<String, ChatProvider> providers, Map<String, String> aliases) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    /**
     * Registry with every built-in provider.
     */
    public static ProviderRegistry withDefaults(ObjectMapper mapper) {
        HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build();

        Builder builder = new Builder()
            .register(new AnthropicChatProvider(mapper, httpClient))
            .register(new GeminiChatProvider(mapper, httpClient))
            .register(new OllamaChatProvider(mapper, httpClient))
            .alias("google", "gemini")
            .alias("claude", "anthropic");
        for (String name : new TreeSet<>(OpenAiCompatibleChatProvider.SUPPORTED_PROVIDERS)) {
            builder.register(new OpenAiCompatibleChatProvider(mapper, httpClient, name));
        }
        return builder.build();
    }

    @Override
    public String generate(GenerationRequest request) throws GenerationException, InterruptedException {
        if (request == null) {
            throw new ConfigurationException("Generation request is required");
        }
        ChatProvider provider = resolve(request.getProvider());
        String prompt = request.getPrompt();
        if (prompt == null || prompt.isBlank()) {
            throw new ConfigurationException("Prompt is required");
        }
        AppLogger.get().info("Generating with " + provider.getProviderName()
            + " (model " + request.getOptions().getModel() + ", " + prompt.length() + " prompt chars)");
        return provider.chat(request.getCredential(), request.getOptions(), prompt);
    }

    public ChatProvider resolve(String providerName) throws ConfigurationException {
        if (providerName == null || providerName.isBlank()) {
            throw new ConfigurationException("Provider is required");
        }
        String key = providerName.trim().toLowerCase(Locale.ROOT);
        key = aliases.getOrDefault(key, key);
        ChatProvider provider = providers.get(key);
        if (provider == null) {
            throw new ConfigurationException("Unknown provider: " + providerName
                + " (registered: " + String.join(", ", providerNames()) + ")");
        }
        return provider;
    }

    public boolean supports(String providerName) {
        if (providerName == null) {
            return false;
        }
        String key = providerName.trim().toLowerCase(Locale.ROOT);
        return providers.containsKey(aliases.getOrDefault(key, key));
    }

    public Set<String> providerNames() {
        return new TreeSet<>(providers.keySet());
    }

    public static class Builder {
        private final Map<String, ChatProvider> providers = new LinkedHashMap<>();
        private final Map<String, String> aliases = new LinkedHashMap<>();

        public Builder register(ChatProvider provider) {
            providers.put(provider.getProviderName().toLowerCase(Locale.ROOT), provider);
            return this;
        }

        public Builder alias(String alias, String target) {
            aliases.put(alias.toLowerCase(Locale.ROOT), target.toLowerCase(Locale.ROOT));
            return this;
        }

        public ProviderRegistry build() {
            return new ProviderRegistry(providers, aliases);
        }
    }
}
