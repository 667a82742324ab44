package com.storyarchitect.providers.chat;

import com.storyarchitect.providers.Credential;
import com.storyarchitect.providers.GenerationException;
import com.storyarchitect.providers.GenerationOptions;

/**
 * Interface for AI chat providers.
 * Each provider implementation handles the specific API format for that service.
 */
public interface ChatProvider {

    /**
     * Get the provider name this implementation handles.
     */
    String getProviderName();

    /**
     * Send one prompt and return the generated text.
     *
     * @param credential The provider credential (may be empty for local providers)
     * @param options Model, base URL, sampling and output settings
     * @param prompt The user prompt to send
     * @return The assistant's response text
     */
    String chat(Credential credential, GenerationOptions options, String prompt)
        throws GenerationException, InterruptedException;
}
