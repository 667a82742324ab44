package com.storyarchitect.providers;

/**
 * One provider call. Lives only for the duration of the call.
 */
public final class GenerationRequest {

    private final String provider;
    private final Credential credential;
    private final String prompt;
    private final GenerationOptions options;

    public GenerationRequest(String provider, Credential credential, String prompt, GenerationOptions options) {
        this.provider = provider;
        this.credential = credential != null ? credential : Credential.none();
        this.prompt = prompt;
        this.options = options != null ? options : new GenerationOptions();
    }

    public String getProvider() {
        return provider;
    }

    public Credential getCredential() {
        return credential;
    }

    public String getPrompt() {
        return prompt;
    }

    public GenerationOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        int length = prompt == null ? 0 : prompt.length();
        return "GenerationRequest[provider=" + provider + ", model=" + options.getModel()
            + ", promptChars=" + length + "]";
    }
}
