package com.storyarchitect.prompt;

/**
 * Provider-neutral prompt: a system instruction and a body, plus whether the
 * caller should ask the provider for JSON output.
 */
public final class ComposedPrompt {

    private final String systemInstruction;
    private final String body;
    private final boolean jsonOutput;

    public ComposedPrompt(String systemInstruction, String body, boolean jsonOutput) {
        this.systemInstruction = systemInstruction != null ? systemInstruction : "";
        this.body = body != null ? body : "";
        this.jsonOutput = jsonOutput;
    }

    public String getSystemInstruction() {
        return systemInstruction;
    }

    public String getBody() {
        return body;
    }

    public boolean isJsonOutput() {
        return jsonOutput;
    }

    public int estimatedTokens() {
        return PromptBudget.estimateTokens(systemInstruction.length() + body.length());
    }

    @Override
    public String toString() {
        return "ComposedPrompt[" + estimatedTokens() + " tokens, json=" + jsonOutput + "]";
    }
}
