package com.storyarchitect.prompt;

/**
 * Token-equivalent size limit for composed prompts. Tokens are estimated at
 * four characters each, rounded up.
 */
public final class PromptBudget {

    public static final int CHARS_PER_TOKEN = 4;
    public static final int DEFAULT_MAX_TOKENS = 6000;

    private final int maxTokens;

    public PromptBudget(int maxTokens) {
        if (maxTokens < 256) {
            throw new IllegalArgumentException("Prompt budget must be at least 256 tokens, got " + maxTokens);
        }
        this.maxTokens = maxTokens;
    }

    public static PromptBudget defaults() {
        return new PromptBudget(DEFAULT_MAX_TOKENS);
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int maxChars() {
        return maxTokens * CHARS_PER_TOKEN;
    }

    public static int estimateTokens(int chars) {
        return (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static int estimateTokens(String text) {
        return text == null ? 0 : estimateTokens(text.length());
    }
}
