package com.storyarchitect.pipeline;

import com.storyarchitect.models.Severity;
import com.storyarchitect.prompt.PromptBudget;

/**
 * Tunables of the generation pipeline.
 */
public final class PipelineSettings {

    public static final int DEFAULT_CHAPTER_COUNT = 10;

    private final int defaultChapterCount;
    private final RetryPolicy retryPolicy;
    private final int promptBudgetTokens;
    private final Severity blockingSeverity;

    private PipelineSettings(Builder builder) {
        this.defaultChapterCount = builder.defaultChapterCount;
        this.retryPolicy = builder.retryPolicy;
        this.promptBudgetTokens = builder.promptBudgetTokens;
        this.blockingSeverity = builder.blockingSeverity;
    }

    public static PipelineSettings defaults() {
        return new Builder().build();
    }

    public int getDefaultChapterCount() {
        return defaultChapterCount;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public int getPromptBudgetTokens() {
        return promptBudgetTokens;
    }

    /**
     * Lowest contradiction severity that stops a stage from committing;
     * null means contradictions are only flagged.
     */
    public Severity getBlockingSeverity() {
        return blockingSeverity;
    }

    public static class Builder {
        private int defaultChapterCount = DEFAULT_CHAPTER_COUNT;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private int promptBudgetTokens = PromptBudget.DEFAULT_MAX_TOKENS;
        private Severity blockingSeverity;

        public Builder defaultChapterCount(int defaultChapterCount) {
            if (defaultChapterCount < 1) {
                throw new IllegalArgumentException("Chapter count must be at least 1");
            }
            this.defaultChapterCount = defaultChapterCount;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder promptBudgetTokens(int promptBudgetTokens) {
            this.promptBudgetTokens = promptBudgetTokens;
            return this;
        }

        public Builder blockingSeverity(Severity blockingSeverity) {
            this.blockingSeverity = blockingSeverity;
            return this;
        }

        public PipelineSettings build() {
            return new PipelineSettings(this);
        }
    }
}
