package com.storyarchitect.providers;

import com.storyarchitect.models.ErrorKind;

public class RateLimitException extends GenerationException {

    private final Long retryAfterMs;

    public RateLimitException(String message) {
        this(message, null);
    }

    public RateLimitException(String message, Long retryAfterMs) {
        super(message);
        this.retryAfterMs = retryAfterMs;
    }

    /**
     * Provider-suggested wait, if the response carried a Retry-After header.
     */
    public Long getRetryAfterMs() {
        return retryAfterMs;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.RATE_LIMIT;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
