package com.storyarchitect.providers;

import com.storyarchitect.models.ErrorKind;

/**
 * Base type for provider call failures. Each subclass maps to one
 * {@link ErrorKind}; only rate-limit and transient failures are retryable.
 * Messages never carry the credential or the prompt body.
 */
public abstract class GenerationException extends Exception {

    protected GenerationException(String message) {
        super(message);
    }

    protected GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();

    public boolean isRetryable() {
        return false;
    }
}
