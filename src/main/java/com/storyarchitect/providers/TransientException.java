package com.storyarchitect.providers;

import com.storyarchitect.models.ErrorKind;

/**
 * Timeouts, dropped connections and 5xx responses.
 */
public class TransientException extends GenerationException {

    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TRANSIENT;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
