package com.storyarchitect.providers;

import com.storyarchitect.models.ErrorKind;

/**
 * Unknown provider, missing model or a request the provider rejects as malformed.
 */
public class ConfigurationException extends GenerationException {

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFIGURATION;
    }
}
