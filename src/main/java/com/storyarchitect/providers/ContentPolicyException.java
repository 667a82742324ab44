package com.storyarchitect.providers;

import com.storyarchitect.models.ErrorKind;

/**
 * The provider refused to produce the content.
 */
public class ContentPolicyException extends GenerationException {

    public ContentPolicyException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONTENT_POLICY;
    }
}
