package com.storyarchitect.providers;

import com.storyarchitect.models.ErrorKind;

public class AuthException extends GenerationException {

    public AuthException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.AUTH;
    }
}
