package com.storyarchitect.knowledge;

/**
 * Generated text held no readable facts. Never fails a stage: the knowledge
 * store degrades it to an empty fact set.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
