package com.storyarchitect.providers;

/**
 * The single capability the pipeline needs from a text-generation backend:
 * send a prompt, receive text. Implementations make at most one network call
 * per invocation and never retry; retry policy belongs to the caller.
 */
@FunctionalInterface
public interface GenerationGateway {

    String generate(GenerationRequest request) throws GenerationException, InterruptedException;
}
