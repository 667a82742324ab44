package com.storyarchitect.providers;

/**
 * Opaque provider credential. Passed explicitly to each generation call and
 * never stored on a project; {@link #toString()} is masked so it cannot leak
 * into logs or error messages.
 */
public final class Credential {

    private static final Credential NONE = new Credential(null);

    private final String secret;

    private Credential(String secret) {
        this.secret = secret;
    }

    public static Credential of(String secret) {
        if (secret == null || secret.isBlank()) {
            return NONE;
        }
        return new Credential(secret.trim());
    }

    /**
     * For local providers that need no key.
     */
    public static Credential none() {
        return NONE;
    }

    public boolean isPresent() {
        return secret != null;
    }

    /**
     * The raw secret, for placing in an outbound request header only.
     */
    public String reveal() {
        return secret;
    }

    @Override
    public String toString() {
        return isPresent() ? "Credential[****]" : "Credential[none]";
    }
}
