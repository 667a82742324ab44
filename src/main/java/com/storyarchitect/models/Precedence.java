package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Committed ordering constraint: event {@code before} happens before event {@code after}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Precedence {

    private final String before;
    private final String after;
    private final String assertedBy;

    @JsonCreator
    public Precedence(@JsonProperty("before") String before,
                      @JsonProperty("after") String after,
                      @JsonProperty("assertedBy") String assertedBy) {
        this.before = before;
        this.after = after;
        this.assertedBy = assertedBy;
    }

    public String getBefore() {
        return before;
    }

    public String getAfter() {
        return after;
    }

    public String getAssertedBy() {
        return assertedBy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Precedence)) return false;
        Precedence that = (Precedence) o;
        return Objects.equals(before, that.before)
            && Objects.equals(after, that.after)
            && Objects.equals(assertedBy, that.assertedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(before, after, assertedBy);
    }
}
