package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * One step of the generation pipeline: the concept, the outline, or chapter n.
 * Serialized as {@code concept}, {@code outline} or {@code chapter-<n>}.
 */
public final class StageKind {

    public enum Type {
        CONCEPT,
        OUTLINE,
        CHAPTER
    }

    public static final StageKind CONCEPT = new StageKind(Type.CONCEPT, 0);
    public static final StageKind OUTLINE = new StageKind(Type.OUTLINE, 0);

    private static final String CHAPTER_PREFIX = "chapter-";

    private final Type type;
    private final int chapter;

    private StageKind(Type type, int chapter) {
        this.type = type;
        this.chapter = chapter;
    }

    public static StageKind chapter(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Chapter numbers start at 1: " + number);
        }
        return new StageKind(Type.CHAPTER, number);
    }

    @JsonCreator
    public static StageKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Stage is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("concept".equals(normalized)) {
            return CONCEPT;
        }
        if ("outline".equals(normalized)) {
            return OUTLINE;
        }
        if (normalized.startsWith(CHAPTER_PREFIX)) {
            try {
                return chapter(Integer.parseInt(normalized.substring(CHAPTER_PREFIX.length())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid chapter stage: " + value);
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + value);
    }

    public Type getType() {
        return type;
    }

    /**
     * Chapter number, or 0 for the concept and outline stages.
     */
    public int getChapter() {
        return chapter;
    }

    public boolean isChapter() {
        return type == Type.CHAPTER;
    }

    /**
     * Position of this stage in the pipeline: concept 0, outline 1, chapter n at n + 1.
     */
    public int sequence() {
        switch (type) {
            case CONCEPT:
                return 0;
            case OUTLINE:
                return 1;
            default:
                return chapter + 1;
        }
    }

    /**
     * The stage that follows this one, or null when this was the last chapter.
     */
    public StageKind next(int chapterCount) {
        switch (type) {
            case CONCEPT:
                return OUTLINE;
            case OUTLINE:
                return chapterCount > 0 ? chapter(1) : null;
            default:
                return chapter < chapterCount ? chapter(chapter + 1) : null;
        }
    }

    @JsonValue
    @Override
    public String toString() {
        switch (type) {
            case CONCEPT:
                return "concept";
            case OUTLINE:
                return "outline";
            default:
                return CHAPTER_PREFIX + chapter;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StageKind)) return false;
        StageKind other = (StageKind) o;
        return type == other.type && chapter == other.chapter;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, chapter);
    }
}
