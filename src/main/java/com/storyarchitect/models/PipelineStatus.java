package com.storyarchitect.models;

/**
 * Pipeline state of a project. {@code FAILED} keeps the failed stage in
 * {@link Project#getNextStage()} so the next advance re-enters it.
 */
public enum PipelineStatus {
    IDLE,
    CONCEPT_PENDING,
    OUTLINE_PENDING,
    CHAPTER_PENDING,
    COMPLETE,
    FAILED;

    public static PipelineStatus pendingFor(StageKind stage) {
        if (stage == null) {
            return COMPLETE;
        }
        switch (stage.getType()) {
            case CONCEPT:
                return CONCEPT_PENDING;
            case OUTLINE:
                return OUTLINE_PENDING;
            default:
                return CHAPTER_PENDING;
        }
    }
}
