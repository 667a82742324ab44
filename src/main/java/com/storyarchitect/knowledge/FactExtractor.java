package com.storyarchitect.knowledge;

import com.storyarchitect.models.ExtractedFacts;
import com.storyarchitect.models.StageKind;

/**
 * Best-effort structured read of generated text. Model output cannot be fully
 * constrained, so implementations may throw; callers treat any failure as
 * "no new facts".
 */
@FunctionalInterface
public interface FactExtractor {

    ExtractedFacts extract(String text, StageKind stage) throws ExtractionException;
}
