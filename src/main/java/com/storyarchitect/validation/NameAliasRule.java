package com.storyarchitect.validation;

import com.storyarchitect.knowledge.NameFolding;

/**
 * "Dr. Smith" and "Smith" name the same person. Applies only when both
 * values are names, so "King of Arden" and "Queen of Arden" stay distinct.
 */
public class NameAliasRule implements EquivalenceRule {

    @Override
    public boolean equivalent(String attribute, String priorValue, String newValue) {
        return NameFolding.isProperName(priorValue)
            && NameFolding.isProperName(newValue)
            && NameFolding.sameName(priorValue, newValue);
    }
}
