package com.storyarchitect.validation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EquivalenceRuleTest {

    private final EquivalenceRule rule = EquivalenceRule.defaults();

    @Test
    void ignoresCasePunctuationAndArticles() {
        assertTrue(rule.equivalent("eyecolor", "Blue.", "blue"));
        assertTrue(rule.equivalent("home", "the  old mill", "Old Mill"));
        assertFalse(rule.equivalent("eyes", "brown eyes", "hazel eyes"));
    }

    @Test
    void foldsHonorificsInNames() {
        assertTrue(rule.equivalent("mentor", "Dr. Smith", "Smith"));
        assertFalse(rule.equivalent("mentor", "Dr. Smith", "Dr. Jones"));
        assertFalse(rule.equivalent("relation", "sister of Bob", "brother of Bob"));
        assertFalse(rule.equivalent("title", "King of Arden", "Queen of Arden"));
    }

    @Test
    void customRulesCanBeAdded() {
        EquivalenceRule numbers = (attribute, prior, next) ->
            "age".equals(attribute) && prior.replaceAll("\\D", "").equals(next.replaceAll("\\D", ""));
        EquivalenceRule combined = EquivalenceRule.anyOf(List.of(new NormalizedTextRule(), numbers));

        assertTrue(combined.equivalent("age", "30 years", "30"));
        assertFalse(combined.equivalent("age", "30", "31"));
    }
}
