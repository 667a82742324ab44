package com.storyarchitect.knowledge;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameFoldingTest {

    @Test
    void dropsLeadingHonorifics() {
        assertEquals("smith", NameFolding.foldName("Dr. Smith"));
        assertEquals("jane doe", NameFolding.foldName("Captain  Jane Doe,"));
        assertEquals("doctor", NameFolding.foldName("Doctor"));
        assertTrue(NameFolding.sameName("Mr. Holmes", "holmes"));
        assertFalse(NameFolding.sameName("", ""));
    }

    @Test
    void recognisesCapitalizedNames() {
        assertTrue(NameFolding.isProperName("Dr. Smith"));
        assertTrue(NameFolding.isProperName("Jane Smith"));
        assertFalse(NameFolding.isProperName("sister of Bob"));
        assertFalse(NameFolding.isProperName("Captain Smith's daughter"));
        assertFalse(NameFolding.isProperName("  "));
    }

    @Test
    void foldsAttributeAndEventKeys() {
        assertEquals("eyecolor", NameFolding.foldAttribute("eyeColor"));
        assertEquals("eyecolor", NameFolding.foldAttribute("eye_color"));
        assertEquals("eyecolor", NameFolding.foldAttribute("Eye Color"));
        assertEquals("the-wedding", NameFolding.foldKey("  The Wedding! "));
    }
}
