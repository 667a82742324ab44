package com.storyarchitect.prompt;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutlineParserTest {

    private final OutlineParser parser = new OutlineParser(new ObjectMapper());

    @Test
    void parsesFencedThreeActOutline() {
        String text = "```json\n{\"outline\": {"
            + "\"act_1\": {\"title\": \"Setup\", \"chapters\": [{\"title\": \"One\", \"summary\": \"First.\"}]},"
            + "\"act_2\": {\"title\": \"Conflict\", \"chapters\": [{\"title\": \"Two\", \"summary\": \"Second.\"},"
            + "{\"title\": \"Three\", \"summary\": \"Third.\"}]},"
            + "\"act_3\": {\"title\": \"Resolution\", \"chapters\": [{\"title\": \"Four\", \"summary\": \"Fourth.\"}]}}}\n```";

        List<ChapterPlan> plans = parser.parse(text);

        assertEquals(4, plans.size());
        assertEquals(new ChapterPlan(3, "Three", "Third.", "Conflict"), plans.get(2));
        assertEquals("Resolution", plans.get(3).getAct());
    }

    @Test
    void parsesFlatChapterArray() {
        List<ChapterPlan> plans = parser.parse("{\"chapters\": [\"Opening\", {\"title\": \"Middle\"}]}");

        assertEquals(2, plans.size());
        assertEquals("Opening", plans.get(0).getTitle());
        assertEquals(2, plans.get(1).getNumber());
    }

    @Test
    void fallsBackToMarkdownHeadings() {
        String text = "## Act I\n"
            + "### Chapter 1: The Harbor\n- Alice arrives.\n"
            + "### Chapter 2: The Letter\n- A letter is found.\n- Nobody signs it.\n";

        List<ChapterPlan> plans = parser.parse(text);

        assertEquals(2, plans.size());
        assertEquals("The Harbor", plans.get(0).getTitle());
        assertEquals("Alice arrives.", plans.get(0).getSummary());
        assertEquals("A letter is found. Nobody signs it.", plans.get(1).getSummary());
    }

    @Test
    void unreadableOutlineIsEmpty() {
        assertTrue(parser.parse("Sorry, I can't help with that.").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }
}
