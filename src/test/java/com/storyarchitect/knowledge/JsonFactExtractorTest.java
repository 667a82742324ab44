package com.storyarchitect.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.models.EntityCategory;
import com.storyarchitect.models.ExtractedFacts;
import com.storyarchitect.models.StageKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonFactExtractorTest {

    private final JsonFactExtractor extractor = new JsonFactExtractor(new ObjectMapper());

    @Test
    void readsTrailingFactsBlock() throws Exception {
        String text = "Alice walked into the harbor.\n\n"
            + "```facts\n"
            + "{\"summary\": \"Alice arrives.\",\n"
            + " \"entities\": [{\"name\": \"Alice\", \"category\": \"character\", \"aliases\": [\"Ally\"],"
            + " \"attributes\": {\"eyeColor\": \"blue\", \"age\": 12}},"
            + " {\"name\": \"Harbor Town\", \"category\": \"location\"}],\n"
            + " \"events\": [{\"key\": \"arrival\", \"description\": \"Alice arrives\"}],\n"
            + " \"precedences\": [{\"before\": \"departure\", \"after\": \"arrival\"}],\n"
            + " \"plotThreads\": {\"opened\": [{\"name\": \"Lost letter\"}], \"resolved\": [\"Old debt\"]}}\n"
            + "```\n";

        ExtractedFacts facts = extractor.extract(text, StageKind.chapter(1));

        assertEquals("Alice arrives.", facts.getSummary());
        assertEquals(2, facts.getEntities().size());
        assertEquals("blue", facts.getEntities().get(0).getAttributes().get("eyeColor"));
        assertEquals("12", facts.getEntities().get(0).getAttributes().get("age"));
        assertEquals(EntityCategory.LOCATION, facts.getEntities().get(1).getCategory());
        assertEquals(1, facts.getEvents().size());
        assertEquals(1, facts.getPrecedences().size());
        assertEquals("Lost letter", facts.getOpenedThreads().get(0).getName());
        assertEquals("Old debt", facts.getResolvedThreads().get(0));
    }

    @Test
    void readsFactsKeyOfJsonOutline() throws Exception {
        String text = "{\"outline\": {\"act_1\": {\"title\": \"Setup\", \"chapters\": []}},"
            + " \"facts\": {\"characters\": [\"Alice\", \"Bob\"]}}";

        ExtractedFacts facts = extractor.extract(text, StageKind.OUTLINE);

        assertEquals(2, facts.getEntities().size());
        assertEquals(EntityCategory.CHARACTER, facts.getEntities().get(1).getCategory());
    }

    @Test
    void proseWithoutJsonIsAnExtractionError() {
        assertThrows(ExtractionException.class,
            () -> extractor.extract("Just a story, no data.", StageKind.chapter(2)));
        assertThrows(ExtractionException.class,
            () -> extractor.extract("  ", StageKind.chapter(2)));
    }
}
