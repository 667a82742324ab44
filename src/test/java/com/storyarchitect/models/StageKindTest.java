package com.storyarchitect.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StageKindTest {

    @Test
    void stagesFollowConceptOutlineThenChapters() {
        assertEquals(StageKind.OUTLINE, StageKind.CONCEPT.next(3));
        assertEquals(StageKind.chapter(1), StageKind.OUTLINE.next(3));
        assertEquals(StageKind.chapter(3), StageKind.chapter(2).next(3));
        assertNull(StageKind.chapter(3).next(3));
        assertTrue(StageKind.chapter(1).sequence() > StageKind.OUTLINE.sequence());
    }

    @Test
    void parsesItsOwnNames() {
        assertEquals(StageKind.CONCEPT, StageKind.parse("Concept"));
        assertEquals(StageKind.chapter(12), StageKind.parse("chapter-12"));
        assertEquals("chapter-12", StageKind.chapter(12).toString());
        assertThrows(IllegalArgumentException.class, () -> StageKind.parse("chapter-x"));
        assertThrows(IllegalArgumentException.class, () -> StageKind.parse("epilogue"));
        assertThrows(IllegalArgumentException.class, () -> StageKind.chapter(0));
    }

    @Test
    void serializesAsAPlainString() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"chapter-2\"", mapper.writeValueAsString(StageKind.chapter(2)));
        assertEquals(StageKind.OUTLINE, mapper.readValue("\"outline\"", StageKind.class));
    }

    @Test
    void pendingStatusFollowsTheStage() {
        assertEquals(PipelineStatus.OUTLINE_PENDING, PipelineStatus.pendingFor(StageKind.OUTLINE));
        assertEquals(PipelineStatus.CHAPTER_PENDING, PipelineStatus.pendingFor(StageKind.chapter(4)));
        assertEquals(PipelineStatus.COMPLETE, PipelineStatus.pendingFor(null));
    }
}
