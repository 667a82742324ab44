package com.storyarchitect.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.models.Contradiction;
import com.storyarchitect.models.ContradictionKind;
import com.storyarchitect.models.Entity;
import com.storyarchitect.models.EntityCategory;
import com.storyarchitect.models.ExtractedFacts;
import com.storyarchitect.models.ExtractedFacts.EntityFact;
import com.storyarchitect.models.ExtractedFacts.EventFact;
import com.storyarchitect.models.ExtractedFacts.PrecedenceFact;
import com.storyarchitect.models.ExtractedFacts.ThreadFact;
import com.storyarchitect.models.Severity;
import com.storyarchitect.models.StageKind;
import com.storyarchitect.models.StageResult;
import com.storyarchitect.models.StoryKnowledge;
import com.storyarchitect.models.TimelineEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeStoreTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final KnowledgeStore store = new KnowledgeStore(new JsonFactExtractor(mapper), mapper);

    private static StageResult result(String id, StageKind stage, ExtractedFacts facts, List<Contradiction> found) {
        return new StageResult(id, stage, "text", null, facts, null, found, "ollama", "llama3", 1, 0L);
    }

    private static ExtractedFacts alice(String eyeColor, String... aliases) {
        return new ExtractedFacts(null,
            List.of(new EntityFact("Alice", EntityCategory.CHARACTER, List.of(aliases), Map.of("eyeColor", eyeColor))),
            null, null, null, null);
    }

    @Test
    void unparseableTextDegradesToNoFacts() {
        ExtractedFacts facts = store.extract("It was a dark and stormy night.", StageKind.chapter(1));
        assertTrue(facts.isEmpty());

        ExtractedFacts broken = store.extract("Prose.\n```facts\n{not json\n```\n", StageKind.chapter(1));
        assertTrue(broken.isEmpty());
    }

    @Test
    void extractorFailureOfAnyKindDegrades() {
        KnowledgeStore failing = new KnowledgeStore((text, stage) -> {
            throw new IllegalStateException("boom");
        }, mapper);
        assertTrue(failing.extract("anything", StageKind.CONCEPT).isEmpty());
    }

    @Test
    void commitKeepsFirstValueAndRecordsDisputedOne() {
        StoryKnowledge knowledge = new StoryKnowledge();
        store.commit(knowledge, result("sr_1", StageKind.chapter(1), alice("blue"), List.of()));

        Contradiction flagged = new Contradiction("ct_1", ContradictionKind.ATTRIBUTE, Severity.MAJOR,
            "sr_3", "sr_1", "Alice", "eyeColor", "blue", "green", "changed");
        store.commit(knowledge, result("sr_3", StageKind.chapter(3), alice("green"), List.of(flagged)));

        Entity entity = knowledge.getEntity(EntityCategory.CHARACTER, "Alice");
        assertEquals("blue", entity.getAttributes().get("eyecolor").getValue());
        assertEquals("sr_1", entity.getAttributes().get("eyecolor").getStageResultId());
        assertEquals(1, entity.getDisputed().size());
        assertEquals("green", entity.getDisputed().get(0).getValue());
        assertEquals(Integer.valueOf(3), entity.getLastTouchedChapter());
        assertEquals(2, entity.getMentionCount());
    }

    @Test
    void aliasesMergeIntoOneEntity() {
        StoryKnowledge knowledge = new StoryKnowledge();
        store.commit(knowledge, result("sr_1", StageKind.chapter(1), alice("blue", "Ally"), List.of()));
        store.commit(knowledge, result("sr_2", StageKind.chapter(2), new ExtractedFacts(null,
            List.of(new EntityFact("ally", EntityCategory.CHARACTER, null, Map.of("age", "12"))),
            null, null, null, null), List.of()));

        assertEquals(1, knowledge.entityCount());
        Entity entity = knowledge.getEntity(EntityCategory.CHARACTER, "Alice");
        assertEquals("12", entity.getAttributes().get("age").getValue());
    }

    @Test
    void precedencesReorderTheTimeline() {
        StoryKnowledge knowledge = new StoryKnowledge();
        ExtractedFacts facts = new ExtractedFacts(null, null,
            List.of(new EventFact("Wedding", "The wedding"), new EventFact("Engagement", "The engagement")),
            List.of(new PrecedenceFact("Engagement", "Wedding")), null, null);
        store.commit(knowledge, result("sr_1", StageKind.chapter(1), facts, List.of()));

        List<String> keys = knowledge.orderedTimeline().stream()
            .map(TimelineEvent::getKey).collect(Collectors.toList());
        assertEquals(List.of("engagement", "wedding"), keys);
        assertEquals("The wedding", knowledge.getEvent("wedding").getDescription());
    }

    @Test
    void rebuildReplaysResultsInOrder() {
        StageResult first = result("sr_1", StageKind.chapter(1), alice("blue"), List.of());
        StageResult second = result("sr_2", StageKind.chapter(2), new ExtractedFacts(null, null, null, null,
            List.of(new ThreadFact("The locked door", null)), null), List.of());

        StoryKnowledge incremental = new StoryKnowledge();
        store.commit(incremental, first);
        store.commit(incremental, second);

        assertEquals(incremental, store.rebuild(List.of(first, second)));
        assertEquals(1, store.rebuild(List.of(first)).entityCount());
        assertTrue(store.rebuild(List.of(first)).getPlotThreads().isEmpty());
    }

    @Test
    void queryFiltersByCategoryNameAndRecency() {
        StoryKnowledge knowledge = new StoryKnowledge();
        store.commit(knowledge, result("sr_1", StageKind.chapter(1), new ExtractedFacts(null, List.of(
            new EntityFact("Dr. Smith", EntityCategory.CHARACTER, null, null),
            new EntityFact("Harbor Town", EntityCategory.LOCATION, null, null)), null, null, null, null), List.of()));
        store.commit(knowledge, result("sr_2", StageKind.chapter(4), alice("blue"), List.of()));

        assertEquals(1, store.query(knowledge, KnowledgeFilter.all().category(EntityCategory.LOCATION)).entityCount());
        assertEquals(1, store.query(knowledge, KnowledgeFilter.all().name("smith")).entityCount());
        StoryKnowledge recent = store.query(knowledge, KnowledgeFilter.all().touchedSinceChapter(3));
        assertEquals(1, recent.entityCount());
        assertNotNull(recent.getEntity(EntityCategory.CHARACTER, "Alice"));
    }

    @Test
    void copyIsIndependent() {
        StoryKnowledge knowledge = new StoryKnowledge();
        store.commit(knowledge, result("sr_1", StageKind.chapter(1), alice("blue"), List.of()));

        StoryKnowledge copy = store.copy(knowledge);
        assertEquals(knowledge, copy);
        store.commit(copy, result("sr_2", StageKind.chapter(2), new ExtractedFacts(null,
            List.of(new EntityFact("Bob", EntityCategory.CHARACTER, null, null)), null, null, null, null), List.of()));

        assertEquals(1, knowledge.entityCount());
        assertEquals(2, copy.entityCount());
    }

    @Test
    void summaryFallsBackToOpeningProse() {
        String text = "# Chapter 1\nThe rain fell.\n```facts\n{\"entities\": []}\n```";
        assertEquals("Chapter 1 The rain fell.", store.summarize(text, ExtractedFacts.empty()));
    }
}
