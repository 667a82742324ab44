package com.storyarchitect.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.knowledge.JsonFactExtractor;
import com.storyarchitect.knowledge.KnowledgeStore;
import com.storyarchitect.models.Contradiction;
import com.storyarchitect.models.ContradictionKind;
import com.storyarchitect.models.ExtractedFacts;
import com.storyarchitect.models.PipelineStatus;
import com.storyarchitect.models.Project;
import com.storyarchitect.models.ProjectSummary;
import com.storyarchitect.models.ProviderConfig;
import com.storyarchitect.models.Severity;
import com.storyarchitect.models.StageKind;
import com.storyarchitect.models.StageResult;
import com.storyarchitect.models.StoryConcept;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonProjectStoreTest {

    @TempDir
    Path projectsDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final KnowledgeStore knowledgeStore = new KnowledgeStore(new JsonFactExtractor(mapper), mapper);

    private StageResult result(StageKind stage, String facts, List<Contradiction> contradictions) {
        String text = stage + " text\n```facts\n" + facts + "\n```\n";
        ExtractedFacts extracted = knowledgeStore.extract(text, stage);
        return new StageResult(StageResult.newId(), stage, text, knowledgeStore.summarize(text, extracted),
            extracted, null, contradictions, "ollama", "llama3", 1, 1000L);
    }

    private Project project(String title, long createdAt) {
        Project project = new Project();
        project.setId(Project.newId());
        project.setTitle(title);
        project.setCreatedAt(createdAt);
        project.setUpdatedAt(createdAt);
        StoryConcept concept = new StoryConcept("Mystery", "Belonging", "A lighthouse", "Lyrical");
        project.setConcept(concept);
        ProviderConfig provider = new ProviderConfig("openai", "gpt-4o");
        provider.setTemperature(0.7);
        project.setProviderConfig(provider);
        project.setChapterCount(5);
        project.setStatus(PipelineStatus.CHAPTER_PENDING);
        project.setNextStage(StageKind.chapter(4));
        return project;
    }

    @Test
    void roundTripsAProjectWithResultsAndContradictions() throws Exception {
        Project project = project("Lighthouse", 1000L);
        String alice = "{\"summary\": \"s\", \"entities\": [{\"name\": \"Alice\", \"category\": \"character\","
            + " \"attributes\": {\"eyeColor\": \"blue\"}}], \"events\": [{\"key\": \"arrival\", \"description\": \"x\"}]}";
        List<StageResult> results = List.of(
            result(StageKind.CONCEPT, alice, List.of()),
            result(StageKind.OUTLINE, "{\"entities\": [\"Bob\"]}", List.of()),
            result(StageKind.chapter(1), alice, List.of()),
            result(StageKind.chapter(2), "{\"entities\": []}", List.of()),
            result(StageKind.chapter(3), "{\"entities\": []}", List.of(
                new Contradiction("ct_000000000001", ContradictionKind.ATTRIBUTE, Severity.MAJOR, "sr_3", "sr_1",
                    "Alice", "eyeColor", "blue", "green", "Alice's eyeColor changed"),
                new Contradiction("ct_000000000002", ContradictionKind.TIMELINE, Severity.CRITICAL, "sr_3", "sr_2",
                    "wedding", "engagement", null, null, "Timeline cycle"))));
        project.setStageResults(new ArrayList<>(results));
        project.setKnowledge(knowledgeStore.rebuild(results));
        JsonProjectStore store = new JsonProjectStore(projectsDir, mapper);

        store.save(project);
        Project loaded = store.load(project.getId());

        assertEquals(project, loaded);
        assertEquals(5, loaded.getStageResults().size());
        assertEquals(2, loaded.getStageResults().get(4).getContradictions().size());
    }

    @Test
    void listsNewestFirstAndDeletes() throws Exception {
        JsonProjectStore store = new JsonProjectStore(projectsDir, mapper);
        Project older = project("Older", 1000L);
        Project newer = project("Newer", 2000L);
        store.save(older);
        store.save(newer);

        List<ProjectSummary> summaries = store.list();

        assertEquals(2, summaries.size());
        assertEquals("Newer", summaries.get(0).getTitle());
        assertEquals(StageKind.chapter(4), summaries.get(1).getNextStage());

        store.delete(older.getId());

        assertEquals(1, store.list().size());
        assertThrows(ProjectNotFoundException.class, () -> store.load(older.getId()));
    }

    @Test
    void missingAndUnsafeIdsAreNotFound() throws Exception {
        JsonProjectStore store = new JsonProjectStore(projectsDir, mapper);

        assertThrows(ProjectNotFoundException.class, () -> store.load("story_missing"));
        assertThrows(ProjectNotFoundException.class, () -> store.load("../escape"));
        assertThrows(ProjectNotFoundException.class, () -> store.delete("story_missing"));

        Project unsafe = project("Unsafe", 1L);
        unsafe.setId("../escape");
        assertThrows(IOException.class, () -> store.save(unsafe));
    }

    @Test
    void saveLeavesNoTemporaryFiles() throws Exception {
        JsonProjectStore store = new JsonProjectStore(projectsDir, mapper);
        Project project = project("Lighthouse", 1000L);

        store.save(project);
        store.save(project);

        try (Stream<Path> files = Files.list(projectsDir)) {
            assertEquals(List.of(project.getId() + ".json"),
                files.map(path -> path.getFileName().toString()).sorted().collect(Collectors.toList()));
        }
    }

    @Test
    void listOfMissingDirectoryIsEmpty() throws Exception {
        JsonProjectStore store = new JsonProjectStore(projectsDir.resolve("absent"), mapper);

        assertTrue(store.list().isEmpty());
    }
}
