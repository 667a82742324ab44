package com.storyarchitect.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.knowledge.JsonFactExtractor;
import com.storyarchitect.knowledge.KnowledgeStore;
import com.storyarchitect.models.ChapterAnalysis;
import com.storyarchitect.models.ErrorKind;
import com.storyarchitect.models.PipelineStatus;
import com.storyarchitect.models.Project;
import com.storyarchitect.models.ProjectSummary;
import com.storyarchitect.models.ProviderConfig;
import com.storyarchitect.models.Severity;
import com.storyarchitect.models.StageKind;
import com.storyarchitect.models.StageResult;
import com.storyarchitect.models.StageRevision;
import com.storyarchitect.models.StoryConcept;
import com.storyarchitect.models.ValidationOutcome;
import com.storyarchitect.prompt.OutlineParser;
import com.storyarchitect.prompt.PromptBudget;
import com.storyarchitect.prompt.PromptComposer;
import com.storyarchitect.providers.AuthException;
import com.storyarchitect.providers.ConfigurationException;
import com.storyarchitect.providers.Credential;
import com.storyarchitect.providers.GenerationException;
import com.storyarchitect.providers.GenerationGateway;
import com.storyarchitect.providers.GenerationRequest;
import com.storyarchitect.providers.RateLimitException;
import com.storyarchitect.providers.TransientException;
import com.storyarchitect.storage.ProjectNotFoundException;
import com.storyarchitect.storage.ProjectStore;
import com.storyarchitect.validation.ConsistencyValidator;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PipelineOrchestratorTest {

    private static final String SECRET = "sk-test-secret-4242";

    private static final String OUTLINE = "{\"outline\": {"
        + "\"act_1\": {\"title\": \"Arrival\", \"chapters\": [{\"title\": \"The Harbor\", \"summary\": \"Alice arrives.\"}]},"
        + "\"act_2\": {\"title\": \"Trouble\", \"chapters\": [{\"title\": \"The Storm\", \"summary\": \"A storm hits.\"}]},"
        + "\"act_3\": {\"title\": \"Home\", \"chapters\": [{\"title\": \"Dawn\", \"summary\": \"The lamp is lit.\"}]}},"
        + " \"facts\": {\"summary\": \"Three acts.\", \"entities\": [{\"name\": \"Harbor Town\", \"category\": \"location\"}]}}";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ScriptedGateway gateway = new ScriptedGateway();
    private final InMemoryProjectStore store = new InMemoryProjectStore(mapper);
    private final List<Long> sleeps = new ArrayList<>();
    private final Credential credential = Credential.of(SECRET);

    private PipelineOrchestrator orchestrator = orchestrator(PipelineSettings.defaults());

    private PipelineOrchestrator orchestrator(PipelineSettings settings) {
        return new PipelineOrchestrator(store, gateway,
            new PromptComposer(PromptBudget.defaults(), new OutlineParser(mapper)),
            new KnowledgeStore(new JsonFactExtractor(mapper), mapper),
            new ConsistencyValidator(), settings, sleeps::add, mapper);
    }

    private static String concept() {
        return "A quiet mystery set in a harbor town.\n"
            + "```facts\n{\"summary\": \"A girl inherits a lighthouse.\", \"entities\": [{\"name\": \"Alice\","
            + " \"category\": \"character\", \"attributes\": {\"eyeColor\": \"blue\"}}]}\n```\n";
    }

    private static String chapter(int number, String eyeColor) {
        return "Chapter " + number + " prose about Alice.\n"
            + "```facts\n{\"summary\": \"Chapter " + number + " happens.\", \"entities\": [{\"name\": \"Alice\","
            + " \"category\": \"character\", \"attributes\": {\"eyeColor\": \"" + eyeColor + "\"}}]}\n```\n";
    }

    private Project start() throws Exception {
        gateway.reply(concept());
        StoryConcept concept = new StoryConcept("Mystery", "Belonging", "A girl inherits a lighthouse", "Lyrical");
        return orchestrator.startProject("Lighthouse", concept, new ProviderConfig("ollama", "llama3"), 3, credential);
    }

    private Project runToCompletion() throws Exception {
        Project project = start();
        gateway.reply(OUTLINE).reply(chapter(1, "blue")).reply(chapter(2, "blue")).reply(chapter(3, "blue"));
        for (int i = 0; i < 4; i++) {
            project = orchestrator.advanceStage(project.getId(), credential);
        }
        return project;
    }

    @Test
    void runsEveryStageThenStopsAtComplete() throws Exception {
        Project project = runToCompletion();

        assertEquals(PipelineStatus.COMPLETE, project.getStatus());
        assertNull(project.getNextStage());
        assertEquals(5, project.getStageResults().size());
        assertEquals(StageKind.chapter(3), project.getStageResults().get(4).getStage());
        assertEquals(5, gateway.calls);
        assertEquals(5, store.saves);

        Project again = orchestrator.advanceStage(project.getId(), credential);

        assertEquals(PipelineStatus.COMPLETE, again.getStatus());
        assertEquals(5, gateway.calls);
        assertEquals(5, store.saves);
    }

    @Test
    void chapterPromptCarriesTheOutlinedChapter() throws Exception {
        Project project = start();
        gateway.reply(OUTLINE).reply(chapter(1, "blue")).reply(chapter(2, "blue"));
        orchestrator.advanceStage(project.getId(), credential);
        orchestrator.advanceStage(project.getId(), credential);
        orchestrator.advanceStage(project.getId(), credential);

        GenerationRequest request = gateway.requests.get(3);
        assertTrue(request.getPrompt().contains("Write chapter 2 of a 3-chapter novel."));
        assertTrue(request.getPrompt().contains("The Storm"));
        assertTrue(request.getPrompt().contains("Chapter 1: Chapter 1 happens."));
        assertTrue(gateway.requests.get(1).getOptions().isJsonOutput());
    }

    @Test
    void transientFailuresRetryWithBackoffThenFail() throws Exception {
        Project project = start();
        gateway.fail(new TransientException("503"))
            .fail(new TransientException("503"))
            .fail(new TransientException("503"));

        Project failed = orchestrator.advanceStage(project.getId(), credential);

        assertEquals(PipelineStatus.FAILED, failed.getStatus());
        assertEquals(ErrorKind.TRANSIENT, failed.getLastFailure().getKind());
        assertEquals(3, failed.getLastFailure().getAttempts());
        assertEquals(StageKind.OUTLINE, failed.getNextStage());
        assertEquals(List.of(500L, 1000L), sleeps);
        assertEquals(1, failed.getStageResults().size());
        assertEquals(PipelineStatus.FAILED, store.load(project.getId()).getStatus());

        gateway.reply(OUTLINE);
        Project recovered = orchestrator.advanceStage(project.getId(), credential);

        assertEquals(PipelineStatus.CHAPTER_PENDING, recovered.getStatus());
        assertNull(recovered.getLastFailure());
        assertEquals(StageKind.chapter(1), recovered.getNextStage());
    }

    @Test
    void transientThenSuccessCommitsWithAttemptCount() throws Exception {
        Project project = start();
        gateway.fail(new TransientException("timeout")).reply(OUTLINE);

        Project advanced = orchestrator.advanceStage(project.getId(), credential);

        assertEquals(2, advanced.resultFor(StageKind.OUTLINE).getAttempts());
        assertEquals(List.of(500L), sleeps);
    }

    @Test
    void rateLimitHonoursRetryAfter() throws Exception {
        Project project = start();
        gateway.fail(new RateLimitException("slow down", 3000L)).reply(OUTLINE);

        orchestrator.advanceStage(project.getId(), credential);

        assertEquals(List.of(3000L), sleeps);
    }

    @Test
    void authFailureIsNotRetried() throws Exception {
        Project project = start();
        gateway.fail(new AuthException("Invalid API key"));

        Project failed = orchestrator.advanceStage(project.getId(), credential);

        assertEquals(PipelineStatus.FAILED, failed.getStatus());
        assertEquals(ErrorKind.AUTH, failed.getLastFailure().getKind());
        assertEquals(1, failed.getLastFailure().getAttempts());
        assertEquals(2, gateway.calls);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void failedStartPersistsNothing() {
        gateway.fail(new AuthException("Invalid API key"));
        StoryConcept concept = new StoryConcept("Mystery", null, "A lighthouse", null);

        assertThrows(AuthException.class, () -> orchestrator.startProject(null, concept,
            new ProviderConfig("openai", "gpt-4o"), 3, credential));
        assertEquals(0, store.saves);
        assertTrue(store.documents.isEmpty());
    }

    @Test
    void startRejectsMissingInputs() {
        StoryConcept concept = new StoryConcept("Mystery", null, "A lighthouse", null);
        ProviderConfig provider = new ProviderConfig("ollama", null);

        assertThrows(ConfigurationException.class,
            () -> orchestrator.startProject(null, new StoryConcept(), provider, 3, credential));
        assertThrows(ConfigurationException.class,
            () -> orchestrator.startProject(null, concept, null, 3, credential));
        assertThrows(ConfigurationException.class,
            () -> orchestrator.startProject(null, concept, provider, 0, credential));
        assertEquals(0, gateway.calls);
    }

    @Test
    void startUsesDefaultChapterCountAndTitle() throws Exception {
        gateway.reply(concept());
        StoryConcept concept = new StoryConcept("Mystery", null, "A girl inherits a lighthouse", null);

        Project project = orchestrator.startProject(" ", concept, new ProviderConfig("ollama", "llama3"), null, credential);

        assertEquals(PipelineSettings.DEFAULT_CHAPTER_COUNT, project.getChapterCount());
        assertEquals("A girl inherits a lighthouse", project.getTitle());
        assertEquals(PipelineStatus.OUTLINE_PENDING, project.getStatus());
    }

    @Test
    void contradictionsAreFlaggedButCommittedByDefault() throws Exception {
        Project project = start();
        gateway.reply(OUTLINE).reply(chapter(1, "blue")).reply(chapter(2, "green"));
        orchestrator.advanceStage(project.getId(), credential);
        orchestrator.advanceStage(project.getId(), credential);

        Project advanced = orchestrator.advanceStage(project.getId(), credential);

        StageResult chapterTwo = advanced.resultFor(StageKind.chapter(2));
        assertNotNull(chapterTwo);
        assertEquals(ValidationOutcome.FLAGGED, chapterTwo.getOutcome());
        assertEquals(1, chapterTwo.getContradictions().size());
        assertEquals(Severity.MAJOR, chapterTwo.getContradictions().get(0).getSeverity());
        assertEquals(StageKind.chapter(3), advanced.getNextStage());
    }

    @Test
    void blockingThresholdStopsTheStage() throws Exception {
        orchestrator = orchestrator(new PipelineSettings.Builder().blockingSeverity(Severity.MAJOR).build());
        Project project = start();
        gateway.reply(OUTLINE).reply(chapter(1, "blue")).reply(chapter(2, "green"));
        orchestrator.advanceStage(project.getId(), credential);
        orchestrator.advanceStage(project.getId(), credential);

        Project blocked = orchestrator.advanceStage(project.getId(), credential);

        assertEquals(PipelineStatus.FAILED, blocked.getStatus());
        assertEquals(ErrorKind.BLOCKING_CONTRADICTION, blocked.getLastFailure().getKind());
        assertEquals(1, blocked.getLastFailure().getContradictions().size());
        assertEquals(3, blocked.getStageResults().size());
        assertEquals(StageKind.chapter(2), blocked.getNextStage());
        assertEquals(3, store.load(project.getId()).getStageResults().size());
    }

    @Test
    void regenerateDiscardsLaterStagesAndRebuildsKnowledge() throws Exception {
        Project complete = runToCompletion();
        String replacement = OUTLINE.replace("The Storm", "The Flood");
        gateway.reply(replacement);

        Project regenerated = orchestrator.regenerateStage(complete.getId(), StageKind.OUTLINE, credential);

        assertEquals(2, regenerated.getStageResults().size());
        assertEquals(replacement, regenerated.resultFor(StageKind.OUTLINE).getText());
        assertEquals(StageKind.chapter(1), regenerated.getNextStage());
        assertEquals(PipelineStatus.CHAPTER_PENDING, regenerated.getStatus());

        StageRevision revision = regenerated.getRevisions().get(0);
        assertEquals(4, revision.getDiscarded().size());
        assertEquals(regenerated.resultFor(StageKind.OUTLINE).getId(), revision.getReplacementResultId());
        assertTrue(revision.getDiff().stream().anyMatch(line -> line.startsWith("+") && line.contains("The Flood")));

        KnowledgeStore knowledgeStore = new KnowledgeStore(new JsonFactExtractor(mapper), mapper);
        assertEquals(knowledgeStore.rebuild(regenerated.getStageResults()), regenerated.getKnowledge());
        assertEquals(regenerated, store.load(complete.getId()));
    }

    @Test
    void regeneratingAnUngeneratedStageIsRejected() throws Exception {
        Project project = start();

        assertThrows(IllegalStateException.class,
            () -> orchestrator.regenerateStage(project.getId(), StageKind.chapter(2), credential));
    }

    @Test
    void cancellationStopsBeforeTheNextAttemptAndSavesNothing() throws Exception {
        Project project = start();
        int savesBefore = store.saves;
        gateway.respond(request -> {
            assertTrue(orchestrator.cancel(project.getId()));
            throw new TransientException("503");
        });

        assertThrows(StageCancelledException.class, () -> orchestrator.advanceStage(project.getId(), credential));
        assertEquals(savesBefore, store.saves);
        assertEquals(PipelineStatus.OUTLINE_PENDING, store.load(project.getId()).getStatus());
        assertFalse(orchestrator.cancel(project.getId()));
    }

    @Test
    void secondCommandOnABusyProjectIsRejected() throws Exception {
        Project project = start();
        AtomicReference<Exception> nested = new AtomicReference<>();
        gateway.respond(request -> {
            try {
                orchestrator.advanceStage(project.getId(), credential);
            } catch (Exception e) {
                nested.set(e);
            }
            return OUTLINE;
        });

        Project advanced = orchestrator.advanceStage(project.getId(), credential);

        assertInstanceOf(ProjectBusyException.class, nested.get());
        assertEquals(StageKind.chapter(1), advanced.getNextStage());
    }

    @Test
    void credentialReachesTheGatewayButIsNeverSaved() throws Exception {
        runToCompletion();

        assertEquals(SECRET, gateway.requests.get(0).getCredential().reveal());
        for (String json : store.documents.values()) {
            assertFalse(json.contains(SECRET));
        }
    }

    @Test
    void analyzeChapterReadsJsonReply() throws Exception {
        gateway.reply("```json\n{\"summary\": \"Alice meets Bob.\", \"characters\": [\"Alice\", \"Bob\", \"Alice\"]}\n```");

        ChapterAnalysis analysis = orchestrator.analyzeChapter("Alice met Bob at the pier.",
            new ProviderConfig("ollama", "llama3"), Credential.none());

        assertEquals("Alice meets Bob.", analysis.getSummary());
        assertEquals(List.of("Alice", "Bob"), analysis.getCharacters());
        assertTrue(gateway.requests.get(0).getOptions().isJsonOutput());
        assertEquals(0, store.saves);
    }

    @Test
    void deleteRemovesTheProject() throws Exception {
        Project project = start();

        orchestrator.deleteProject(project.getId());

        assertThrows(ProjectNotFoundException.class, () -> orchestrator.getProject(project.getId()));
        assertTrue(orchestrator.listProjects().isEmpty());
    }

    @FunctionalInterface
    interface Response {
        String respond(GenerationRequest request) throws Exception;
    }

    static class ScriptedGateway implements GenerationGateway {
        final Deque<Response> script = new ArrayDeque<>();
        final List<GenerationRequest> requests = new ArrayList<>();
        int calls;

        ScriptedGateway reply(String text) {
            return respond(request -> text);
        }

        ScriptedGateway fail(GenerationException failure) {
            return respond(request -> {
                throw failure;
            });
        }

        ScriptedGateway respond(Response response) {
            script.add(response);
            return this;
        }

        @Override
        public String generate(GenerationRequest request) throws GenerationException {
            calls++;
            requests.add(request);
            Response next = script.poll();
            if (next == null) {
                throw new IllegalStateException("No scripted response for call " + calls);
            }
            try {
                return next.respond(request);
            } catch (GenerationException | RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
    }

    static class InMemoryProjectStore implements ProjectStore {
        final Map<String, String> documents = new LinkedHashMap<>();
        final ObjectMapper mapper;
        int saves;

        InMemoryProjectStore(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Project load(String projectId) throws ProjectNotFoundException, IOException {
            String json = documents.get(projectId);
            if (json == null) {
                throw new ProjectNotFoundException(projectId);
            }
            return mapper.readValue(json, Project.class);
        }

        @Override
        public void save(Project project) throws IOException {
            saves++;
            documents.put(project.getId(), mapper.writeValueAsString(project));
        }

        @Override
        public List<ProjectSummary> list() throws IOException {
            List<ProjectSummary> summaries = new ArrayList<>();
            for (String json : documents.values()) {
                summaries.add(ProjectSummary.of(mapper.readValue(json, Project.class)));
            }
            summaries.sort(Comparator.comparingLong(ProjectSummary::getCreatedAt).reversed());
            return summaries;
        }

        @Override
        public void delete(String projectId) throws ProjectNotFoundException {
            if (documents.remove(projectId) == null) {
                throw new ProjectNotFoundException(projectId);
            }
        }
    }
}
