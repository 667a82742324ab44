package com.storyarchitect.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.storyarchitect.AppLogger;
import com.storyarchitect.ProjectTurnGate;
import com.storyarchitect.knowledge.JsonBlocks;
import com.storyarchitect.knowledge.KnowledgeFilter;
import com.storyarchitect.knowledge.KnowledgeStore;
import com.storyarchitect.models.ChapterAnalysis;
import com.storyarchitect.models.Contradiction;
import com.storyarchitect.models.ErrorKind;
import com.storyarchitect.models.ExtractedFacts;
import com.storyarchitect.models.FailureInfo;
import com.storyarchitect.models.PipelineStatus;
import com.storyarchitect.models.Project;
import com.storyarchitect.models.ProjectSummary;
import com.storyarchitect.models.ProviderConfig;
import com.storyarchitect.models.Severity;
import com.storyarchitect.models.StageKind;
import com.storyarchitect.models.StageResult;
import com.storyarchitect.models.StageRevision;
import com.storyarchitect.models.StoryConcept;
import com.storyarchitect.models.StoryKnowledge;
import com.storyarchitect.prompt.ComposedPrompt;
import com.storyarchitect.prompt.PromptComposer;
import com.storyarchitect.providers.ConfigurationException;
import com.storyarchitect.providers.Credential;
import com.storyarchitect.providers.GenerationException;
import com.storyarchitect.providers.GenerationGateway;
import com.storyarchitect.providers.GenerationOptions;
import com.storyarchitect.providers.GenerationRequest;
import com.storyarchitect.providers.TransientException;
import com.storyarchitect.storage.ProjectNotFoundException;
import com.storyarchitect.storage.ProjectStore;
import com.storyarchitect.validation.ConsistencyValidator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives projects through concept, outline and chapter stages.
 *
 * Each stage composes a prompt, calls the gateway (retrying rate-limit and
 * transient failures with backoff), extracts and validates facts, then
 * commits the result and saves the project once. Stages of one project are
 * serialized through a {@link ProjectTurnGate}; different projects run in
 * parallel. The credential is passed per call and never stored.
 */
public class PipelineOrchestrator {

    private final ProjectStore store;
    private final GenerationGateway gateway;
    private final PromptComposer composer;
    private final KnowledgeStore knowledgeStore;
    private final ConsistencyValidator validator;
    private final PipelineSettings settings;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;
    private final ProjectTurnGate turnGate = new ProjectTurnGate();
    private final AppLogger logger = AppLogger.get();

    /** Tracks cancellation requests by projectId */
    private final ConcurrentHashMap<String, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();

    public PipelineOrchestrator(ProjectStore store, GenerationGateway gateway, PromptComposer composer,
                                KnowledgeStore knowledgeStore, ConsistencyValidator validator,
                                PipelineSettings settings, Sleeper sleeper, ObjectMapper objectMapper) {
        this.store = store;
        this.gateway = gateway;
        this.composer = composer;
        this.knowledgeStore = knowledgeStore;
        this.validator = validator;
        this.settings = settings;
        this.sleeper = sleeper;
        this.objectMapper = objectMapper;
    }

    /**
     * Generate the concept of a new project. The project exists, and is
     * saved, only if that first stage succeeds; otherwise the failure is
     * thrown and nothing is persisted.
     */
    public Project startProject(String title, StoryConcept concept, ProviderConfig providerConfig,
                                Integer chapterCount, Credential credential)
            throws GenerationException, StageCancelledException, IOException, InterruptedException {
        if (concept == null || concept.isBlank()) {
            throw new ConfigurationException("Story concept is required");
        }
        if (providerConfig == null || providerConfig.getProvider() == null || providerConfig.getProvider().isBlank()) {
            throw new ConfigurationException("Provider is required");
        }
        int chapters = chapterCount != null ? chapterCount : settings.getDefaultChapterCount();
        if (chapters < 1) {
            throw new ConfigurationException("Chapter count must be at least 1, got " + chapters);
        }

        long now = System.currentTimeMillis();
        Project project = new Project();
        project.setId(Project.newId());
        project.setTitle(title != null && !title.isBlank() ? title.trim() : defaultTitle(concept));
        project.setCreatedAt(now);
        project.setUpdatedAt(now);
        project.setConcept(concept);
        project.setProviderConfig(providerConfig);
        project.setChapterCount(chapters);
        project.setNextStage(StageKind.CONCEPT);
        project.setStatus(PipelineStatus.CONCEPT_PENDING);

        turnGate.enter(project.getId());
        try {
            StageResult result = runStage(project, StageKind.CONCEPT, credential, new AtomicInteger());
            commit(project, result);
            store.save(project);
            logger.forProject(project.getId()).info("created (" + chapters + " chapters, provider "
                + providerConfig.getProvider() + ")");
            return project;
        } finally {
            turnGate.leave(project.getId());
        }
    }

    /**
     * Run the project's next stage. A complete project is returned unchanged
     * without calling the provider; a failed project re-enters its failed
     * stage. Provider errors and blocking contradictions leave the project
     * FAILED (saved) rather than being thrown.
     */
    public Project advanceStage(String projectId, Credential credential)
            throws ProjectNotFoundException, IOException, StageCancelledException, InterruptedException {
        turnGate.enter(projectId);
        try {
            Project project = store.load(projectId);
            StageKind stage = project.getNextStage();
            if (project.isComplete() || stage == null) {
                return project;
            }
            return runAndCommit(project, stage, credential, null);
        } finally {
            turnGate.leave(projectId);
        }
    }

    /**
     * Discard the given stage and everything after it, then generate that
     * stage again. The discarded results are kept in a {@link StageRevision}.
     * A cancelled regeneration leaves the stored project untouched.
     */
    public Project regenerateStage(String projectId, StageKind stage, Credential credential)
            throws ProjectNotFoundException, IOException, StageCancelledException, InterruptedException {
        if (stage == null) {
            throw new IllegalArgumentException("Stage is required");
        }
        turnGate.enter(projectId);
        try {
            Project project = store.load(projectId);
            int index = project.indexOf(stage);
            if (index < 0) {
                throw new IllegalStateException("Stage " + stage + " has not been generated for project " + projectId);
            }
            List<StageResult> results = project.getStageResults();
            List<StageResult> discarded = new ArrayList<>(results.subList(index, results.size()));
            List<StageResult> retained = new ArrayList<>(results.subList(0, index));

            project.setStageResults(retained);
            project.setKnowledge(knowledgeStore.rebuild(retained));
            project.setNextStage(stage);
            project.setStatus(PipelineStatus.pendingFor(stage));
            project.setLastFailure(null);
            logger.forProject(projectId).info("regenerating " + stage + ", discarding " + discarded.size() + " result(s)");

            StageRevision revision = new StageRevision(stage, discarded, System.currentTimeMillis());
            return runAndCommit(project, stage, credential, revision);
        } finally {
            turnGate.leave(projectId);
        }
    }

    /**
     * Request cancellation of the project's in-flight stage. Takes effect
     * before the next generation attempt.
     */
    public boolean cancel(String projectId) {
        AtomicBoolean flag = cancelFlags.get(projectId);
        if (flag != null) {
            flag.set(true);
            logger.forProject(projectId).info("cancellation requested");
            return true;
        }
        return false;
    }

    public Project getProject(String projectId) throws ProjectNotFoundException, IOException {
        return store.load(projectId);
    }

    public List<ProjectSummary> listProjects() throws IOException {
        return store.list();
    }

    public void deleteProject(String projectId) throws ProjectNotFoundException, IOException {
        turnGate.enter(projectId);
        try {
            store.delete(projectId);
        } finally {
            cancelFlags.remove(projectId);
            turnGate.retire(projectId);
        }
    }

    public StoryKnowledge queryKnowledge(String projectId, KnowledgeFilter filter)
            throws ProjectNotFoundException, IOException {
        Project project = store.load(projectId);
        return knowledgeStore.query(project.getKnowledge(), filter != null ? filter : KnowledgeFilter.all());
    }

    /**
     * Summary and character list of arbitrary chapter text. Not tied to a
     * project and never persisted.
     */
    public ChapterAnalysis analyzeChapter(String chapterText, ProviderConfig providerConfig, Credential credential)
            throws GenerationException, InterruptedException {
        if (chapterText == null || chapterText.isBlank()) {
            throw new ConfigurationException("Chapter text is required");
        }
        if (providerConfig == null) {
            throw new ConfigurationException("Provider is required");
        }
        ComposedPrompt prompt = composer.composeAnalysis(chapterText);
        GenerationRequest request = new GenerationRequest(providerConfig.getProvider(), credential,
            prompt.getBody(), options(providerConfig, prompt));
        String text = generateWithRetry(logger.forScope("Chapter analysis"), request, new AtomicBoolean(false),
            new AtomicInteger());
        if (text == null) {
            throw new TransientException("Chapter analysis was interrupted");
        }

        JsonNode node = JsonBlocks.parseObject(objectMapper, text);
        if (node == null) {
            logger.warn("Chapter analysis returned no JSON; using the opening of the reply as summary");
            return new ChapterAnalysis(knowledgeStore.summarize(text, ExtractedFacts.empty()), List.of());
        }
        List<String> characters = new ArrayList<>();
        for (JsonNode character : node.path("characters")) {
            String name = character.isTextual() ? character.asText() : character.path("name").asText("");
            if (!name.isBlank() && !characters.contains(name.trim())) {
                characters.add(name.trim());
            }
        }
        return new ChapterAnalysis(node.path("summary").asText(""), characters);
    }

    private Project runAndCommit(Project project, StageKind stage, Credential credential, StageRevision revision)
            throws IOException, StageCancelledException, InterruptedException {
        project.setStatus(PipelineStatus.pendingFor(stage));
        AtomicInteger attempts = new AtomicInteger();
        StageResult result;
        try {
            result = runStage(project, stage, credential, attempts);
        } catch (GenerationException e) {
            fail(project, stage, e.getKind(), e.getMessage(), attempts.get(), List.of(), revision);
            store.save(project);
            return project;
        }

        List<Contradiction> blocking = blockingContradictions(result);
        if (!blocking.isEmpty()) {
            fail(project, stage, ErrorKind.BLOCKING_CONTRADICTION,
                blocking.size() + " contradiction(s) at or above " + settings.getBlockingSeverity()
                    + " severity; first: " + blocking.get(0).getDescription(),
                attempts.get(), blocking, revision);
            store.save(project);
            return project;
        }

        commit(project, result);
        if (revision != null) {
            revision.setReplacementResultId(result.getId());
            revision.setDiff(diff(stage, revision.getDiscarded().get(0).getText(), result.getText()));
            project.getRevisions().add(revision);
        }
        store.save(project);
        return project;
    }

    /**
     * Compose, generate, extract and validate one stage. Does not touch the
     * project's results or knowledge.
     */
    private StageResult runStage(Project project, StageKind stage, Credential credential, AtomicInteger attempts)
            throws GenerationException, StageCancelledException, InterruptedException {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        cancelFlags.put(project.getId(), cancelled);
        try {
            StoryKnowledge knowledge = project.getKnowledge();
            ComposedPrompt prompt = composer.compose(stage, project.getConcept(), knowledge,
                project.getStageResults(), project.getChapterCount());
            ProviderConfig providerConfig = project.getProviderConfig();
            GenerationRequest request = new GenerationRequest(providerConfig.getProvider(), credential,
                prompt.getBody(), options(providerConfig, prompt));
            AppLogger.ScopedLog log = logger.forScope("Project " + project.getId() + " [" + stage + "]");
            log.info("generating (~" + prompt.estimatedTokens() + " prompt tokens)");

            String text = generateWithRetry(log, request, cancelled, attempts);
            if (text == null) {
                throw new StageCancelledException(project.getId(), stage);
            }

            ExtractedFacts facts = knowledgeStore.extract(text, stage);
            StageResult draft = new StageResult(StageResult.newId(), stage, text,
                knowledgeStore.summarize(text, facts), facts, null, List.of(),
                providerConfig.getProvider(), providerConfig.getModel(), attempts.get(),
                System.currentTimeMillis());
            return draft.withContradictions(validator.validate(draft, knowledge));
        } finally {
            cancelFlags.remove(project.getId(), cancelled);
        }
    }

    /**
     * Call the gateway until it succeeds, fails with a non-retryable error or
     * runs out of attempts. Returns null when cancelled between attempts.
     */
    private String generateWithRetry(AppLogger.ScopedLog log, GenerationRequest request,
                                     AtomicBoolean cancelled, AtomicInteger attempts)
            throws GenerationException, InterruptedException {
        RetryPolicy policy = settings.getRetryPolicy();
        for (int attempt = 1; ; attempt++) {
            if (cancelled.get()) {
                log.info("cancelled before attempt " + attempt);
                return null;
            }
            attempts.set(attempt);
            try {
                return gateway.generate(request);
            } catch (GenerationException e) {
                if (!policy.shouldRetry(e, attempt)) {
                    log.warn("failed after " + attempt + " attempt(s): " + e.getKind() + " - " + e.getMessage());
                    throw e;
                }
                long delay = policy.delayFor(e, attempt);
                log.warn("attempt " + attempt + "/" + policy.getMaxAttempts() + " failed (" + e.getKind()
                    + "), retrying in " + delay + "ms");
                sleeper.sleep(delay);
            }
        }
    }

    private void commit(Project project, StageResult result) {
        StoryKnowledge updated = knowledgeStore.copy(project.getKnowledge());
        knowledgeStore.commit(updated, result);
        project.setKnowledge(updated);
        project.getStageResults().add(result);

        StageKind next = result.getStage().next(project.getChapterCount());
        project.setNextStage(next);
        project.setStatus(PipelineStatus.pendingFor(next));
        project.setLastFailure(null);
        project.setUpdatedAt(System.currentTimeMillis());
        logger.forProject(project.getId()).info("committed " + result.getStage() + " ("
            + result.getContradictions().size() + " contradiction(s), " + result.getAttempts() + " attempt(s))"
            + (next == null ? "; complete" : "; next " + next));
    }

    private void fail(Project project, StageKind stage, ErrorKind kind, String message, int attempts,
                      List<Contradiction> contradictions, StageRevision revision) {
        long now = System.currentTimeMillis();
        project.setStatus(PipelineStatus.FAILED);
        project.setNextStage(stage);
        project.setLastFailure(new FailureInfo(stage, kind, message, attempts, contradictions, now));
        project.setUpdatedAt(now);
        if (revision != null) {
            project.getRevisions().add(revision);
        }
        logger.forProject(project.getId()).warn(stage + " failed (" + kind + ")");
    }

    private List<Contradiction> blockingContradictions(StageResult result) {
        Severity threshold = settings.getBlockingSeverity();
        List<Contradiction> blocking = new ArrayList<>();
        for (Contradiction contradiction : result.getContradictions()) {
            if (contradiction.getSeverity() != null && contradiction.getSeverity().atLeast(threshold)) {
                blocking.add(contradiction);
            }
        }
        return blocking;
    }

    private static GenerationOptions options(ProviderConfig providerConfig, ComposedPrompt prompt) {
        return GenerationOptions.from(providerConfig)
            .setSystemInstruction(prompt.getSystemInstruction())
            .setJsonOutput(prompt.isJsonOutput());
    }

    static List<String> diff(StageKind stage, String previous, String replacement) {
        List<String> original = lines(previous);
        List<String> revised = lines(replacement);
        var patch = DiffUtils.diff(original, revised);
        return UnifiedDiffUtils.generateUnifiedDiff(
            stage + " (previous)",
            stage + " (regenerated)",
            original,
            patch,
            3
        );
    }

    private static List<String> lines(String text) {
        return text == null || text.isEmpty() ? List.of() : Arrays.asList(text.split("\\R", -1));
    }

    private static String defaultTitle(StoryConcept concept) {
        String source = concept.getCoreIdea() != null && !concept.getCoreIdea().isBlank()
            ? concept.getCoreIdea() : concept.getPremise();
        if (source == null || source.isBlank()) {
            return "Untitled story";
        }
        String trimmed = source.trim();
        return trimmed.length() <= 60 ? trimmed : trimmed.substring(0, 57) + "...";
    }
}
