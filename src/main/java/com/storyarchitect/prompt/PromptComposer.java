package com.storyarchitect.prompt;

import com.storyarchitect.AppLogger;
import com.storyarchitect.knowledge.JsonBlocks;
import com.storyarchitect.knowledge.JsonFactExtractor;
import com.storyarchitect.knowledge.NameFolding;
import com.storyarchitect.models.AttributeAssertion;
import com.storyarchitect.models.Entity;
import com.storyarchitect.models.PlotThread;
import com.storyarchitect.models.StageKind;
import com.storyarchitect.models.StageResult;
import com.storyarchitect.models.StoryConcept;
import com.storyarchitect.models.StoryKnowledge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Builds the prompt for each pipeline stage from the concept, earlier stage
 * results and accumulated knowledge.
 *
 * <p>Every prompt fits the configured {@link PromptBudget}. For chapters the
 * knowledge digest gives way first (least relevant entities), then the oldest
 * chapter summaries, then the outline text. Entities touched in the previous
 * or current chapter are never dropped from the digest.</p>
 */
public class PromptComposer {

    static final String SYSTEM_AUTHOR = "You are a story architect helping an author write a novel. "
        + "Stay consistent with everything already established about the characters, places and timeline.";
    static final String SYSTEM_ANALYST = "You are a literary analyst. Answer with JSON only.";

    static final String FACTS_INSTRUCTIONS = "After the text, add a fenced block tagged `"
        + JsonFactExtractor.FACTS_TAG + "` with JSON describing what this text establishes:\n"
        + "```" + JsonFactExtractor.FACTS_TAG + "\n"
        + "{\"summary\": \"two or three sentences\",\n"
        + " \"entities\": [{\"name\": \"...\", \"category\": \"character|location|object\", "
        + "\"aliases\": [], \"attributes\": {\"eyeColor\": \"...\"}}],\n"
        + " \"events\": [{\"key\": \"short-event-id\", \"description\": \"...\"}],\n"
        + " \"precedences\": [{\"before\": \"event-key\", \"after\": \"event-key\"}],\n"
        + " \"plotThreads\": {\"opened\": [{\"name\": \"...\", \"description\": \"...\"}], \"resolved\": [\"...\"]}}\n"
        + "```\n";

    private static final String TRUNCATED = "\n[...]\n";

    private final PromptBudget budget;
    private final OutlineParser outlineParser;
    private final AppLogger logger = AppLogger.get();

    public PromptComposer(PromptBudget budget, OutlineParser outlineParser) {
        this.budget = budget;
        this.outlineParser = outlineParser;
    }

    public PromptBudget getBudget() {
        return budget;
    }

    public ComposedPrompt compose(StageKind stage, StoryConcept concept, StoryKnowledge knowledge,
                                  List<StageResult> priorResults, int chapterCount) {
        ComposedPrompt prompt;
        switch (stage.getType()) {
            case CONCEPT:
                prompt = composeConcept(concept);
                break;
            case OUTLINE:
                prompt = composeOutline(concept, priorResults, chapterCount);
                break;
            default:
                prompt = composeChapter(stage.getChapter(), concept, knowledge, priorResults, chapterCount);
                break;
        }
        return enforceBudget(prompt);
    }

    /**
     * Prompt for summarizing arbitrary chapter text and listing its characters.
     */
    public ComposedPrompt composeAnalysis(String chapterText) {
        String head = "Analyze the chapter below. Respond with a JSON object of the form "
            + "{\"summary\": \"...\", \"characters\": [\"name\", ...]} listing every named character.\n\n"
            + "CHAPTER:\n";
        int allowed = budget.maxChars() - SYSTEM_ANALYST.length() - head.length();
        return enforceBudget(new ComposedPrompt(SYSTEM_ANALYST, head + clamp(chapterText, allowed), true));
    }

    ComposedPrompt composeConcept(StoryConcept concept) {
        StringBuilder body = new StringBuilder();
        body.append("Develop a story concept from the author's notes.\n\n");
        appendConceptFields(body, concept);
        body.append("\nDescribe the premise, the central conflict, the main characters with their defining traits, ")
            .append("the setting and the tone.\n\n")
            .append(FACTS_INSTRUCTIONS);
        return new ComposedPrompt(SYSTEM_AUTHOR, body.toString(), false);
    }

    ComposedPrompt composeOutline(StoryConcept concept, List<StageResult> priorResults, int chapterCount) {
        String head = "Create a chapter outline for the novel described below.\n\n## Concept\n";
        String tail = "\n\nRespond with a single JSON object of the form\n"
            + "{\"outline\": {\"act_1\": {\"title\": \"...\", \"chapters\": [{\"title\": \"...\", \"summary\": \"...\"}]},"
            + " \"act_2\": {...}, \"act_3\": {...}},\n"
            + " \"facts\": {\"summary\": \"...\", \"entities\": [...], \"events\": [...], \"precedences\": [...],"
            + " \"plotThreads\": {\"opened\": [...], \"resolved\": []}}}\n"
            + "with exactly " + chapterCount + " chapters across the three acts. The facts object uses the "
            + "same fields as before: entities with name, category and attributes; events with key and "
            + "description; precedences with before and after event keys.\n";
        StageResult conceptResult = find(priorResults, StageKind.CONCEPT);
        String conceptText = conceptResult != null
            ? JsonBlocks.withoutBlocks(conceptResult.getText(), JsonFactExtractor.FACTS_TAG)
            : conceptFieldsText(concept);
        int allowed = budget.maxChars() - SYSTEM_AUTHOR.length() - head.length() - tail.length();
        return new ComposedPrompt(SYSTEM_AUTHOR, head + clamp(conceptText, allowed) + tail, true);
    }

    ComposedPrompt composeChapter(int chapter, StoryConcept concept, StoryKnowledge knowledge,
                                  List<StageResult> priorResults, int chapterCount) {
        List<ChapterPlan> plans = new ArrayList<>();
        String outlineText = "";
        StageResult outline = find(priorResults, StageKind.OUTLINE);
        if (outline != null) {
            plans = outlineParser.parse(outline.getText());
            outlineText = plans.isEmpty()
                ? JsonBlocks.withoutBlocks(outline.getText(), JsonFactExtractor.FACTS_TAG)
                : renderPlans(plans);
        }
        ChapterPlan plan = chapter <= plans.size() ? plans.get(chapter - 1) : null;

        StringBuilder head = new StringBuilder();
        head.append("Write chapter ").append(chapter).append(" of a ").append(chapterCount)
            .append("-chapter novel.\n");
        String brief = conceptBrief(concept);
        if (!brief.isEmpty()) {
            head.append(brief).append('\n');
        }
        head.append("\n## This chapter\n");
        if (plan != null) {
            head.append("Chapter ").append(chapter).append(": ").append(plan.getTitle()).append('\n');
            if (plan.getSummary() != null && !plan.getSummary().isEmpty()) {
                head.append(plan.getSummary()).append('\n');
            }
        } else {
            head.append("Chapter ").append(chapter).append(" (continue the story from where it left off)\n");
        }
        String tail = "\nWrite the complete chapter as prose. Keep every established fact unchanged "
            + "unless the story explicitly changes it.\n\n" + FACTS_INSTRUCTIONS;

        List<String> summaries = new ArrayList<>();
        for (StageResult result : priorResults) {
            if (result.getStage().isChapter() && result.getStage().getChapter() < chapter) {
                summaries.add("Chapter " + result.getStage().getChapter() + ": "
                    + (result.getSummary() != null ? result.getSummary() : ""));
            }
        }

        String scope = plan != null ? " " + NameFolding.foldName(plan.getTitle() + " " + plan.getSummary()) + " " : "";
        List<Entity> pinned = new ArrayList<>();
        List<Entity> others = new ArrayList<>();
        for (Entity entity : knowledge.allEntities()) {
            Integer touched = entity.getLastTouchedChapter();
            if (touched != null && touched >= chapter - 1) {
                pinned.add(entity);
            } else {
                others.add(entity);
            }
        }
        Comparator<Entity> relevance = byRelevance(scope);
        pinned.sort(relevance);
        others.sort(relevance);
        List<String> pinnedLines = new ArrayList<>();
        for (Entity entity : pinned) {
            pinnedLines.add(entityLine(entity));
        }
        List<String> otherLines = new ArrayList<>();
        for (Entity entity : others) {
            otherLines.add(entityLine(entity));
        }
        List<String> threadLines = new ArrayList<>();
        for (PlotThread thread : knowledge.openThreads()) {
            threadLines.add("- " + thread.getName()
                + (thread.getDescription() != null && !thread.getDescription().isBlank()
                    ? ": " + thread.getDescription() : ""));
        }

        int allowed = budget.maxChars() - SYSTEM_AUTHOR.length() - head.length() - tail.length();
        int length = renderContext(pinnedLines, otherLines, threadLines, summaries, outlineText).length();
        int droppedEntities = 0;
        while (length > allowed && !otherLines.isEmpty()) {
            length -= otherLines.remove(otherLines.size() - 1).length() + 1;
            droppedEntities++;
        }
        int droppedSummaries = 0;
        while (length > allowed && !summaries.isEmpty()) {
            length -= summaries.remove(0).length() + 1;
            droppedSummaries++;
        }
        String context = renderContext(pinnedLines, otherLines, threadLines, summaries, outlineText);
        if (context.length() > allowed) {
            context = clamp(context, allowed);
        }
        if (droppedEntities > 0 || droppedSummaries > 0) {
            logger.info("Prompt for chapter " + chapter + " trimmed to budget: dropped " + droppedEntities
                + " entities and " + droppedSummaries + " summaries");
        }
        return new ComposedPrompt(SYSTEM_AUTHOR, head + context + tail, false);
    }

    /**
     * Context section, most important first so a final clamp cuts the outline.
     */
    private static String renderContext(List<String> pinned, List<String> others, List<String> threads,
                                        List<String> summaries, String outlineText) {
        StringBuilder context = new StringBuilder();
        context.append("\n## Established characters, places and objects\n");
        for (String line : pinned) {
            context.append(line).append('\n');
        }
        for (String line : others) {
            context.append(line).append('\n');
        }
        context.append("\n## Open plot threads\n");
        for (String line : threads) {
            context.append(line).append('\n');
        }
        context.append("\n## Story so far\n");
        for (String line : summaries) {
            context.append(line).append('\n');
        }
        context.append("\n## Outline\n").append(outlineText).append('\n');
        return context.toString();
    }

    private static Comparator<Entity> byRelevance(String scope) {
        Comparator<Entity> inScope = Comparator.comparing(entity -> !mentioned(scope, entity));
        return inScope
            .thenComparing(Comparator.comparingInt(Entity::getLastTouchedSequence).reversed())
            .thenComparing(Comparator.comparingInt((Entity entity) -> entity.getAttributes().size()).reversed())
            .thenComparing(Comparator.comparingInt(Entity::getMentionCount).reversed())
            .thenComparing(Entity::getName);
    }

    private static boolean mentioned(String scope, Entity entity) {
        if (scope.isEmpty()) {
            return false;
        }
        String name = NameFolding.foldName(entity.getName());
        if (!name.isEmpty() && scope.contains(" " + name + " ")) {
            return true;
        }
        for (String alias : entity.getAliases()) {
            String folded = NameFolding.foldName(alias);
            if (!folded.isEmpty() && scope.contains(" " + folded + " ")) {
                return true;
            }
        }
        return false;
    }

    static String entityLine(Entity entity) {
        StringBuilder line = new StringBuilder("- ").append(entity.getName())
            .append(" [").append(entity.getCategory().name().toLowerCase(Locale.ROOT)).append(']');
        if (!entity.getAliases().isEmpty()) {
            line.append(" (also ").append(String.join(", ", entity.getAliases())).append(')');
        }
        if (!entity.getAttributes().isEmpty()) {
            List<String> attributes = new ArrayList<>();
            for (AttributeAssertion assertion : entity.getAttributes().values()) {
                attributes.add(assertion.getAttribute() + ": " + assertion.getValue());
            }
            line.append(": ").append(String.join("; ", attributes));
        }
        return line.toString();
    }

    private static String renderPlans(List<ChapterPlan> plans) {
        StringBuilder text = new StringBuilder();
        for (ChapterPlan plan : plans) {
            text.append(plan.getNumber()).append(". ").append(plan.getTitle());
            if (plan.getSummary() != null && !plan.getSummary().isEmpty()) {
                text.append(": ").append(plan.getSummary());
            }
            text.append('\n');
        }
        return text.toString().trim();
    }

    private static void appendConceptFields(StringBuilder body, StoryConcept concept) {
        if (concept == null) {
            return;
        }
        appendField(body, "Genre", concept.getGenre());
        appendField(body, "Theme", concept.getTheme());
        appendField(body, "Core idea", concept.getCoreIdea());
        appendField(body, "Style", concept.getStyle());
        appendField(body, "Premise", concept.getPremise());
    }

    private static String conceptFieldsText(StoryConcept concept) {
        StringBuilder text = new StringBuilder();
        appendConceptFields(text, concept);
        return text.toString();
    }

    private static void appendField(StringBuilder body, String label, String value) {
        if (value != null && !value.isBlank()) {
            body.append(label).append(": ").append(value.trim()).append('\n');
        }
    }

    private static String conceptBrief(StoryConcept concept) {
        if (concept == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        if (concept.getGenre() != null && !concept.getGenre().isBlank()) {
            parts.add("Genre: " + concept.getGenre().trim());
        }
        if (concept.getStyle() != null && !concept.getStyle().isBlank()) {
            parts.add("Style: " + concept.getStyle().trim());
        }
        return String.join(". ", parts);
    }

    private static StageResult find(List<StageResult> results, StageKind stage) {
        for (StageResult result : results) {
            if (result.getStage().equals(stage)) {
                return result;
            }
        }
        return null;
    }

    private static String clamp(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        if (maxChars <= TRUNCATED.length()) {
            return "";
        }
        return text.substring(0, maxChars - TRUNCATED.length()) + TRUNCATED;
    }

    private ComposedPrompt enforceBudget(ComposedPrompt prompt) {
        int allowed = budget.maxChars() - prompt.getSystemInstruction().length();
        if (prompt.getBody().length() <= allowed) {
            return prompt;
        }
        logger.warn("Prompt exceeded budget after trimming; clamping to " + budget.getMaxTokens() + " tokens");
        return new ComposedPrompt(prompt.getSystemInstruction(),
            prompt.getBody().substring(0, Math.max(0, allowed)), prompt.isJsonOutput());
    }
}
