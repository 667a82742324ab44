package com.storyarchitect.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyarchitect.AppLogger;
import com.storyarchitect.models.AttributeAssertion;
import com.storyarchitect.models.Contradiction;
import com.storyarchitect.models.ContradictionKind;
import com.storyarchitect.models.Entity;
import com.storyarchitect.models.EntityCategory;
import com.storyarchitect.models.ExtractedFacts;
import com.storyarchitect.models.ExtractedFacts.EntityFact;
import com.storyarchitect.models.ExtractedFacts.EventFact;
import com.storyarchitect.models.ExtractedFacts.PrecedenceFact;
import com.storyarchitect.models.ExtractedFacts.ThreadFact;
import com.storyarchitect.models.PlotThread;
import com.storyarchitect.models.PlotThreadStatus;
import com.storyarchitect.models.Precedence;
import com.storyarchitect.models.StageKind;
import com.storyarchitect.models.StageResult;
import com.storyarchitect.models.StoryKnowledge;
import com.storyarchitect.models.TimelineEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Extracts facts from generated text and folds validated stage results into
 * {@link StoryKnowledge}.
 *
 * Commit never deletes: a value equal to the current one is a no-op, and a
 * value the validator flagged is recorded as disputed while the earlier value
 * stays current.
 */
public class KnowledgeStore {

    private static final int FALLBACK_SUMMARY_CHARS = 400;

    private final FactExtractor extractor;
    private final ObjectMapper mapper;
    private final AppLogger logger = AppLogger.get();

    public KnowledgeStore(FactExtractor extractor, ObjectMapper mapper) {
        this.extractor = extractor;
        this.mapper = mapper;
    }

    /**
     * Proposed updates from one stage's text. Extraction failures of any kind
     * degrade to an empty fact set so the stage can still proceed.
     */
    public ExtractedFacts extract(String text, StageKind stage) {
        try {
            ExtractedFacts facts = extractor.extract(text, stage);
            return facts != null ? facts : ExtractedFacts.empty();
        } catch (ExtractionException e) {
            logger.warn("Fact extraction for " + stage + " found nothing usable: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Fact extraction for " + stage + " failed (" + e.getClass().getSimpleName()
                + "); continuing with no new facts");
        }
        return ExtractedFacts.empty();
    }

    /**
     * Short summary for prompts of later chapters: the extracted summary, or
     * the opening of the prose when the model gave none.
     */
    public String summarize(String text, ExtractedFacts facts) {
        if (facts != null && facts.getSummary() != null && !facts.getSummary().isBlank()) {
            return facts.getSummary();
        }
        String prose = JsonBlocks.withoutBlocks(text, JsonFactExtractor.FACTS_TAG)
            .replaceAll("(?m)^#+\\s*", "")
            .replaceAll("\\s+", " ")
            .trim();
        if (prose.length() <= FALLBACK_SUMMARY_CHARS) {
            return prose;
        }
        int cut = prose.lastIndexOf(' ', FALLBACK_SUMMARY_CHARS);
        return prose.substring(0, cut > 0 ? cut : FALLBACK_SUMMARY_CHARS) + "...";
    }

    /**
     * Fold a validated stage result into the knowledge, in place.
     */
    public StoryKnowledge commit(StoryKnowledge knowledge, StageResult result) {
        ExtractedFacts facts = result.getFacts();
        StageKind stage = result.getStage();
        Set<String> disputedKeys = new HashSet<>();
        Set<String> rejectedEdges = new HashSet<>();
        for (Contradiction contradiction : result.getContradictions()) {
            if (contradiction.getKind() == ContradictionKind.ATTRIBUTE) {
                disputedKeys.add(NameFolding.foldName(contradiction.getSubject())
                    + "|" + NameFolding.foldAttribute(contradiction.getAttribute()));
            } else if (contradiction.getKind() == ContradictionKind.TIMELINE) {
                rejectedEdges.add(contradiction.getSubject() + "|" + contradiction.getAttribute());
            }
        }

        for (EntityFact fact : facts.getEntities()) {
            if (fact.getName() == null || fact.getName().isBlank()) {
                continue;
            }
            Entity entity = findEntity(knowledge, fact.getCategory(), fact.getName());
            if (entity == null) {
                entity = new Entity(fact.getName().trim(), fact.getCategory());
                entity.setFirstSeenSequence(stage.sequence());
                knowledge.putEntity(entity);
            } else if (!entity.getName().equals(fact.getName().trim())) {
                addAlias(entity, fact.getName().trim());
            }
            for (String alias : fact.getAliases()) {
                addAlias(entity, alias);
            }
            entity.touch(stage);

            for (Map.Entry<String, String> attribute : fact.getAttributes().entrySet()) {
                String key = NameFolding.foldAttribute(attribute.getKey());
                if (key.isEmpty() || attribute.getValue() == null || attribute.getValue().isBlank()) {
                    continue;
                }
                AttributeAssertion assertion = new AttributeAssertion(
                    attribute.getKey(), attribute.getValue().trim(), result.getId(), stage);
                AttributeAssertion current = entity.getAttributes().get(key);
                if (current == null) {
                    entity.getAttributes().put(key, assertion);
                } else if (disputedKeys.contains(NameFolding.foldName(entity.getName()) + "|" + key)) {
                    entity.getDisputed().add(assertion);
                }
            }
        }

        for (EventFact event : facts.getEvents()) {
            ensureEvent(knowledge, event.getKey(), event.getDescription(), result.getId());
        }
        for (PrecedenceFact edge : facts.getPrecedences()) {
            String before = NameFolding.foldKey(edge.getBefore());
            String after = NameFolding.foldKey(edge.getAfter());
            if (before.isEmpty() || after.isEmpty() || before.equals(after)
                || rejectedEdges.contains(before + "|" + after)) {
                continue;
            }
            ensureEvent(knowledge, edge.getBefore(), null, result.getId());
            ensureEvent(knowledge, edge.getAfter(), null, result.getId());
            boolean known = knowledge.getPrecedences().stream()
                .anyMatch(p -> p.getBefore().equals(before) && p.getAfter().equals(after));
            if (!known) {
                knowledge.getPrecedences().add(new Precedence(before, after, result.getId()));
            }
        }
        reorderTimeline(knowledge);

        for (ThreadFact opened : facts.getOpenedThreads()) {
            if (opened.getName() == null || opened.getName().isBlank()) {
                continue;
            }
            String key = NameFolding.foldKey(opened.getName());
            if (!knowledge.getPlotThreads().containsKey(key)) {
                knowledge.getPlotThreads().put(key,
                    new PlotThread(opened.getName().trim(), opened.getDescription(), result.getId()));
            }
        }
        for (String resolved : facts.getResolvedThreads()) {
            String key = NameFolding.foldKey(resolved);
            if (key.isEmpty()) {
                continue;
            }
            PlotThread thread = knowledge.getPlotThreads().get(key);
            if (thread == null) {
                thread = new PlotThread(resolved.trim(), null, null);
                knowledge.getPlotThreads().put(key, thread);
            }
            if (thread.isOpen()) {
                thread.setStatus(PlotThreadStatus.RESOLVED);
                thread.setResolvedBy(result.getId());
            }
        }
        return knowledge;
    }

    /**
     * Knowledge as it stands after replaying the given results in order.
     */
    public StoryKnowledge rebuild(List<StageResult> results) {
        StoryKnowledge knowledge = new StoryKnowledge();
        for (StageResult result : results) {
            commit(knowledge, result);
        }
        return knowledge;
    }

    public StoryKnowledge query(StoryKnowledge knowledge, KnowledgeFilter filter) {
        StoryKnowledge subset = new StoryKnowledge();
        for (Entity entity : knowledge.allEntities()) {
            if (matches(entity, filter)) {
                subset.putEntity(entity);
            }
        }
        subset.setTimeline(new ArrayList<>(knowledge.getTimeline()));
        subset.setPrecedences(new ArrayList<>(knowledge.getPrecedences()));
        Map<String, PlotThread> threads = new LinkedHashMap<>();
        for (Map.Entry<String, PlotThread> entry : knowledge.getPlotThreads().entrySet()) {
            if (!filter.isOpenThreadsOnly() || entry.getValue().isOpen()) {
                threads.put(entry.getKey(), entry.getValue());
            }
        }
        subset.setPlotThreads(threads);
        return subset;
    }

    /**
     * Deep copy, so a stage can work on knowledge that is discarded if it fails.
     */
    public StoryKnowledge copy(StoryKnowledge knowledge) {
        return mapper.convertValue(knowledge, StoryKnowledge.class);
    }

    /**
     * Entity lookup by exact name, then by folded name or alias within the category.
     */
    public static Entity findEntity(StoryKnowledge knowledge, EntityCategory category, String name) {
        if (name == null) {
            return null;
        }
        Entity exact = knowledge.getEntity(category, name.trim());
        if (exact != null) {
            return exact;
        }
        Map<String, Entity> byName = knowledge.getEntities().get(category);
        if (byName == null) {
            return null;
        }
        for (Entity entity : byName.values()) {
            if (NameFolding.sameName(entity.getName(), name)) {
                return entity;
            }
            for (String alias : entity.getAliases()) {
                if (NameFolding.sameName(alias, name)) {
                    return entity;
                }
            }
        }
        return null;
    }

    private boolean matches(Entity entity, KnowledgeFilter filter) {
        if (!filter.getCategories().isEmpty() && !filter.getCategories().contains(entity.getCategory())) {
            return false;
        }
        if (filter.getTouchedSinceChapter() != null) {
            Integer touched = entity.getLastTouchedChapter();
            if (touched == null || touched < filter.getTouchedSinceChapter()) {
                return false;
            }
        }
        if (!filter.getNames().isEmpty()) {
            if (filter.getNames().contains(NameFolding.foldName(entity.getName()))) {
                return true;
            }
            for (String alias : entity.getAliases()) {
                if (filter.getNames().contains(NameFolding.foldName(alias))) {
                    return true;
                }
            }
            return false;
        }
        return true;
    }

    private static void addAlias(Entity entity, String alias) {
        if (alias == null || alias.isBlank() || NameFolding.sameName(entity.getName(), alias)) {
            return;
        }
        for (String existing : entity.getAliases()) {
            if (existing.equalsIgnoreCase(alias.trim())) {
                return;
            }
        }
        entity.getAliases().add(alias.trim());
    }

    private static void ensureEvent(StoryKnowledge knowledge, String rawKey, String description, String resultId) {
        String key = NameFolding.foldKey(rawKey);
        if (key.isEmpty()) {
            return;
        }
        TimelineEvent existing = knowledge.getEvent(key);
        if (existing == null) {
            knowledge.getTimeline().add(new TimelineEvent(key,
                description != null ? description : rawKey, knowledge.nextOrderKey(), resultId));
        } else if (description != null
            && (existing.getDescription() == null || existing.getDescription().equals(rawKey))) {
            existing.setDescription(description);
        }
    }

    /**
     * Reassign relative order keys so that every committed precedence holds,
     * keeping assertion order among unconstrained events.
     */
    static void reorderTimeline(StoryKnowledge knowledge) {
        Map<String, TimelineEvent> byKey = new HashMap<>();
        Map<String, Integer> indegree = new HashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        for (TimelineEvent event : knowledge.getTimeline()) {
            byKey.put(event.getKey(), event);
            indegree.put(event.getKey(), 0);
        }
        for (Precedence edge : knowledge.getPrecedences()) {
            if (!byKey.containsKey(edge.getBefore()) || !byKey.containsKey(edge.getAfter())) {
                continue;
            }
            successors.computeIfAbsent(edge.getBefore(), k -> new ArrayList<>()).add(edge.getAfter());
            indegree.merge(edge.getAfter(), 1, Integer::sum);
        }
        PriorityQueue<TimelineEvent> ready = new PriorityQueue<>(
            Comparator.comparingLong(TimelineEvent::getOrderKey));
        for (TimelineEvent event : knowledge.getTimeline()) {
            if (indegree.get(event.getKey()) == 0) {
                ready.add(event);
            }
        }
        List<TimelineEvent> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            TimelineEvent next = ready.poll();
            ordered.add(next);
            for (String successor : successors.getOrDefault(next.getKey(), List.of())) {
                if (indegree.merge(successor, -1, Integer::sum) == 0) {
                    ready.add(byKey.get(successor));
                }
            }
        }
        if (ordered.size() != knowledge.getTimeline().size()) {
            // Committed precedences are acyclic, so this only happens with hand-edited data
            return;
        }
        long orderKey = 1;
        for (TimelineEvent event : ordered) {
            event.setOrderKey(orderKey++);
        }
        knowledge.setTimeline(ordered);
    }
}
