package com.storyarchitect.validation;

import com.storyarchitect.AppLogger;
import com.storyarchitect.knowledge.KnowledgeStore;
import com.storyarchitect.knowledge.NameFolding;
import com.storyarchitect.models.AttributeAssertion;
import com.storyarchitect.models.Contradiction;
import com.storyarchitect.models.ContradictionKind;
import com.storyarchitect.models.Entity;
import com.storyarchitect.models.EntityCategory;
import com.storyarchitect.models.ExtractedFacts;
import com.storyarchitect.models.ExtractedFacts.EntityFact;
import com.storyarchitect.models.ExtractedFacts.PrecedenceFact;
import com.storyarchitect.models.PlotThread;
import com.storyarchitect.models.Severity;
import com.storyarchitect.models.StageResult;
import com.storyarchitect.models.StoryKnowledge;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Checks the facts proposed by a stage result against committed knowledge.
 *
 * The newer assertion is always the candidate and the committed one is
 * treated as ground truth; both sides go into the record and nothing is
 * resolved here.
 */
public class ConsistencyValidator {

    private final EquivalenceRule equivalence;
    private final AppLogger logger = AppLogger.get();

    public ConsistencyValidator() {
        this(EquivalenceRule.defaults());
    }

    public ConsistencyValidator(EquivalenceRule equivalence) {
        this.equivalence = equivalence;
    }

    public List<Contradiction> validate(StageResult result, StoryKnowledge knowledge) {
        List<Contradiction> found = new ArrayList<>();
        ExtractedFacts facts = result.getFacts();
        checkAttributes(result, facts, knowledge, found);
        checkTimeline(result, facts, knowledge, found);
        checkPlotThreads(result, facts, knowledge, found);
        if (!found.isEmpty()) {
            logger.info("Validation of " + result.getStage() + " flagged " + found.size() + " contradiction(s)");
        }
        return found;
    }

    private void checkAttributes(StageResult result, ExtractedFacts facts, StoryKnowledge knowledge,
                                 List<Contradiction> found) {
        Set<String> reported = new HashSet<>();
        for (EntityFact fact : facts.getEntities()) {
            Entity entity = KnowledgeStore.findEntity(knowledge, fact.getCategory(), fact.getName());
            if (entity == null) {
                continue;
            }
            for (Map.Entry<String, String> attribute : fact.getAttributes().entrySet()) {
                String key = NameFolding.foldAttribute(attribute.getKey());
                String value = attribute.getValue();
                if (key.isEmpty() || value == null || value.isBlank()) {
                    continue;
                }
                AttributeAssertion prior = entity.getAttributes().get(key);
                if (prior == null || equivalence.equivalent(key, prior.getValue(), value.trim())) {
                    continue;
                }
                if (!reported.add(NameFolding.foldName(entity.getName()) + "|" + key)) {
                    continue;
                }
                Severity severity = entity.getCategory() == EntityCategory.CHARACTER
                    ? Severity.MAJOR : Severity.MINOR;
                found.add(new Contradiction(newId(), ContradictionKind.ATTRIBUTE, severity,
                    result.getId(), prior.getStageResultId(), entity.getName(), attribute.getKey(),
                    prior.getValue(), value.trim(),
                    entity.getName() + " has " + attribute.getKey() + " \"" + value.trim()
                        + "\" in " + result.getStage() + " but \"" + prior.getValue()
                        + "\" was established in " + prior.getStage()));
            }
        }
    }

    private void checkTimeline(StageResult result, ExtractedFacts facts, StoryKnowledge knowledge,
                               List<Contradiction> found) {
        PrecedenceGraph graph = PrecedenceGraph.of(knowledge.getPrecedences());
        for (PrecedenceFact edge : facts.getPrecedences()) {
            String before = NameFolding.foldKey(edge.getBefore());
            String after = NameFolding.foldKey(edge.getAfter());
            if (before.isEmpty() || after.isEmpty()) {
                continue;
            }
            List<String> path = graph.path(after, before);
            if (path.isEmpty()) {
                graph.add(before, after, result.getId());
                continue;
            }
            String prior = priorOwner(graph, path, result.getId());
            String description = before.equals(after)
                ? "Event \"" + before + "\" is asserted to precede itself"
                : "\"" + before + "\" before \"" + after + "\" closes a cycle: "
                    + String.join(" -> ", path) + " -> " + after;
            found.add(new Contradiction(newId(), ContradictionKind.TIMELINE, Severity.CRITICAL,
                result.getId(), prior, before, after,
                after + " before " + before, before + " before " + after, description));
        }
    }

    private void checkPlotThreads(StageResult result, ExtractedFacts facts, StoryKnowledge knowledge,
                                  List<Contradiction> found) {
        for (String resolved : facts.getResolvedThreads()) {
            PlotThread thread = knowledge.getPlotThreads().get(NameFolding.foldKey(resolved));
            if (thread == null || thread.isOpen()) {
                continue;
            }
            found.add(new Contradiction(newId(), ContradictionKind.PLOT_THREAD, Severity.MINOR,
                result.getId(), thread.getResolvedBy(), thread.getName(), null,
                "resolved", "resolved again",
                "Plot thread \"" + thread.getName() + "\" was already resolved"));
        }
    }

    /**
     * First edge on the cycle that an earlier stage result asserted; falls back
     * to the current result when the whole cycle comes from it.
     */
    private static String priorOwner(PrecedenceGraph graph, List<String> path, String currentId) {
        for (int i = 0; i + 1 < path.size(); i++) {
            String owner = graph.assertedBy(path.get(i), path.get(i + 1));
            if (owner != null && !owner.equals(currentId)) {
                return owner;
            }
        }
        return path.size() > 1 ? graph.assertedBy(path.get(0), path.get(1)) : currentId;
    }

    private static String newId() {
        return "ct_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
