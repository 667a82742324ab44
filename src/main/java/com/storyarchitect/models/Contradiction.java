package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A conflict between a newly asserted fact and a previously committed one.
 * The new fact ({@code stageResultId}) is the candidate; the prior one is kept
 * as ground truth. Both sides are recorded for review and nothing is resolved
 * automatically.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Contradiction {

    private final String id;
    private final ContradictionKind kind;
    private final Severity severity;
    private final String stageResultId;
    private final String priorStageResultId;
    private final String subject;
    private final String attribute;
    private final String priorValue;
    private final String newValue;
    private final String description;

    @JsonCreator
    public Contradiction(@JsonProperty("id") String id,
                         @JsonProperty("kind") ContradictionKind kind,
                         @JsonProperty("severity") Severity severity,
                         @JsonProperty("stageResultId") String stageResultId,
                         @JsonProperty("priorStageResultId") String priorStageResultId,
                         @JsonProperty("subject") String subject,
                         @JsonProperty("attribute") String attribute,
                         @JsonProperty("priorValue") String priorValue,
                         @JsonProperty("newValue") String newValue,
                         @JsonProperty("description") String description) {
        this.id = id;
        this.kind = kind;
        this.severity = severity;
        this.stageResultId = stageResultId;
        this.priorStageResultId = priorStageResultId;
        this.subject = subject;
        this.attribute = attribute;
        this.priorValue = priorValue;
        this.newValue = newValue;
        this.description = description;
    }

    public String getId() {
        return id;
    }

    public ContradictionKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * The stage result that asserted the conflicting (newer) fact.
     */
    public String getStageResultId() {
        return stageResultId;
    }

    /**
     * The stage result whose earlier assertion is treated as ground truth.
     */
    public String getPriorStageResultId() {
        return priorStageResultId;
    }

    /**
     * Entity name for attribute conflicts, the earlier event of the pair for
     * timeline conflicts, the thread name for plot-thread conflicts.
     */
    public String getSubject() {
        return subject;
    }

    /**
     * Attribute name, or the later event of the pair for timeline conflicts.
     */
    public String getAttribute() {
        return attribute;
    }

    public String getPriorValue() {
        return priorValue;
    }

    public String getNewValue() {
        return newValue;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Contradiction)) return false;
        Contradiction that = (Contradiction) o;
        return Objects.equals(id, that.id)
            && kind == that.kind
            && severity == that.severity
            && Objects.equals(stageResultId, that.stageResultId)
            && Objects.equals(priorStageResultId, that.priorStageResultId)
            && Objects.equals(subject, that.subject)
            && Objects.equals(attribute, that.attribute)
            && Objects.equals(priorValue, that.priorValue)
            && Objects.equals(newValue, that.newValue)
            && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, severity, stageResultId, priorStageResultId,
            subject, attribute, priorValue, newValue, description);
    }

    @Override
    public String toString() {
        return kind + "/" + severity + ": " + description;
    }
}
