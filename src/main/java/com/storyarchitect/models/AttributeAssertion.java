package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One asserted attribute value together with the stage result that asserted it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AttributeAssertion {

    private final String attribute;
    private final String value;
    private final String stageResultId;
    private final StageKind stage;

    @JsonCreator
    public AttributeAssertion(@JsonProperty("attribute") String attribute,
                              @JsonProperty("value") String value,
                              @JsonProperty("stageResultId") String stageResultId,
                              @JsonProperty("stage") StageKind stage) {
        this.attribute = attribute;
        this.value = value;
        this.stageResultId = stageResultId;
        this.stage = stage;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getValue() {
        return value;
    }

    public String getStageResultId() {
        return stageResultId;
    }

    public StageKind getStage() {
        return stage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeAssertion)) return false;
        AttributeAssertion that = (AttributeAssertion) o;
        return Objects.equals(attribute, that.attribute)
            && Objects.equals(value, that.value)
            && Objects.equals(stageResultId, that.stageResultId)
            && Objects.equals(stage, that.stage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attribute, value, stageResultId, stage);
    }
}
