package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A character, location or object known to the story. Each attribute has at
 * most one current value; later conflicting values are kept in
 * {@link #getDisputed()} and never replace it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Entity {

    private String name;
    private EntityCategory category;
    private List<String> aliases = new ArrayList<>();
    private Map<String, AttributeAssertion> attributes = new LinkedHashMap<>();
    private List<AttributeAssertion> disputed = new ArrayList<>();
    private int firstSeenSequence;
    private int lastTouchedSequence;
    private Integer lastTouchedChapter;
    private int mentionCount;

    public Entity() {
    }

    public Entity(String name, EntityCategory category) {
        this.name = name;
        this.category = category;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public EntityCategory getCategory() {
        return category;
    }

    public void setCategory(EntityCategory category) {
        this.category = category;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public void setAliases(List<String> aliases) {
        this.aliases = aliases != null ? aliases : new ArrayList<>();
    }

    /**
     * Current value per attribute, keyed by the folded attribute name.
     */
    public Map<String, AttributeAssertion> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, AttributeAssertion> attributes) {
        this.attributes = attributes != null ? attributes : new LinkedHashMap<>();
    }

    public List<AttributeAssertion> getDisputed() {
        return disputed;
    }

    public void setDisputed(List<AttributeAssertion> disputed) {
        this.disputed = disputed != null ? disputed : new ArrayList<>();
    }

    public int getFirstSeenSequence() {
        return firstSeenSequence;
    }

    public void setFirstSeenSequence(int firstSeenSequence) {
        this.firstSeenSequence = firstSeenSequence;
    }

    public int getLastTouchedSequence() {
        return lastTouchedSequence;
    }

    public void setLastTouchedSequence(int lastTouchedSequence) {
        this.lastTouchedSequence = lastTouchedSequence;
    }

    /**
     * Last chapter that mentioned this entity, or null if only the concept or
     * outline did.
     */
    public Integer getLastTouchedChapter() {
        return lastTouchedChapter;
    }

    public void setLastTouchedChapter(Integer lastTouchedChapter) {
        this.lastTouchedChapter = lastTouchedChapter;
    }

    public int getMentionCount() {
        return mentionCount;
    }

    public void setMentionCount(int mentionCount) {
        this.mentionCount = mentionCount;
    }

    public void touch(StageKind stage) {
        mentionCount++;
        lastTouchedSequence = Math.max(lastTouchedSequence, stage.sequence());
        if (stage.isChapter()) {
            lastTouchedChapter = lastTouchedChapter == null
                ? stage.getChapter()
                : Math.max(lastTouchedChapter, stage.getChapter());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity)) return false;
        Entity entity = (Entity) o;
        return firstSeenSequence == entity.firstSeenSequence
            && lastTouchedSequence == entity.lastTouchedSequence
            && mentionCount == entity.mentionCount
            && Objects.equals(name, entity.name)
            && category == entity.category
            && Objects.equals(aliases, entity.aliases)
            && Objects.equals(attributes, entity.attributes)
            && Objects.equals(disputed, entity.disputed)
            && Objects.equals(lastTouchedChapter, entity.lastTouchedChapter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, category, aliases, attributes, disputed,
            firstSeenSequence, lastTouchedSequence, lastTouchedChapter, mentionCount);
    }
}
