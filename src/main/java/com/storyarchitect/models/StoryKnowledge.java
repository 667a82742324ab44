package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structured facts accumulated from all committed stage results: entities per
 * category (names unique within a category), timeline events with their
 * precedence constraints, and plot threads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoryKnowledge {

    private Map<EntityCategory, Map<String, Entity>> entities = new LinkedHashMap<>();
    private List<TimelineEvent> timeline = new ArrayList<>();
    private List<Precedence> precedences = new ArrayList<>();
    private Map<String, PlotThread> plotThreads = new LinkedHashMap<>();

    public Map<EntityCategory, Map<String, Entity>> getEntities() {
        return entities;
    }

    public void setEntities(Map<EntityCategory, Map<String, Entity>> entities) {
        this.entities = entities != null ? entities : new LinkedHashMap<>();
    }

    public List<TimelineEvent> getTimeline() {
        return timeline;
    }

    public void setTimeline(List<TimelineEvent> timeline) {
        this.timeline = timeline != null ? timeline : new ArrayList<>();
    }

    public List<Precedence> getPrecedences() {
        return precedences;
    }

    public void setPrecedences(List<Precedence> precedences) {
        this.precedences = precedences != null ? precedences : new ArrayList<>();
    }

    public Map<String, PlotThread> getPlotThreads() {
        return plotThreads;
    }

    public void setPlotThreads(Map<String, PlotThread> plotThreads) {
        this.plotThreads = plotThreads != null ? plotThreads : new LinkedHashMap<>();
    }

    public Entity getEntity(EntityCategory category, String name) {
        Map<String, Entity> byName = entities.get(category);
        return byName != null ? byName.get(name) : null;
    }

    public void putEntity(Entity entity) {
        entities.computeIfAbsent(entity.getCategory(), c -> new LinkedHashMap<>())
            .put(entity.getName(), entity);
    }

    @JsonIgnore
    public List<Entity> allEntities() {
        List<Entity> all = new ArrayList<>();
        for (Map<String, Entity> byName : entities.values()) {
            all.addAll(byName.values());
        }
        return all;
    }

    @JsonIgnore
    public int entityCount() {
        return entities.values().stream().mapToInt(Map::size).sum();
    }

    public TimelineEvent getEvent(String key) {
        for (TimelineEvent event : timeline) {
            if (event.getKey().equals(key)) {
                return event;
            }
        }
        return null;
    }

    @JsonIgnore
    public long nextOrderKey() {
        return timeline.stream().mapToLong(TimelineEvent::getOrderKey).max().orElse(0L) + 1;
    }

    @JsonIgnore
    public List<TimelineEvent> orderedTimeline() {
        return timeline.stream()
            .sorted(Comparator.comparingLong(TimelineEvent::getOrderKey))
            .collect(Collectors.toList());
    }

    @JsonIgnore
    public List<PlotThread> openThreads() {
        return plotThreads.values().stream()
            .filter(PlotThread::isOpen)
            .collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoryKnowledge)) return false;
        StoryKnowledge that = (StoryKnowledge) o;
        return Objects.equals(entities, that.entities)
            && Objects.equals(timeline, that.timeline)
            && Objects.equals(precedences, that.precedences)
            && Objects.equals(plotThreads, that.plotThreads);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entities, timeline, precedences, plotThreads);
    }
}
