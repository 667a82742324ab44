package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Facts proposed by one piece of generated text, before they are validated
 * and committed to the {@link StoryKnowledge}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExtractedFacts {

    private static final ExtractedFacts EMPTY = new ExtractedFacts(null, null, null, null, null, null);

    private final String summary;
    private final List<EntityFact> entities;
    private final List<EventFact> events;
    private final List<PrecedenceFact> precedences;
    private final List<ThreadFact> openedThreads;
    private final List<String> resolvedThreads;

    @JsonCreator
    public ExtractedFacts(@JsonProperty("summary") String summary,
                          @JsonProperty("entities") List<EntityFact> entities,
                          @JsonProperty("events") List<EventFact> events,
                          @JsonProperty("precedences") List<PrecedenceFact> precedences,
                          @JsonProperty("openedThreads") List<ThreadFact> openedThreads,
                          @JsonProperty("resolvedThreads") List<String> resolvedThreads) {
        this.summary = summary;
        this.entities = copy(entities);
        this.events = copy(events);
        this.precedences = copy(precedences);
        this.openedThreads = copy(openedThreads);
        this.resolvedThreads = copy(resolvedThreads);
    }

    public static ExtractedFacts empty() {
        return EMPTY;
    }

    public String getSummary() {
        return summary;
    }

    public List<EntityFact> getEntities() {
        return entities;
    }

    public List<EventFact> getEvents() {
        return events;
    }

    public List<PrecedenceFact> getPrecedences() {
        return precedences;
    }

    public List<ThreadFact> getOpenedThreads() {
        return openedThreads;
    }

    public List<String> getResolvedThreads() {
        return resolvedThreads;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return (summary == null || summary.isBlank())
            && entities.isEmpty() && events.isEmpty() && precedences.isEmpty()
            && openedThreads.isEmpty() && resolvedThreads.isEmpty();
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? Collections.emptyList() : List.copyOf(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractedFacts)) return false;
        ExtractedFacts that = (ExtractedFacts) o;
        return Objects.equals(summary, that.summary)
            && entities.equals(that.entities)
            && events.equals(that.events)
            && precedences.equals(that.precedences)
            && openedThreads.equals(that.openedThreads)
            && resolvedThreads.equals(that.resolvedThreads);
    }

    @Override
    public int hashCode() {
        return Objects.hash(summary, entities, events, precedences, openedThreads, resolvedThreads);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EntityFact {
        private final String name;
        private final EntityCategory category;
        private final List<String> aliases;
        private final Map<String, String> attributes;

        @JsonCreator
        public EntityFact(@JsonProperty("name") String name,
                          @JsonProperty("category") EntityCategory category,
                          @JsonProperty("aliases") List<String> aliases,
                          @JsonProperty("attributes") Map<String, String> attributes) {
            this.name = name;
            this.category = category != null ? category : EntityCategory.CHARACTER;
            this.aliases = copy(aliases);
            this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public String getName() {
            return name;
        }

        public EntityCategory getCategory() {
            return category;
        }

        public List<String> getAliases() {
            return aliases;
        }

        public Map<String, String> getAttributes() {
            return attributes;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof EntityFact)) return false;
            EntityFact that = (EntityFact) o;
            return Objects.equals(name, that.name) && category == that.category
                && aliases.equals(that.aliases) && attributes.equals(that.attributes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, category, aliases, attributes);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EventFact {
        private final String key;
        private final String description;

        @JsonCreator
        public EventFact(@JsonProperty("key") String key,
                         @JsonProperty("description") String description) {
            this.key = key;
            this.description = description;
        }

        public String getKey() {
            return key;
        }

        public String getDescription() {
            return description;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof EventFact)) return false;
            EventFact that = (EventFact) o;
            return Objects.equals(key, that.key) && Objects.equals(description, that.description);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, description);
        }
    }

    /**
     * "{@code before} happens before {@code after}" in story time.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PrecedenceFact {
        private final String before;
        private final String after;

        @JsonCreator
        public PrecedenceFact(@JsonProperty("before") String before,
                              @JsonProperty("after") String after) {
            this.before = before;
            this.after = after;
        }

        public String getBefore() {
            return before;
        }

        public String getAfter() {
            return after;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PrecedenceFact)) return false;
            PrecedenceFact that = (PrecedenceFact) o;
            return Objects.equals(before, that.before) && Objects.equals(after, that.after);
        }

        @Override
        public int hashCode() {
            return Objects.hash(before, after);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ThreadFact {
        private final String name;
        private final String description;

        @JsonCreator
        public ThreadFact(@JsonProperty("name") String name,
                          @JsonProperty("description") String description) {
            this.name = name;
            this.description = description;
        }

        public String getName() {
            return name;
        }

        public String getDescription() {
            return description;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ThreadFact)) return false;
            ThreadFact that = (ThreadFact) o;
            return Objects.equals(name, that.name) && Objects.equals(description, that.description);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, description);
        }
    }
}
