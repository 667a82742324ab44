package com.storyarchitect.knowledge;

import com.storyarchitect.models.EntityCategory;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Selection for {@link KnowledgeStore#query}. An empty filter matches everything.
 */
public class KnowledgeFilter {

    private final Set<EntityCategory> categories = EnumSet.noneOf(EntityCategory.class);
    private final Set<String> names = new LinkedHashSet<>();
    private Integer touchedSinceChapter;
    private boolean openThreadsOnly;

    public static KnowledgeFilter all() {
        return new KnowledgeFilter();
    }

    public KnowledgeFilter category(EntityCategory category) {
        if (category != null) {
            categories.add(category);
        }
        return this;
    }

    /**
     * Match by name or alias, after name folding.
     */
    public KnowledgeFilter name(String name) {
        if (name != null && !name.isBlank()) {
            names.add(NameFolding.foldName(name));
        }
        return this;
    }

    public KnowledgeFilter touchedSinceChapter(Integer chapter) {
        this.touchedSinceChapter = chapter;
        return this;
    }

    public KnowledgeFilter openThreadsOnly(boolean openThreadsOnly) {
        this.openThreadsOnly = openThreadsOnly;
        return this;
    }

    public Set<EntityCategory> getCategories() {
        return categories;
    }

    public Set<String> getNames() {
        return names;
    }

    public Integer getTouchedSinceChapter() {
        return touchedSinceChapter;
    }

    public boolean isOpenThreadsOnly() {
        return openThreadsOnly;
    }
}
