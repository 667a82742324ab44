package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * The user-supplied premise a project starts from.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoryConcept {

    private String genre;
    private String theme;
    private String coreIdea;
    private String style;
    private String premise;

    public StoryConcept() {
    }

    public StoryConcept(String genre, String theme, String coreIdea, String style) {
        this.genre = genre;
        this.theme = theme;
        this.coreIdea = coreIdea;
        this.style = style;
    }

    public String getGenre() {
        return genre;
    }

    public void setGenre(String genre) {
        this.genre = genre;
    }

    public String getTheme() {
        return theme;
    }

    public void setTheme(String theme) {
        this.theme = theme;
    }

    public String getCoreIdea() {
        return coreIdea;
    }

    public void setCoreIdea(String coreIdea) {
        this.coreIdea = coreIdea;
    }

    public String getStyle() {
        return style;
    }

    public void setStyle(String style) {
        this.style = style;
    }

    /**
     * Free-form premise text, used alongside or instead of the structured fields.
     */
    public String getPremise() {
        return premise;
    }

    public void setPremise(String premise) {
        this.premise = premise;
    }

    public boolean isBlank() {
        return isBlank(genre) && isBlank(theme) && isBlank(coreIdea) && isBlank(style) && isBlank(premise);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoryConcept)) return false;
        StoryConcept that = (StoryConcept) o;
        return Objects.equals(genre, that.genre)
            && Objects.equals(theme, that.theme)
            && Objects.equals(coreIdea, that.coreIdea)
            && Objects.equals(style, that.style)
            && Objects.equals(premise, that.premise);
    }

    @Override
    public int hashCode() {
        return Objects.hash(genre, theme, coreIdea, style, premise);
    }
}
