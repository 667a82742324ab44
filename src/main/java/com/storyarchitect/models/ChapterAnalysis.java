package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ChapterAnalysis {

    private String summary;
    private List<String> characters = new ArrayList<>();

    public ChapterAnalysis() {
    }

    public ChapterAnalysis(String summary, List<String> characters) {
        this.summary = summary;
        this.characters = characters != null ? characters : new ArrayList<>();
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public List<String> getCharacters() {
        return characters;
    }

    public void setCharacters(List<String> characters) {
        this.characters = characters != null ? characters : new ArrayList<>();
    }
}
