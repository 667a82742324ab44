package com.storyarchitect.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * One chapter of a parsed outline.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChapterPlan {

    private int number;
    private String title;
    private String summary;
    private String act;

    public ChapterPlan() {
    }

    public ChapterPlan(int number, String title, String summary, String act) {
        this.number = number;
        this.title = title;
        this.summary = summary;
        this.act = act;
    }

    public int getNumber() {
        return number;
    }

    public void setNumber(int number) {
        this.number = number;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public String getAct() {
        return act;
    }

    public void setAct(String act) {
        this.act = act;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChapterPlan)) return false;
        ChapterPlan that = (ChapterPlan) o;
        return number == that.number
            && Objects.equals(title, that.title)
            && Objects.equals(summary, that.summary)
            && Objects.equals(act, that.act);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, title, summary, act);
    }
}
