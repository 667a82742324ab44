package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PlotThread {

    private String name;
    private String description;
    private PlotThreadStatus status = PlotThreadStatus.OPEN;
    private String openedBy;
    private String resolvedBy;

    public PlotThread() {
    }

    public PlotThread(String name, String description, String openedBy) {
        this.name = name;
        this.description = description;
        this.openedBy = openedBy;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public PlotThreadStatus getStatus() {
        return status;
    }

    public void setStatus(PlotThreadStatus status) {
        this.status = status;
    }

    public String getOpenedBy() {
        return openedBy;
    }

    public void setOpenedBy(String openedBy) {
        this.openedBy = openedBy;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public void setResolvedBy(String resolvedBy) {
        this.resolvedBy = resolvedBy;
    }

    @JsonIgnore
    public boolean isOpen() {
        return status == PlotThreadStatus.OPEN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlotThread)) return false;
        PlotThread that = (PlotThread) o;
        return Objects.equals(name, that.name)
            && Objects.equals(description, that.description)
            && status == that.status
            && Objects.equals(openedBy, that.openedBy)
            && Objects.equals(resolvedBy, that.resolvedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, status, openedBy, resolvedBy);
    }
}
