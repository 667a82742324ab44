package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A story-time event. {@code orderKey} is a relative position assigned in the
 * order events were first asserted; story time is fictional, so there is no
 * wall-clock timestamp.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimelineEvent {

    private String key;
    private String description;
    private long orderKey;
    private String assertedBy;

    public TimelineEvent() {
    }

    public TimelineEvent(String key, String description, long orderKey, String assertedBy) {
        this.key = key;
        this.description = description;
        this.orderKey = orderKey;
        this.assertedBy = assertedBy;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public long getOrderKey() {
        return orderKey;
    }

    public void setOrderKey(long orderKey) {
        this.orderKey = orderKey;
    }

    public String getAssertedBy() {
        return assertedBy;
    }

    public void setAssertedBy(String assertedBy) {
        this.assertedBy = assertedBy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimelineEvent)) return false;
        TimelineEvent that = (TimelineEvent) o;
        return orderKey == that.orderKey
            && Objects.equals(key, that.key)
            && Objects.equals(description, that.description)
            && Objects.equals(assertedBy, that.assertedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, description, orderKey, assertedBy);
    }
}
