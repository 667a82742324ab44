package com.storyarchitect.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Which provider and model a project generates with. Holds no credential;
 * keys are supplied per command and never stored with the project.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderConfig {

    private String provider;
    private String model;
    private String baseUrl;
    private Double temperature;
    private Integer maxOutputTokens;
    private Integer timeoutMs;

    public ProviderConfig() {
    }

    public ProviderConfig(String provider, String model) {
        this.provider = provider;
        this.model = model;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public void setMaxOutputTokens(Integer maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Integer timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProviderConfig)) return false;
        ProviderConfig that = (ProviderConfig) o;
        return Objects.equals(provider, that.provider)
            && Objects.equals(model, that.model)
            && Objects.equals(baseUrl, that.baseUrl)
            && Objects.equals(temperature, that.temperature)
            && Objects.equals(maxOutputTokens, that.maxOutputTokens)
            && Objects.equals(timeoutMs, that.timeoutMs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, model, baseUrl, temperature, maxOutputTokens, timeoutMs);
    }
}
