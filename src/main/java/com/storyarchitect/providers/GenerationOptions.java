package com.storyarchitect.providers;

import com.storyarchitect.models.ProviderConfig;

/**
 * Per-call generation settings.
 */
public class GenerationOptions {

    private String model;
    private String baseUrl;
    private Integer maxOutputTokens;
    private Double temperature;
    private Integer timeoutMs;
    private String systemInstruction;
    private boolean jsonOutput;

    public static GenerationOptions from(ProviderConfig config) {
        GenerationOptions options = new GenerationOptions();
        if (config != null) {
            options.setModel(config.getModel());
            options.setBaseUrl(config.getBaseUrl());
            options.setMaxOutputTokens(config.getMaxOutputTokens());
            options.setTemperature(config.getTemperature());
            options.setTimeoutMs(config.getTimeoutMs());
        }
        return options;
    }

    public String getModel() {
        return model;
    }

    public GenerationOptions setModel(String model) {
        this.model = model;
        return this;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public GenerationOptions setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
        return this;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public GenerationOptions setMaxOutputTokens(Integer maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
        return this;
    }

    public Double getTemperature() {
        return temperature;
    }

    public GenerationOptions setTemperature(Double temperature) {
        this.temperature = temperature;
        return this;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }

    public GenerationOptions setTimeoutMs(Integer timeoutMs) {
        this.timeoutMs = timeoutMs;
        return this;
    }

    public String getSystemInstruction() {
        return systemInstruction;
    }

    public GenerationOptions setSystemInstruction(String systemInstruction) {
        this.systemInstruction = systemInstruction;
        return this;
    }

    public boolean isJsonOutput() {
        return jsonOutput;
    }

    public GenerationOptions setJsonOutput(boolean jsonOutput) {
        this.jsonOutput = jsonOutput;
        return this;
    }
}
