package com.phillippitts.saleshud.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Model parameters and endpoint settings for the completion-style AI backend.
 */
@Validated
@ConfigurationProperties(prefix = "insight.backend")
public class AiBackendProperties {

    @NotBlank
    private String url = "https://api.anthropic.com/v1/messages";

    /** Endpoint used by the periodic health probe. */
    private String healthUrl = "https://api.anthropic.com/v1/models";

    /** Sent as {@code x-api-key}. */
    private String apiKey;

    @NotBlank
    private String apiVersion = "2023-06-01";

    @NotBlank
    private String model = "claude-3-sonnet-20240229";

    @Min(1)
    @Max(200_000)
    private int maxTokens = 4096;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double temperature = 0.1;

    @NotBlank
    private String systemInstruction = "You are a sales call analyst. Respond only with the JSON object requested.";

    @Positive
    private long requestTimeoutMs = 30_000;

    /** USD per million input tokens, used for cost estimation only. */
    @PositiveOrZero
    private double inputPricePerMillion = 3.0;

    /** USD per million output tokens, used for cost estimation only. */
    @PositiveOrZero
    private double outputPricePerMillion = 15.0;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getHealthUrl() {
        return healthUrl;
    }

    public void setHealthUrl(String healthUrl) {
        this.healthUrl = healthUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public String getSystemInstruction() {
        return systemInstruction;
    }

    public void setSystemInstruction(String systemInstruction) {
        this.systemInstruction = systemInstruction;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public double getInputPricePerMillion() {
        return inputPricePerMillion;
    }

    public void setInputPricePerMillion(double inputPricePerMillion) {
        this.inputPricePerMillion = inputPricePerMillion;
    }

    public double getOutputPricePerMillion() {
        return outputPricePerMillion;
    }

    public void setOutputPricePerMillion(double outputPricePerMillion) {
        this.outputPricePerMillion = outputPricePerMillion;
    }
}
