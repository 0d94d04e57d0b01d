package com.phillippitts.saleshud.service.insight;

import java.util.Objects;

/**
 * @param id           backend response id
 * @param model        model that produced the response
 * @param text         concatenated text content
 * @param inputTokens  prompt tokens billed
 * @param outputTokens completion tokens billed
 */
public record CompletionResponse(String id, String model, String text, long inputTokens, long outputTokens) {

    public CompletionResponse {
        Objects.requireNonNull(text, "text must not be null");
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
