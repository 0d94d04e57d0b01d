package com.phillippitts.saleshud.service.insight;

import java.util.Objects;

/**
 * One completion call: a system instruction plus a single user message.
 *
 * @param model       backend model id
 * @param maxTokens   output token budget
 * @param temperature sampling temperature
 * @param system      system instruction, may be {@code null}
 * @param userContent task-specific prompt
 */
public record CompletionRequest(String model, int maxTokens, double temperature, String system, String userContent) {

    public CompletionRequest {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(userContent, "userContent must not be null");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got: " + maxTokens);
        }
    }
}
