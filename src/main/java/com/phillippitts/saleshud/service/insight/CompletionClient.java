package com.phillippitts.saleshud.service.insight;

/**
 * Request/response client for the AI analysis backend.
 */
public interface CompletionClient {

    /**
     * Sends one completion request and blocks for the response.
     *
     * @throws com.phillippitts.saleshud.exception.ServiceException classified by {@link
     *         com.phillippitts.saleshud.exception.ErrorKind} with its retryable flag set
     */
    CompletionResponse complete(CompletionRequest request);
}
