package com.phillippitts.saleshud.service.insight;

import com.phillippitts.saleshud.config.properties.AiBackendProperties;
import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.exception.ErrorKind;
import com.phillippitts.saleshud.exception.ServiceException;
import com.phillippitts.saleshud.exception.ServiceExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CompletionClient} over {@link HttpClient} speaking the messages API.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>401/403: AUTH_FAILED, not retryable</li>
 *   <li>402: QUOTA_EXCEEDED, not retryable</li>
 *   <li>429: RATE_LIMIT, retryable, with the {@code retry-after} hint</li>
 *   <li>5xx: NETWORK_ERROR, retryable</li>
 *   <li>other 4xx: NETWORK_ERROR, not retryable</li>
 * </ul>
 * I/O failures are retryable NETWORK_ERROR, request timeouts are TIMEOUT and unreadable bodies are
 * PROCESSING_ERROR.
 */
public class HttpCompletionClient implements CompletionClient {

    private static final Logger LOG = LogManager.getLogger(HttpCompletionClient.class);

    private static final int MAX_BODY_SIZE = 4 * 1_048_576; // 4MB

    private final HttpClient client;
    private final AiBackendProperties props;
    private final URI uri;

    public HttpCompletionClient(HttpClient client, AiBackendProperties props) {
        this.client = Objects.requireNonNull(client, "client");
        this.props = Objects.requireNonNull(props, "props");
        this.uri = URI.create(props.getUrl());
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        HttpRequest httpRequest = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofMillis(props.getRequestTimeoutMs()))
                .header("content-type", "application/json")
                .header("x-api-key", props.getApiKey() == null ? "" : props.getApiKey())
                .header("anthropic-version", props.getApiVersion())
                .POST(HttpRequest.BodyPublishers.ofString(toJson(request).toString(), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw failure("AI request timed out", ErrorKind.TIMEOUT, true, e).build();
        } catch (IOException e) {
            throw failure("AI request failed", ErrorKind.NETWORK_ERROR, true, e).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("AI request interrupted", ErrorKind.NETWORK_ERROR, false, e).build();
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return parse(response.body());
        }
        throw statusFailure(status, response);
    }

    static JSONObject toJson(CompletionRequest request) {
        JSONObject body = new JSONObject();
        body.put("model", request.model());
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());
        if (request.system() != null && !request.system().isBlank()) {
            body.put("system", request.system());
        }
        JSONArray messages = new JSONArray();
        messages.put(new JSONObject().put("role", "user").put("content", request.userContent()));
        body.put("messages", messages);
        return body;
    }

    static CompletionResponse parse(String body) {
        if (body == null || body.isBlank() || body.length() > MAX_BODY_SIZE) {
            throw failure("AI response body unreadable", ErrorKind.PROCESSING_ERROR, true, null)
                    .metadata("length", body == null ? 0 : body.length())
                    .build();
        }
        try {
            JSONObject obj = new JSONObject(body);
            JSONArray content = obj.getJSONArray("content");
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < content.length(); i++) {
                JSONObject block = content.getJSONObject(i);
                if ("text".equals(block.optString("type", "text"))) {
                    text.append(block.optString("text", ""));
                }
            }
            JSONObject usage = obj.optJSONObject("usage");
            long in = usage == null ? 0 : usage.optLong("input_tokens", 0);
            long out = usage == null ? 0 : usage.optLong("output_tokens", 0);
            return new CompletionResponse(obj.optString("id", null), obj.optString("model", null),
                    text.toString(), in, out);
        } catch (JSONException e) {
            throw failure("AI response body unreadable", ErrorKind.PROCESSING_ERROR, true, e).build();
        }
    }

    private ServiceException statusFailure(int status, HttpResponse<String> response) {
        LOG.warn("AI backend returned status {}", status);
        if (status == 401 || status == 403) {
            return failure("AI backend rejected credentials", ErrorKind.AUTH_FAILED, false, null)
                    .metadata("status", status).build();
        }
        if (status == 402) {
            return failure("AI backend quota exceeded", ErrorKind.QUOTA_EXCEEDED, false, null)
                    .metadata("status", status).build();
        }
        if (status == 429) {
            ServiceExceptionBuilder builder = failure("AI backend rate limited", ErrorKind.RATE_LIMIT, true, null)
                    .metadata("status", status);
            retryAfter(response).ifPresent(builder::retryAfter);
            return builder.build();
        }
        boolean retryable = status >= 500;
        return failure("AI backend error", ErrorKind.NETWORK_ERROR, retryable, null)
                .metadata("status", status).build();
    }

    static Optional<Duration> retryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("retry-after").flatMap(value -> {
            try {
                long seconds = Long.parseLong(value.trim());
                return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }

    private static ServiceExceptionBuilder failure(String message, ErrorKind kind, boolean retryable, Throwable cause) {
        return ServiceExceptionBuilder.create(message, kind)
                .dependency(Dependency.AI_ANALYSIS)
                .retryable(retryable)
                .cause(cause);
    }
}
