package com.phillippitts.saleshud.exception;

import com.phillippitts.saleshud.domain.Dependency;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ServiceException} with contextual metadata appended to the message.
 *
 * <pre>
 * throw ServiceExceptionBuilder.create("AI backend rejected request", ErrorKind.RATE_LIMIT)
 *         .dependency(Dependency.AI_ANALYSIS)
 *         .retryAfter(Duration.ofSeconds(20))
 *         .metadata("status", 429)
 *         .build();
 * </pre>
 */
public final class ServiceExceptionBuilder {

    private final String message;
    private final ErrorKind kind;
    private Dependency dependency;
    private Boolean retryable;
    private Duration retryAfter;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ServiceExceptionBuilder(String message, ErrorKind kind) {
        this.message = message;
        this.kind = kind;
    }

    /**
     * Creates a new builder.
     *
     * @param message base error message (must not be null or empty)
     * @param kind error classification (must not be null)
     * @return new builder instance
     */
    public static ServiceExceptionBuilder create(String message, ErrorKind kind) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        return new ServiceExceptionBuilder(message, kind);
    }

    public ServiceExceptionBuilder dependency(Dependency dependency) {
        this.dependency = dependency;
        return this;
    }

    /** Overrides the kind's default retryable flag. */
    public ServiceExceptionBuilder retryable(boolean retryable) {
        this.retryable = retryable;
        return this;
    }

    public ServiceExceptionBuilder retryAfter(Duration retryAfter) {
        this.retryAfter = retryAfter;
        return this;
    }

    public ServiceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ServiceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The message format is {@code {message} (k1=v1, k2=v2)}.
     */
    public ServiceException build() {
        boolean isRetryable = retryable != null ? retryable : kind.isRetryableByDefault();
        return new ServiceException(buildDetailedMessage(), kind, dependency, isRetryable, retryAfter, cause);
    }

    private String buildDetailedMessage() {
        if (metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
