package io.crosspost.publisher.api.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Failure of a call to a publishing service, normalized into an {@link ErrorCategory}.
 */
public class ConnectorException extends Exception {
    private final ErrorCategory category;
    private final Duration retryAfter;

    public ConnectorException(String message, ErrorCategory category) {
        this(message, null, category, null);
    }

    public ConnectorException(String message, Throwable cause, ErrorCategory category) {
        this(message, cause, category, null);
    }

    public ConnectorException(String message, Throwable cause, ErrorCategory category, Duration retryAfter) {
        super(message, cause);
        this.category = category;
        this.retryAfter = retryAfter;
    }

    public static ConnectorException rateLimited(String message, Duration retryAfter) {
        return new ConnectorException(message, null, ErrorCategory.RATE_LIMITED, retryAfter);
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
