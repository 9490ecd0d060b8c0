package io.crosspost.publisher.connector;

import io.crosspost.publisher.api.dto.ServiceKind;
import io.crosspost.publisher.api.exception.ConnectorException;
import io.crosspost.publisher.api.exception.ErrorCategory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;

/**
 * Maps transport failures to the connector error taxonomy.
 */
public final class HttpErrorTranslator {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private HttpErrorTranslator() {
    }

    public static ConnectorException translate(RestClientException e, ServiceKind service, ConnectorOperation operation) {
        if (e instanceof RestClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            String message = String.format("%s failed on %s (%d): %s",
                    operation, service, status, abbreviate(responseException.getResponseBodyAsString()));
            return forStatus(status, message, retryAfter(responseException.getResponseHeaders()), e, operation);
        }

        if (e instanceof ResourceAccessException) {
            return new ConnectorException(
                    String.format("%s failed on %s, network error: %s", operation, service, e.getMessage()),
                    e, ErrorCategory.TRANSIENT_NETWORK);
        }

        return new ConnectorException(
                String.format("%s failed on %s: %s", operation, service, e.getMessage()),
                e, ErrorCategory.UNKNOWN);
    }

    public static ConnectorException forStatus(int status, String message, Duration retryAfter,
                                               Throwable cause, ConnectorOperation operation) {
        ErrorCategory category = switch (status) {
            case 401 -> ErrorCategory.AUTH;
            case 403 -> operation == ConnectorOperation.DELETE ? ErrorCategory.PERMISSION_DENIED : ErrorCategory.AUTH;
            case 404 -> ErrorCategory.NOT_FOUND;
            case 429 -> ErrorCategory.RATE_LIMITED;
            case 500, 502, 503, 504 -> ErrorCategory.TRANSIENT_NETWORK;
            default -> ErrorCategory.UNKNOWN;
        };

        return new ConnectorException(message, cause, category,
                category == ErrorCategory.RATE_LIMITED ? retryAfter : null);
    }

    static Duration retryAfter(HttpHeaders headers) {
        if (headers == null) return null;

        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) return null;

        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            // HTTP-date form, fall back to the configured delay
            return null;
        }
    }

    static String abbreviate(String text) {
        if (text == null || text.isBlank()) return "<empty body>";

        String flattened = text.replaceAll("\\s+", " ").trim();
        return flattened.length() <= MAX_BODY_IN_MESSAGE
                ? flattened
                : flattened.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
