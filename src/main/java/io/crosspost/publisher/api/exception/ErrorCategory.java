package io.crosspost.publisher.api.exception;

public enum ErrorCategory {
    AUTH,                // 401, rejected or missing credentials
    RATE_LIMITED,        // 429 Too Many Requests
    PERMISSION_DENIED,   // 403 on delete, insufficient role on a shared publication
    NOT_FOUND,           // 404, article is gone
    TRANSIENT_NETWORK,   // Timeouts, resets, 5xx
    UNKNOWN;             // Anything else

    public boolean isRetryable() {
        return this == RATE_LIMITED || this == TRANSIENT_NETWORK;
    }
}
