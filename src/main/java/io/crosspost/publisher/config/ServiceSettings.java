package io.crosspost.publisher.config;

import java.time.Duration;

/**
 * One publishing service entry under {@code publisher.services}.
 *
 * @param rateLimitDelay minimum pause before retrying a rate-limited or failed call
 * @param username       Hashnode only
 * @param publicationId  Hashnode only, 24 hex characters
 */
public record ServiceSettings(
        String name,
        boolean enabled,
        Duration rateLimitDelay,
        String apiUrl,
        String apiKey,
        String username,
        String publicationId
) {
    public Duration rateLimitDelayOrZero() {
        return rateLimitDelay == null ? Duration.ZERO : rateLimitDelay;
    }
}
