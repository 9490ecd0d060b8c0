package io.crosspost.publisher.config;

import java.time.Duration;

/**
 * @param maxAttempts     attempts per write call, first try included
 * @param listingAttempts attempts for the run-start listing, first try included
 */
public record RetryConfig(
        int maxAttempts,
        int listingAttempts,
        Duration initialDelay,
        double multiplier,
        Duration maxDelay
) {}
