package io.crosspost.publisher.api.service;

import io.crosspost.publisher.api.dto.ServiceKind;
import io.crosspost.publisher.api.service.retry.CategoryRetryPolicy;
import io.crosspost.publisher.api.service.retry.LoggingRetryListener;
import io.crosspost.publisher.api.service.retry.RetryAfterBackOffPolicy;
import io.crosspost.publisher.config.RetryConfig;
import io.crosspost.publisher.connector.ConfiguredService;
import io.crosspost.publisher.connector.ConnectorOperation;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Builds a fresh {@link RetryTemplate} for every connector call, so attempt counters never
 * outlive the call they belong to.
 */
@Component
public class ConnectorRetryTemplates {

    private final RetryConfig retryConfig;
    private final Sleeper sleeper;

    public ConnectorRetryTemplates(RetryConfig retryConfig, Sleeper sleeper) {
        this.retryConfig = retryConfig;
        this.sleeper = sleeper;
    }

    /**
     * Run-start listing: exponential backoff over {@code listing-attempts}.
     */
    public RetryTemplate listing(ServiceKind service) {
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(retryConfig.initialDelay().toMillis());
        backOff.setMultiplier(retryConfig.multiplier());
        backOff.setMaxInterval(retryConfig.maxDelay().toMillis());
        backOff.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new CategoryRetryPolicy(retryConfig.listingAttempts()));
        template.setBackOffPolicy(backOff);
        template.registerListener(new LoggingRetryListener(
                service, ConnectorOperation.LIST.toString(), retryConfig.listingAttempts()));
        return template;
    }

    /**
     * Per-document calls: wait the service's rate-limit delay, or Retry-After when longer.
     */
    public RetryTemplate operations(ConfiguredService service, ConnectorOperation operation) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new CategoryRetryPolicy(retryConfig.maxAttempts()));
        template.setBackOffPolicy(new RetryAfterBackOffPolicy(
                service.settings().rateLimitDelayOrZero(), retryConfig.maxDelay(), sleeper));
        template.registerListener(new LoggingRetryListener(
                service.kind(), operation.toString(), retryConfig.maxAttempts()));
        return template;
    }
}
