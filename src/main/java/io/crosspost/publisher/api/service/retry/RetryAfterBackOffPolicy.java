package io.crosspost.publisher.api.service.retry;

import io.crosspost.publisher.api.exception.ConnectorException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;

/**
 * Waits max(minimum delay, Retry-After) between write attempts, with Retry-After capped at
 * {@code maxDelay}.
 */
public class RetryAfterBackOffPolicy implements BackOffPolicy {

    private final Duration minimumDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    public RetryAfterBackOffPolicy(Duration minimumDelay, Duration maxDelay, Sleeper sleeper) {
        this.minimumDelay = minimumDelay == null ? Duration.ZERO : minimumDelay;
        this.maxDelay = maxDelay;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new RetryAfterContext(context);
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        RetryContext retryContext = ((RetryAfterContext) backOffContext).retryContext;
        long delay = delayFor(retryContext.getLastThrowable()).toMillis();

        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while waiting to retry", e);
        }
    }

    Duration delayFor(Throwable failure) {
        Duration delay = minimumDelay;

        if (failure instanceof ConnectorException connectorException) {
            Duration retryAfter = connectorException.getRetryAfter().orElse(Duration.ZERO);
            if (maxDelay != null && retryAfter.compareTo(maxDelay) > 0) {
                retryAfter = maxDelay;
            }
            if (retryAfter.compareTo(delay) > 0) {
                delay = retryAfter;
            }
        }

        return delay;
    }

    private static final class RetryAfterContext implements BackOffContext {
        private final transient RetryContext retryContext;

        private RetryAfterContext(RetryContext retryContext) {
            this.retryContext = retryContext;
        }
    }
}
