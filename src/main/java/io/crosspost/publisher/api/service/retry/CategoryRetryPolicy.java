package io.crosspost.publisher.api.service.retry;

import io.crosspost.publisher.api.exception.ConnectorException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Retries a {@link ConnectorException} only when its category is retryable. Anything else
 * ends the call on the first failure.
 */
public class CategoryRetryPolicy extends SimpleRetryPolicy {

    public CategoryRetryPolicy(int maxAttempts) {
        super(Math.max(1, maxAttempts));
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last == null) {
            return super.canRetry(context);
        }

        return last instanceof ConnectorException connectorException
                && connectorException.getCategory().isRetryable()
                && super.canRetry(context);
    }
}
