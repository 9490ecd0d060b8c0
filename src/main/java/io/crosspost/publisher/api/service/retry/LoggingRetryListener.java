package io.crosspost.publisher.api.service.retry;

import io.crosspost.publisher.api.dto.ServiceKind;
import io.crosspost.publisher.api.exception.ConnectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;

public class LoggingRetryListener implements RetryListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingRetryListener.class);

    private final ServiceKind service;
    private final String operation;
    private final int maxAttempts;

    public LoggingRetryListener(ServiceKind service, String operation, int maxAttempts) {
        this.service = service;
        this.operation = operation;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        if (throwable instanceof ConnectorException e && e.getCategory().isRetryable()) {
            logger.warn("{} {} failed (attempt {}/{}, category: {}): {}",
                    service, operation, context.getRetryCount(), maxAttempts, e.getCategory(), e.getMessage());
        } else {
            logger.debug("{} {} failed without retry: {}", service, operation, throwable.getMessage());
        }
    }
}
