package io.crosspost.publisher.api.exception;

/**
 * Unrecoverable configuration problem, raised before any remote call is made.
 */
public class PublisherConfigurationException extends RuntimeException {

    public PublisherConfigurationException(String message) {
        super(message);
    }
}
