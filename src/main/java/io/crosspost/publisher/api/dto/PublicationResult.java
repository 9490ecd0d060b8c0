package io.crosspost.publisher.api.dto;

import io.crosspost.publisher.api.dto.ReconciliationDecision.Action;
import io.crosspost.publisher.api.exception.ErrorCategory;

/**
 * Outcome of one (document, service) pair, or of one orphan deletion. {@code action} is
 * null when the pair failed before a decision was reached.
 */
public record PublicationResult(
        ServiceKind service,
        String documentTitle,
        Action action,
        Outcome outcome,
        String remoteId,
        ErrorCategory errorCategory,
        String errorMessage
) {
    public boolean success() {
        return outcome != Outcome.FAILED;
    }

    public static PublicationResult created(ServiceKind service, String title, String remoteId) {
        return new PublicationResult(service, title, Action.CREATE, Outcome.CREATED, remoteId, null, null);
    }

    public static PublicationResult updated(ServiceKind service, String title, String remoteId) {
        return new PublicationResult(service, title, Action.UPDATE, Outcome.UPDATED, remoteId, null, null);
    }

    public static PublicationResult skipped(ServiceKind service, String title, String remoteId) {
        return new PublicationResult(service, title, Action.SKIP, Outcome.SKIPPED, remoteId, null, null);
    }

    public static PublicationResult deleted(ServiceKind service, String title, String remoteId) {
        return new PublicationResult(service, title, Action.DELETE, Outcome.DELETED, remoteId, null, null);
    }

    public static PublicationResult warning(ServiceKind service, String title, Action action, String remoteId,
                                            ErrorCategory category, String message) {
        return new PublicationResult(service, title, action, Outcome.WARNING, remoteId, category, message);
    }

    public static PublicationResult failed(ServiceKind service, String title, Action action, String remoteId,
                                           ErrorCategory category, String message) {
        return new PublicationResult(service, title, action, Outcome.FAILED, remoteId, category, message);
    }
}
