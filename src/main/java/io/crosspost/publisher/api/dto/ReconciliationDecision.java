package io.crosspost.publisher.api.dto;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What to do for one (document, service) pair. Discarded once executed.
 */
public record ReconciliationDecision(
        Action action,
        UpdateScope scope,
        String remoteId,
        Set<ArticleField> changedFields
) {
    public enum Action {
        CREATE,
        UPDATE,
        SKIP,
        DELETE
    }

    public enum UpdateScope {
        FULL,
        METADATA_ONLY
    }

    public ReconciliationDecision {
        changedFields = changedFields == null || changedFields.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ArticleField.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(changedFields));
    }

    public static ReconciliationDecision create() {
        return new ReconciliationDecision(Action.CREATE, null, null, null);
    }

    public static ReconciliationDecision skip(String remoteId) {
        return new ReconciliationDecision(Action.SKIP, null, remoteId, null);
    }

    public static ReconciliationDecision fullUpdate(String remoteId, Set<ArticleField> changedFields) {
        return new ReconciliationDecision(Action.UPDATE, UpdateScope.FULL, remoteId, changedFields);
    }

    public static ReconciliationDecision metadataUpdate(String remoteId, Set<ArticleField> changedFields) {
        return new ReconciliationDecision(Action.UPDATE, UpdateScope.METADATA_ONLY, remoteId, changedFields);
    }

    public static ReconciliationDecision delete(String remoteId) {
        return new ReconciliationDecision(Action.DELETE, null, remoteId, null);
    }
}
