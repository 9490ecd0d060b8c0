package io.crosspost.publisher.api.dto;

import java.util.List;

/**
 * Every article a service reported at run start. A degraded snapshot is empty because the
 * listing could not be fetched; it must not drive deletions.
 */
public record RemoteSnapshot(
        ServiceKind service,
        List<RemoteArticle> articles,
        boolean degraded
) {
    public RemoteSnapshot {
        articles = List.copyOf(articles);
    }

    public static RemoteSnapshot complete(ServiceKind service, List<RemoteArticle> articles) {
        return new RemoteSnapshot(service, articles, false);
    }

    public static RemoteSnapshot unavailable(ServiceKind service) {
        return new RemoteSnapshot(service, List.of(), true);
    }
}
