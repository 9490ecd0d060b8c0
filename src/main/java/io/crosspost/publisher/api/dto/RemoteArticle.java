package io.crosspost.publisher.api.dto;

import java.time.Instant;
import java.util.Set;

/**
 * A service's stored copy of an article. {@code body} is null when the listing that
 * produced it did not include article bodies.
 */
public record RemoteArticle(
        ServiceKind service,
        String id,
        String title,
        String body,
        Set<String> tags,
        boolean published,
        String coverUrl,
        Instant createdAt,
        Instant updatedAt
) {
    public RemoteArticle {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
}
