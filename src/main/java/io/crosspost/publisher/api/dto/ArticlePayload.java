package io.crosspost.publisher.api.dto;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Service-ready article content. Connectors send only the fields listed in {@code fields}.
 */
public record ArticlePayload(
        String title,
        String subtitle,
        String body,
        List<String> tags,
        String coverUrl,
        String canonicalUrl,
        String seriesName,
        String slug,
        Set<ArticleField> fields
) {
    public ArticlePayload {
        tags = tags == null ? List.of() : List.copyOf(tags);
        fields = fields == null || fields.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ArticleField.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(fields));
    }

    public boolean includes(ArticleField field) {
        return fields.contains(field);
    }

    public ArticlePayload restrictTo(Set<ArticleField> allowed) {
        Set<ArticleField> kept = EnumSet.noneOf(ArticleField.class);
        kept.addAll(fields);
        kept.retainAll(allowed);
        return new ArticlePayload(title, subtitle, body, tags, coverUrl, canonicalUrl, seriesName, slug, kept);
    }
}
