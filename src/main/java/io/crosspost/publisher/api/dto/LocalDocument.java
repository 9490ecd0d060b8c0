package io.crosspost.publisher.api.dto;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A locally authored document with the metadata read from its front matter.
 *
 * @param fingerprint SHA-256 over the normalized body, sorted tags, title, draft flag and cover URL
 */
public record LocalDocument(
        Path path,
        String title,
        String subtitle,
        String slug,
        Set<String> tags,
        boolean draft,
        boolean tableOfContents,
        String coverUrl,
        String canonicalUrl,
        String seriesName,
        String body,
        String fingerprint
) {
    public LocalDocument {
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }
}
