package io.crosspost.publisher.api.dto;

import java.util.EnumSet;
import java.util.Set;

public enum ArticleField {
    TITLE,
    SUBTITLE,
    BODY,
    TAGS,
    COVER_IMAGE,
    CANONICAL_URL,
    SERIES,
    SLUG,
    PUBLISH_STATE;

    /** Fields a metadata-only update is allowed to send. */
    public static final Set<ArticleField> METADATA = EnumSet.of(TITLE, TAGS, COVER_IMAGE);

    public static Set<ArticleField> all() {
        return EnumSet.allOf(ArticleField.class);
    }
}
