package io.crosspost.publisher.content;

import io.crosspost.publisher.api.dto.ArticlePayload;
import io.crosspost.publisher.api.dto.LocalDocument;
import io.crosspost.publisher.api.dto.ServiceKind;

import java.util.Collection;
import java.util.List;

public interface ContentTransformer {

    /**
     * Deterministic: the same document and service always give an equal payload.
     */
    ArticlePayload toPayload(LocalDocument document, ServiceKind service);

    /**
     * Reduces a body to the text that matters for change detection, so that a body that went
     * through {@link #toPayload} compares equal to its source.
     */
    String normalizeForComparison(String body);

    List<String> formatTags(Collection<String> tags, ServiceKind service);

    boolean hasTableOfContents(String body);

    /**
     * Whether a cover returned by the service stands for the local one. Services that re-host
     * cover images only keep track of whether a cover is set.
     */
    boolean sameCover(String localUrl, String remoteUrl, ServiceKind service);
}
