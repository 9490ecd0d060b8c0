package io.crosspost.publisher.api.service;

import io.crosspost.publisher.api.dto.ArticleField;
import io.crosspost.publisher.api.dto.LocalDocument;
import io.crosspost.publisher.api.dto.ReconciliationDecision;
import io.crosspost.publisher.api.dto.RemoteArticle;
import io.crosspost.publisher.content.ContentTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a document needs a create, a full update, a metadata-only update or nothing.
 * Pure: no I/O, no clock.
 */
@Service
public class ChangeDetector {
    private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

    private final ContentTransformer contentTransformer;

    public ChangeDetector(ContentTransformer contentTransformer) {
        this.contentTransformer = contentTransformer;
    }

    /**
     * @param remote the resolved article, with its body; empty when the document has no remote copy
     */
    public ReconciliationDecision evaluate(LocalDocument document, Optional<RemoteArticle> remote) {
        if (remote.isEmpty()) {
            return ReconciliationDecision.create();
        }

        RemoteArticle article = remote.get();
        Set<ArticleField> changed = changedFields(document, article);

        if (changed.isEmpty()) {
            return ReconciliationDecision.skip(article.id());
        }

        logger.debug("'{}' changed on {}: {}", document.title(), article.service(), changed);

        if (changed.contains(ArticleField.BODY) || changed.contains(ArticleField.PUBLISH_STATE)) {
            return ReconciliationDecision.fullUpdate(article.id(), changed);
        }
        return ReconciliationDecision.metadataUpdate(article.id(), changed);
    }

    Set<ArticleField> changedFields(LocalDocument document, RemoteArticle article) {
        Set<ArticleField> changed = EnumSet.noneOf(ArticleField.class);

        if (!Objects.equals(document.title(), article.title())) {
            changed.add(ArticleField.TITLE);
        }

        Set<String> localTags = new HashSet<>(contentTransformer.formatTags(document.tags(), article.service()));
        Set<String> remoteTags = new HashSet<>(contentTransformer.formatTags(article.tags(), article.service()));
        if (!localTags.equals(remoteTags)) {
            changed.add(ArticleField.TAGS);
        }

        if (!contentTransformer.sameCover(document.coverUrl(), article.coverUrl(), article.service())) {
            changed.add(ArticleField.COVER_IMAGE);
        }

        String localBody = contentTransformer.normalizeForComparison(document.body());
        String remoteBody = contentTransformer.normalizeForComparison(article.body());
        if (!localBody.equals(remoteBody) || tableOfContentsToggled(document, article)) {
            changed.add(ArticleField.BODY);
        }

        if (document.draft() == article.published()) {
            changed.add(ArticleField.PUBLISH_STATE);
        }

        return changed;
    }

    // Normalization drops the generated TOC, so turning it on or off is checked separately
    private boolean tableOfContentsToggled(LocalDocument document, RemoteArticle article) {
        String publishedBody = contentTransformer.toPayload(document, article.service()).body();
        return contentTransformer.hasTableOfContents(publishedBody) != contentTransformer.hasTableOfContents(article.body());
    }
}
