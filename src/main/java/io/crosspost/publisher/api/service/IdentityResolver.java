package io.crosspost.publisher.api.service;

import io.crosspost.publisher.api.dto.RemoteArticle;
import io.crosspost.publisher.api.dto.RemoteSnapshot;
import io.crosspost.publisher.api.exception.ConnectorException;
import io.crosspost.publisher.api.exception.ErrorCategory;
import io.crosspost.publisher.connector.ConfiguredService;
import io.crosspost.publisher.connector.ServiceConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches local documents to remote articles by exact title.
 */
@Service
public class IdentityResolver {
    private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);

    private static final Comparator<RemoteArticle> NEWEST_CREATED = Comparator.comparing(
            RemoteArticle::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    private final ConnectorRetryTemplates retryTemplates;

    public IdentityResolver(ConnectorRetryTemplates retryTemplates) {
        this.retryTemplates = retryTemplates;
    }

    /**
     * Fetches every article of the service once. AUTH is rethrown so the caller can disable the
     * service; any other failure that survives the retries yields a degraded, empty snapshot.
     */
    public RemoteSnapshot fetchSnapshot(ConfiguredService service) throws ConnectorException {
        ServiceConnector connector = service.connector();

        try {
            List<RemoteArticle> articles = retryTemplates.listing(service.kind())
                    .execute(context -> connector.listArticles());

            logger.info("Fetched {} existing articles from {}", articles.size(), service.kind());
            return RemoteSnapshot.complete(service.kind(), articles);

        } catch (ConnectorException e) {
            if (e.getCategory() == ErrorCategory.AUTH) {
                throw e;
            }

            logger.warn("Could not list articles on {} (category: {}): {}. Every document will be treated as new "
                            + "and orphan deletion is skipped for this service",
                    service.kind(), e.getCategory(), e.getMessage());
            return RemoteSnapshot.unavailable(service.kind());
        }
    }

    /**
     * Exact, case-sensitive title match. Among duplicates the most recently created wins;
     * an unknown creation time counts as oldest.
     */
    public Optional<RemoteArticle> resolve(String title, List<RemoteArticle> candidates) {
        List<RemoteArticle> matches = candidates.stream()
                .filter(article -> Objects.equals(article.title(), title))
                .toList();

        if (matches.size() > 1) {
            logger.warn("Found {} remote articles titled '{}' on {}, using the most recently created",
                    matches.size(), title, matches.get(0).service());
        }

        return matches.stream().max(NEWEST_CREATED);
    }
}
