package io.crosspost.publisher.connector;

import io.crosspost.publisher.api.dto.ArticlePayload;
import io.crosspost.publisher.api.dto.RemoteArticle;
import io.crosspost.publisher.api.dto.ServiceKind;
import io.crosspost.publisher.api.exception.ConnectorException;

import java.util.List;
import java.util.Optional;

/**
 * Remote article operations of one publishing service. Every failure is reported as a
 * {@link ConnectorException} with a normalized category; implementations never leak
 * transport exceptions.
 */
public interface ServiceConnector {

    ServiceKind kind();

    /**
     * Every article of the account, drafts included. Pagination is handled internally.
     */
    List<RemoteArticle> listArticles() throws ConnectorException;

    Optional<RemoteArticle> getArticle(String id) throws ConnectorException;

    RemoteArticle createArticle(ArticlePayload payload, boolean published) throws ConnectorException;

    RemoteArticle updateArticle(String id, ArticlePayload payload, boolean published) throws ConnectorException;

    void deleteArticle(String id) throws ConnectorException;
}
