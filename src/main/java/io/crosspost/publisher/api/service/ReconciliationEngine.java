package io.crosspost.publisher.api.service;

import io.crosspost.publisher.api.dto.ArticlePayload;
import io.crosspost.publisher.api.dto.LocalDocument;
import io.crosspost.publisher.api.dto.PublicationResult;
import io.crosspost.publisher.api.dto.ReconciliationDecision;
import io.crosspost.publisher.api.dto.ReconciliationDecision.Action;
import io.crosspost.publisher.api.dto.ReconciliationDecision.UpdateScope;
import io.crosspost.publisher.api.dto.RemoteArticle;
import io.crosspost.publisher.api.dto.RemoteSnapshot;
import io.crosspost.publisher.api.dto.ServiceKind;
import io.crosspost.publisher.api.exception.ConnectorException;
import io.crosspost.publisher.api.exception.ErrorCategory;
import io.crosspost.publisher.api.exception.PublisherConfigurationException;
import io.crosspost.publisher.config.ContentConfig;
import io.crosspost.publisher.config.DeletionConfig;
import io.crosspost.publisher.connector.ConfiguredService;
import io.crosspost.publisher.connector.ConnectorOperation;
import io.crosspost.publisher.connector.ServiceRegistry;
import io.crosspost.publisher.content.ContentTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one run: every document against every enabled service, in order, then the orphan
 * sweep. A failure on one (document, service) pair never stops the others.
 */
@Service
public class ReconciliationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ServiceRegistry serviceRegistry;
    private final IdentityResolver identityResolver;
    private final ChangeDetector changeDetector;
    private final ContentTransformer contentTransformer;
    private final ConnectorRetryTemplates retryTemplates;
    private final ContentConfig contentConfig;
    private final DeletionConfig deletionConfig;
    private final Sleeper sleeper;

    public ReconciliationEngine(ServiceRegistry serviceRegistry,
                                IdentityResolver identityResolver,
                                ChangeDetector changeDetector,
                                ContentTransformer contentTransformer,
                                ConnectorRetryTemplates retryTemplates,
                                ContentConfig contentConfig,
                                DeletionConfig deletionConfig,
                                Sleeper sleeper) {
        this.serviceRegistry = serviceRegistry;
        this.identityResolver = identityResolver;
        this.changeDetector = changeDetector;
        this.contentTransformer = contentTransformer;
        this.retryTemplates = retryTemplates;
        this.contentConfig = contentConfig;
        this.deletionConfig = deletionConfig;
        this.sleeper = sleeper;
    }

    public ResultAggregator reconcile(List<LocalDocument> documents, CancellationToken cancellation) {
        List<ConfiguredService> services = serviceRegistry.enabledServices();
        if (services.isEmpty()) {
            throw new PublisherConfigurationException(
                    "No publishing service is enabled. Enable at least one entry under publisher.services");
        }

        logger.info("Reconciling {} documents against {}", documents.size(), serviceRegistry.kinds());
        long startTime = System.currentTimeMillis();

        ResultAggregator aggregator = new ResultAggregator();
        List<ServiceBranch> branches = services.stream()
                .map(this::openBranch)
                .toList();

        boolean stopped = false;
        for (int i = 0; i < documents.size(); i++) {
            if (i > 0) {
                pauseBetweenDocuments(cancellation);
            }

            // A stop can arrive during the previous document or the pause
            if (stopRequested(cancellation)) {
                logger.warn("Stop requested, {} of {} documents left unprocessed", documents.size() - i, documents.size());
                stopped = true;
                break;
            }

            reconcileDocument(documents.get(i), branches, aggregator);
        }

        if (stopped || stopRequested(cancellation)) {
            logger.warn("Orphan deletion skipped because the run was stopped");
        } else {
            sweepOrphans(documents, branches, aggregator);
        }

        logger.info("Reconciliation completed in {}ms: {}",
                System.currentTimeMillis() - startTime, aggregator.countsByOutcome());
        return aggregator;
    }

    private ServiceBranch openBranch(ConfiguredService service) {
        try {
            return new ServiceBranch(service, identityResolver.fetchSnapshot(service));
        } catch (ConnectorException e) {
            ServiceBranch branch = new ServiceBranch(service, RemoteSnapshot.unavailable(service.kind()));
            branch.disable(e);
            return branch;
        }
    }

    private void reconcileDocument(LocalDocument document, List<ServiceBranch> branches, ResultAggregator aggregator) {
        logger.info("Processing '{}'", document.title());

        List<PublicationResult> results = new ArrayList<>();
        for (ServiceBranch branch : branches) {
            PublicationResult result = reconcileOnBranch(document, branch);
            aggregator.record(result);
            results.add(result);
        }

        List<ServiceKind> failed = results.stream()
                .filter(result -> !result.success())
                .map(PublicationResult::service)
                .toList();

        if (failed.size() == results.size()) {
            logger.error("'{}' failed on every service", document.title());
        } else if (!failed.isEmpty()) {
            List<ServiceKind> succeeded = results.stream()
                    .filter(PublicationResult::success)
                    .map(PublicationResult::service)
                    .toList();
            logger.warn("'{}' partially published: succeeded on {}, failed on {}",
                    document.title(), succeeded, failed);
        }
    }

    private PublicationResult reconcileOnBranch(LocalDocument document, ServiceBranch branch) {
        ServiceKind kind = branch.kind();
        String title = document.title();

        if (branch.disabled) {
            return PublicationResult.failed(kind, title, null, null, ErrorCategory.AUTH, branch.disabledReason);
        }

        Action action = null;
        String remoteId = null;

        try {
            Optional<RemoteArticle> remote = hydrate(branch, identityResolver.resolve(title, branch.articles));

            ReconciliationDecision decision = changeDetector.evaluate(document, remote);
            action = decision.action();
            remoteId = decision.remoteId();

            return execute(document, branch, decision);

        } catch (ConnectorException e) {
            return handleFailure(branch, title, action, remoteId, e);

        } catch (Exception e) {
            logger.error("Unexpected error while processing '{}' on {} (action: {}): {}",
                    title, kind, action, e.getMessage(), e);
            return PublicationResult.failed(kind, title, action, remoteId, ErrorCategory.UNKNOWN, e.getMessage());
        }
    }

    /**
     * Listings may leave bodies out. Fetch the full article before comparing; an article that
     * vanished since the listing is treated as absent.
     */
    private Optional<RemoteArticle> hydrate(ServiceBranch branch, Optional<RemoteArticle> remote)
            throws ConnectorException {
        if (remote.isEmpty() || remote.get().body() != null) {
            return remote;
        }

        String id = remote.get().id();
        try {
            Optional<RemoteArticle> full = call(branch, ConnectorOperation.GET,
                    context -> branch.service.connector().getArticle(id));
            if (full.isEmpty()) {
                logger.warn("Article {} on {} is gone since the listing, creating it again", id, branch.kind());
            }
            return full;
        } catch (ConnectorException e) {
            if (e.getCategory() != ErrorCategory.NOT_FOUND) throw e;

            logger.warn("Article {} on {} is gone since the listing, creating it again", id, branch.kind());
            return Optional.empty();
        }
    }

    private PublicationResult execute(LocalDocument document, ServiceBranch branch, ReconciliationDecision decision)
            throws ConnectorException {
        ServiceKind kind = branch.kind();
        String title = document.title();

        switch (decision.action()) {
            case SKIP -> {
                logger.info("'{}' is up to date on {}", title, kind);
                return PublicationResult.skipped(kind, title, decision.remoteId());
            }
            case CREATE -> {
                RemoteArticle created = create(document, branch);
                return PublicationResult.created(kind, title, created.id());
            }
            case UPDATE -> {
                return update(document, branch, decision);
            }
            default -> throw new IllegalStateException("Unexpected action for a local document: " + decision.action());
        }
    }

    private RemoteArticle create(LocalDocument document, ServiceBranch branch) throws ConnectorException {
        ArticlePayload payload = contentTransformer.toPayload(document, branch.kind());

        RemoteArticle created = call(branch, ConnectorOperation.CREATE,
                context -> branch.service.connector().createArticle(payload, !document.draft()));
        branch.articles.add(created);

        logger.info("Created '{}' on {} (id: {}, draft: {})", document.title(), branch.kind(), created.id(), document.draft());
        return created;
    }

    private PublicationResult update(LocalDocument document, ServiceBranch branch, ReconciliationDecision decision)
            throws ConnectorException {
        ServiceKind kind = branch.kind();
        String title = document.title();
        String id = decision.remoteId();

        ArticlePayload payload = contentTransformer.toPayload(document, kind);
        if (decision.scope() == UpdateScope.METADATA_ONLY) {
            payload = payload.restrictTo(decision.changedFields());
        }
        ArticlePayload request = payload;

        try {
            RemoteArticle updated = call(branch, ConnectorOperation.UPDATE,
                    context -> branch.service.connector().updateArticle(id, request, !document.draft()));

            logger.info("Updated '{}' on {} (id: {}, {}: {})",
                    title, kind, updated.id(), decision.scope(), decision.changedFields());
            return PublicationResult.updated(kind, title, updated.id());

        } catch (ConnectorException e) {
            if (e.getCategory() != ErrorCategory.NOT_FOUND) throw e;

            logger.warn("Article {} for '{}' no longer exists on {}, creating it again", id, title, kind);
            RemoteArticle created = create(document, branch);
            return PublicationResult.created(kind, title, created.id());
        }
    }

    private PublicationResult handleFailure(ServiceBranch branch, String title, Action action, String remoteId,
                                            ConnectorException e) {
        ServiceKind kind = branch.kind();

        if (e.getCategory() == ErrorCategory.AUTH) {
            branch.disable(e);
            return PublicationResult.failed(kind, title, action, remoteId, ErrorCategory.AUTH, branch.disabledReason);
        }

        logger.error("Failed to {} '{}' on {} (category: {}): {}",
                action == null ? "process" : action.name().toLowerCase(), title, kind, e.getCategory(), e.getMessage());
        return PublicationResult.failed(kind, title, action, remoteId, e.getCategory(), e.getMessage());
    }

    private void sweepOrphans(List<LocalDocument> documents, List<ServiceBranch> branches, ResultAggregator aggregator) {
        if (!deletionConfig.orphanSweep()) {
            logger.debug("Orphan deletion disabled");
            return;
        }

        Set<String> localTitles = new HashSet<>();
        documents.forEach(document -> localTitles.add(document.title()));

        for (ServiceBranch branch : branches) {
            if (branch.snapshot.degraded()) {
                if (!branch.disabled) {
                    logger.warn("Orphan deletion skipped on {} because its article listing is unavailable", branch.kind());
                }
                continue;
            }

            List<RemoteArticle> orphans = branch.snapshot.articles().stream()
                    .filter(article -> !localTitles.contains(article.title()))
                    .toList();

            if (!orphans.isEmpty()) {
                logger.info("Deleting {} orphaned articles from {}", orphans.size(), branch.kind());
            }

            for (RemoteArticle orphan : orphans) {
                aggregator.record(deleteOrphan(branch, orphan.title(), ReconciliationDecision.delete(orphan.id())));
            }
        }
    }

    private PublicationResult deleteOrphan(ServiceBranch branch, String title, ReconciliationDecision decision) {
        ServiceKind kind = branch.kind();
        String id = decision.remoteId();

        if (branch.disabled) {
            return PublicationResult.failed(kind, title, Action.DELETE, id, ErrorCategory.AUTH, branch.disabledReason);
        }

        try {
            call(branch, ConnectorOperation.DELETE, context -> {
                branch.service.connector().deleteArticle(id);
                return null;
            });

            logger.info("Deleted orphan '{}' from {} (id: {})", title, kind, id);
            return PublicationResult.deleted(kind, title, id);

        } catch (ConnectorException e) {
            switch (e.getCategory()) {
                case PERMISSION_DENIED -> {
                    if (deletionConfig.skipPermissionErrors()) {
                        logger.warn("No permission to delete '{}' from {} (id: {}), leaving it in place", title, kind, id);
                        return PublicationResult.warning(kind, title, Action.DELETE, id,
                                ErrorCategory.PERMISSION_DENIED, e.getMessage());
                    }
                    logger.error("No permission to delete '{}' from {} (id: {}): {}", title, kind, id, e.getMessage());
                    return PublicationResult.failed(kind, title, Action.DELETE, id,
                            ErrorCategory.PERMISSION_DENIED, e.getMessage());
                }
                case NOT_FOUND -> {
                    logger.info("Orphan '{}' on {} (id: {}) was already removed", title, kind, id);
                    return PublicationResult.deleted(kind, title, id);
                }
                case AUTH -> {
                    branch.disable(e);
                    return PublicationResult.failed(kind, title, Action.DELETE, id, ErrorCategory.AUTH,
                            branch.disabledReason);
                }
                default -> {
                    logger.error("Failed to delete '{}' from {} (id: {}, category: {}): {}",
                            title, kind, id, e.getCategory(), e.getMessage());
                    return PublicationResult.failed(kind, title, Action.DELETE, id, e.getCategory(), e.getMessage());
                }
            }

        } catch (Exception e) {
            logger.error("Unexpected error while deleting '{}' from {} (id: {}): {}", title, kind, id, e.getMessage(), e);
            return PublicationResult.failed(kind, title, Action.DELETE, id, ErrorCategory.UNKNOWN, e.getMessage());
        }
    }

    private <T> T call(ServiceBranch branch, ConnectorOperation operation,
                       RetryCallback<T, ConnectorException> callback) throws ConnectorException {
        return retryTemplates.operations(branch.service, operation).execute(callback);
    }

    private boolean stopRequested(CancellationToken cancellation) {
        if (Thread.currentThread().isInterrupted()) {
            cancellation.requestStop();
        }
        return cancellation.isStopRequested();
    }

    private void pauseBetweenDocuments(CancellationToken cancellation) {
        long delay = contentConfig.getDocumentDelayMs();
        if (delay <= 0) return;

        try {
            logger.debug("Waiting {}ms before the next document", delay);
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.requestStop();
        }
    }

    /**
     * Per-run state of one service. Articles created during the run are added to {@code articles}
     * so a later document with the same title resolves to them; the snapshot itself stays as listed.
     */
    static final class ServiceBranch {
        private final ConfiguredService service;
        private final RemoteSnapshot snapshot;
        private final List<RemoteArticle> articles;
        private boolean disabled;
        private String disabledReason;

        ServiceBranch(ConfiguredService service, RemoteSnapshot snapshot) {
            this.service = service;
            this.snapshot = snapshot;
            this.articles = new ArrayList<>(snapshot.articles());
        }

        ServiceKind kind() {
            return service.kind();
        }

        void disable(ConnectorException cause) {
            if (disabled) return;

            disabled = true;
            disabledReason = "Authentication failed on " + kind() + ": " + cause.getMessage()
                    + ". Check the API key, remaining documents are not sent to this service";
            logger.error(disabledReason);
        }
    }
}
