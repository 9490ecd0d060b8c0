package io.crosspost.publisher.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.crosspost.publisher.api.dto.ArticleField;
import io.crosspost.publisher.api.dto.ArticlePayload;
import io.crosspost.publisher.api.dto.RemoteArticle;
import io.crosspost.publisher.api.dto.ServiceKind;
import io.crosspost.publisher.api.exception.ConnectorException;
import io.crosspost.publisher.api.exception.ErrorCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hashnode over its GraphQL API. Published posts come from the user's post list, drafts
 * from the publication's draft list.
 * <p>
 * Drafts and posts live in separate id spaces with their own mutations, so the connector
 * remembers which ids it has seen as drafts and routes get, update and delete accordingly.
 * A draft updated with {@code published = true} is published and replaced by the new post.
 */
public class HashnodeConnector implements ServiceConnector {

    private static final Logger logger = LoggerFactory.getLogger(HashnodeConnector.class);

    public static final String DEFAULT_API_URL = "https://gql.hashnode.com";
    static final int DEFAULT_PAGE_SIZE = 20;

    private static final String POST_FIELDS = """
            id
            title
            content { markdown }
            coverImage { url }
            publishedAt
            updatedAt
            tags { name }
            """;

    private static final String DRAFT_FIELDS = """
            id
            title
            content { markdown }
            coverImage { url }
            updatedAt
            tags { name }
            """;

    private static final String LIST_POSTS_QUERY = """
            query UserPosts($username: String!, $page: Int!, $pageSize: Int!) {
              user(username: $username) {
                posts(page: $page, pageSize: $pageSize) {
                  nodes { %s }
                  pageInfo { hasNextPage }
                }
              }
            }
            """.formatted(POST_FIELDS);

    private static final String LIST_DRAFTS_QUERY = """
            query PublicationDrafts($publicationId: ObjectId!, $first: Int!, $after: String) {
              publication(id: $publicationId) {
                drafts(first: $first, after: $after) {
                  edges { node { %s } }
                  pageInfo { hasNextPage endCursor }
                }
              }
            }
            """.formatted(DRAFT_FIELDS);

    private static final String GET_POST_QUERY = """
            query Post($id: ID!) {
              post(id: $id) { %s }
            }
            """.formatted(POST_FIELDS);

    private static final String GET_DRAFT_QUERY = """
            query Draft($id: ObjectId!) {
              draft(id: $id) { %s }
            }
            """.formatted(DRAFT_FIELDS);

    private static final String PUBLISH_POST_MUTATION = """
            mutation PublishPost($input: PublishPostInput!) {
              publishPost(input: $input) { post { %s } }
            }
            """.formatted(POST_FIELDS);

    private static final String CREATE_DRAFT_MUTATION = """
            mutation CreateDraft($input: CreateDraftInput!) {
              createDraft(input: $input) { draft { %s } }
            }
            """.formatted(DRAFT_FIELDS);

    private static final String UPDATE_DRAFT_MUTATION = """
            mutation UpdateDraft($input: UpdateDraftInput!) {
              updateDraft(input: $input) { draft { %s } }
            }
            """.formatted(DRAFT_FIELDS);

    private static final String PUBLISH_DRAFT_MUTATION = """
            mutation PublishDraft($input: PublishDraftInput!) {
              publishDraft(input: $input) { post { %s } }
            }
            """.formatted(POST_FIELDS);

    private static final String REMOVE_DRAFT_MUTATION = """
            mutation RemoveDraft($input: RemoveDraftInput!) {
              removeDraft(input: $input) { draft { id } }
            }
            """;

    private static final String UPDATE_POST_MUTATION = """
            mutation UpdatePost($input: UpdatePostInput!) {
              updatePost(input: $input) { post { %s } }
            }
            """.formatted(POST_FIELDS);

    private static final String REMOVE_POST_MUTATION = """
            mutation RemovePost($input: RemovePostInput!) {
              removePost(input: $input) { post { id } }
            }
            """;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;
    private final String username;
    private final String publicationId;
    private final int pageSize;
    private final Set<String> draftIds = ConcurrentHashMap.newKeySet();

    public HashnodeConnector(RestTemplate restTemplate, ObjectMapper objectMapper, String apiUrl,
                             String apiKey, String username, String publicationId) {
        this(restTemplate, objectMapper, apiUrl, apiKey, username, publicationId, DEFAULT_PAGE_SIZE);
    }

    HashnodeConnector(RestTemplate restTemplate, ObjectMapper objectMapper, String apiUrl,
                      String apiKey, String username, String publicationId, int pageSize) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl;
        this.apiKey = apiKey;
        this.username = username;
        this.publicationId = publicationId;
        this.pageSize = pageSize;
    }

    @Override
    public ServiceKind kind() {
        return ServiceKind.HASHNODE;
    }

    @Override
    public List<RemoteArticle> listArticles() throws ConnectorException {
        List<RemoteArticle> articles = new ArrayList<>(listPublishedPosts());
        articles.addAll(listDrafts());

        logger.debug("Retrieved {} articles from Hashnode", articles.size());
        return articles;
    }

    private List<RemoteArticle> listPublishedPosts() throws ConnectorException {
        List<RemoteArticle> posts = new ArrayList<>();

        for (int page = 1; ; page++) {
            Map<String, Object> variables = new LinkedHashMap<>();
            variables.put("username", username);
            variables.put("page", page);
            variables.put("pageSize", pageSize);

            JsonNode postsNode = execute(LIST_POSTS_QUERY, variables, ConnectorOperation.LIST)
                    .path("user").path("posts");

            JsonNode nodes = postsNode.path("nodes");
            if (!nodes.isArray() || nodes.isEmpty()) break;

            nodes.forEach(node -> posts.add(toRemoteArticle(node, true)));

            if (!postsNode.path("pageInfo").path("hasNextPage").asBoolean(false)) break;
        }

        return posts;
    }

    private List<RemoteArticle> listDrafts() throws ConnectorException {
        List<RemoteArticle> drafts = new ArrayList<>();
        String cursor = null;

        while (true) {
            Map<String, Object> variables = new LinkedHashMap<>();
            variables.put("publicationId", publicationId);
            variables.put("first", pageSize);
            variables.put("after", cursor);

            JsonNode draftsNode = execute(LIST_DRAFTS_QUERY, variables, ConnectorOperation.LIST)
                    .path("publication").path("drafts");

            draftsNode.path("edges").forEach(edge -> drafts.add(toRemoteArticle(edge.path("node"), false)));

            JsonNode pageInfo = draftsNode.path("pageInfo");
            cursor = JsonSupport.text(pageInfo, "endCursor");
            if (!pageInfo.path("hasNextPage").asBoolean(false) || cursor == null) break;
        }

        drafts.forEach(draft -> draftIds.add(draft.id()));
        return drafts;
    }

    @Override
    public Optional<RemoteArticle> getArticle(String id) throws ConnectorException {
        if (draftIds.contains(id)) {
            JsonNode draft = execute(GET_DRAFT_QUERY, Map.of("id", id), ConnectorOperation.GET).path("draft");
            if (draft.isMissingNode() || draft.isNull()) return Optional.empty();
            return Optional.of(toRemoteArticle(draft, false));
        }

        JsonNode post = execute(GET_POST_QUERY, Map.of("id", id), ConnectorOperation.GET).path("post");

        if (post.isMissingNode() || post.isNull()) return Optional.empty();

        return Optional.of(toRemoteArticle(post, JsonSupport.text(post, "publishedAt") != null));
    }

    @Override
    public RemoteArticle createArticle(ArticlePayload payload, boolean published) throws ConnectorException {
        Map<String, Object> input = postInput(payload);
        input.put("publicationId", publicationId);

        if (!published) {
            JsonNode draft = execute(CREATE_DRAFT_MUTATION, Map.of("input", input), ConnectorOperation.CREATE)
                    .path("createDraft").path("draft");
            RemoteArticle created = requireArticle(draft, false, ConnectorOperation.CREATE);
            draftIds.add(created.id());
            return created;
        }

        JsonNode post = execute(PUBLISH_POST_MUTATION, Map.of("input", input), ConnectorOperation.CREATE)
                .path("publishPost").path("post");
        return requireArticle(post, true, ConnectorOperation.CREATE);
    }

    @Override
    public RemoteArticle updateArticle(String id, ArticlePayload payload, boolean published) throws ConnectorException {
        if (draftIds.contains(id)) {
            return updateDraft(id, payload, published);
        }

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("id", id);
        input.putAll(postInput(payload));

        if (!published && payload.includes(ArticleField.PUBLISH_STATE)) {
            // Hashnode cannot turn a published post back into a draft
            logger.warn("Hashnode post {} stays published although '{}' is marked as draft", id, payload.title());
        }

        JsonNode post = execute(UPDATE_POST_MUTATION, Map.of("input", input), ConnectorOperation.UPDATE)
                .path("updatePost").path("post");
        return requireArticle(post, true, ConnectorOperation.UPDATE);
    }

    private RemoteArticle updateDraft(String id, ArticlePayload payload, boolean published) throws ConnectorException {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("id", id);
        input.putAll(postInput(payload));

        JsonNode draft = execute(UPDATE_DRAFT_MUTATION, Map.of("input", input), ConnectorOperation.UPDATE)
                .path("updateDraft").path("draft");
        RemoteArticle updated = requireArticle(draft, false, ConnectorOperation.UPDATE);

        if (!published) return updated;

        JsonNode post = execute(PUBLISH_DRAFT_MUTATION, Map.of("input", Map.of("draftId", id)), ConnectorOperation.UPDATE)
                .path("publishDraft").path("post");
        RemoteArticle publishedPost = requireArticle(post, true, ConnectorOperation.UPDATE);
        draftIds.remove(id);

        logger.debug("Published Hashnode draft {} as post {}", id, publishedPost.id());
        return publishedPost;
    }

    @Override
    public void deleteArticle(String id) throws ConnectorException {
        if (draftIds.contains(id)) {
            JsonNode removed = execute(REMOVE_DRAFT_MUTATION, Map.of("input", Map.of("id", id)), ConnectorOperation.DELETE)
                    .path("removeDraft").path("draft");

            if (removed.isMissingNode() || removed.isNull()) {
                throw new ConnectorException("Hashnode did not confirm removal of draft " + id, ErrorCategory.UNKNOWN);
            }
            draftIds.remove(id);
            logger.debug("Removed Hashnode draft {}", id);
            return;
        }

        JsonNode removed = execute(REMOVE_POST_MUTATION, Map.of("input", Map.of("id", id)), ConnectorOperation.DELETE)
                .path("removePost").path("post");

        if (removed.isMissingNode() || removed.isNull()) {
            throw new ConnectorException("Hashnode did not confirm removal of post " + id, ErrorCategory.UNKNOWN);
        }
        logger.debug("Removed Hashnode post {}", id);
    }

    private Map<String, Object> postInput(ArticlePayload payload) {
        Map<String, Object> input = new LinkedHashMap<>();

        if (payload.includes(ArticleField.TITLE)) input.put("title", payload.title());
        if (payload.includes(ArticleField.SUBTITLE) && hasText(payload.subtitle())) input.put("subtitle", payload.subtitle());
        if (payload.includes(ArticleField.BODY)) input.put("contentMarkdown", payload.body());
        if (payload.includes(ArticleField.SLUG) && hasText(payload.slug())) input.put("slug", payload.slug());

        if (payload.includes(ArticleField.TAGS)) {
            input.put("tags", payload.tags().stream()
                    .map(tag -> Map.of("name", tag, "slug", tag))
                    .toList());
        }

        if (payload.includes(ArticleField.COVER_IMAGE) && hasText(payload.coverUrl())) {
            input.put("coverImageOptions", Map.of("coverImageURL", payload.coverUrl()));
        }

        if (payload.includes(ArticleField.CANONICAL_URL) && hasText(payload.canonicalUrl())) {
            input.put("originalArticleURL", payload.canonicalUrl());
        }

        return input;
    }

    private JsonNode execute(String query, Map<String, Object> variables, ConnectorOperation operation)
            throws ConnectorException {
        JsonNode response;

        try {
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("query", query);
            request.put("variables", variables);

            String body = restTemplate.exchange(apiUrl, HttpMethod.POST,
                    new HttpEntity<>(objectMapper.writeValueAsString(request), headers()), String.class).getBody();

            response = objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);

        } catch (RestClientException e) {
            throw HttpErrorTranslator.translate(e, ServiceKind.HASHNODE, operation);

        } catch (JsonProcessingException e) {
            throw new ConnectorException("Invalid JSON exchanged with Hashnode during " + operation, e, ErrorCategory.UNKNOWN);
        }

        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw translateGraphQlError(errors.get(0), operation);
        }

        return response.path("data");
    }

    static ConnectorException translateGraphQlError(JsonNode error, ConnectorOperation operation) {
        String code = error.path("extensions").path("code").asText("");
        String message = error.path("message").asText("unknown GraphQL error");

        ErrorCategory category;
        if (message.contains("minimum required role")) {
            category = ErrorCategory.PERMISSION_DENIED;
        } else {
            category = switch (code) {
                case "UNAUTHENTICATED" -> ErrorCategory.AUTH;
                case "FORBIDDEN" -> operation == ConnectorOperation.DELETE
                        ? ErrorCategory.PERMISSION_DENIED
                        : ErrorCategory.AUTH;
                case "NOT_FOUND" -> ErrorCategory.NOT_FOUND;
                case "TOO_MANY_REQUESTS", "RATE_LIMITED" -> ErrorCategory.RATE_LIMITED;
                case "INTERNAL_SERVER_ERROR", "SERVICE_UNAVAILABLE" -> ErrorCategory.TRANSIENT_NETWORK;
                default -> ErrorCategory.UNKNOWN;
            };
        }

        return new ConnectorException(
                String.format("%s failed on hashnode (%s): %s", operation, code.isEmpty() ? "no code" : code, message),
                category);
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private RemoteArticle requireArticle(JsonNode node, boolean published, ConnectorOperation operation)
            throws ConnectorException {
        if (node.isMissingNode() || node.isNull() || !node.hasNonNull("id")) {
            throw new ConnectorException("Hashnode returned no post for " + operation, ErrorCategory.UNKNOWN);
        }
        return toRemoteArticle(node, published);
    }

    RemoteArticle toRemoteArticle(JsonNode node, boolean published) {
        Set<String> tags = new LinkedHashSet<>();
        node.path("tags").forEach(tag -> tags.add(tag.path("name").asText()));
        tags.removeIf(String::isBlank);

        JsonNode content = node.path("content");
        JsonNode cover = node.path("coverImage");

        return new RemoteArticle(
                ServiceKind.HASHNODE,
                JsonSupport.text(node, "id"),
                JsonSupport.text(node, "title"),
                content.isObject() ? JsonSupport.text(content, "markdown") : null,
                tags,
                published,
                cover.isObject() ? JsonSupport.text(cover, "url") : null,
                // Hashnode exposes no creation time; the publication time is the closest stable value
                JsonSupport.instant(node, "publishedAt"),
                JsonSupport.instant(node, "updatedAt")
        );
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
