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
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * dev.to (Forem API v1) over REST.
 */
public class DevToConnector implements ServiceConnector {

    private static final Logger logger = LoggerFactory.getLogger(DevToConnector.class);

    public static final String DEFAULT_API_URL = "https://dev.to/api";
    static final int DEFAULT_PAGE_SIZE = 1000;
    private static final String ACCEPT_V1 = "application/vnd.forem.api-v1+json";

    // Image proxy URLs end with the source URL, raw or percent-encoded
    private static final Pattern PROXIED_COVER =
            Pattern.compile("^https?://[^/]+/.*?/(https?(?:%3A%2F%2F|://).*)$", Pattern.CASE_INSENSITIVE);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;
    private final int pageSize;

    public DevToConnector(RestTemplate restTemplate, ObjectMapper objectMapper, String apiUrl, String apiKey) {
        this(restTemplate, objectMapper, apiUrl, apiKey, DEFAULT_PAGE_SIZE);
    }

    DevToConnector(RestTemplate restTemplate, ObjectMapper objectMapper, String apiUrl, String apiKey, int pageSize) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiUrl = stripTrailingSlash(apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl);
        this.apiKey = apiKey;
        this.pageSize = pageSize;
    }

    @Override
    public ServiceKind kind() {
        return ServiceKind.DEVTO;
    }

    @Override
    public List<RemoteArticle> listArticles() throws ConnectorException {
        List<RemoteArticle> articles = fetchAllPages("/articles/me/all", ConnectorOperation.LIST);
        logger.debug("Retrieved {} articles from dev.to", articles.size());
        return articles;
    }

    @Override
    public Optional<RemoteArticle> getArticle(String id) throws ConnectorException {
        try {
            JsonNode node = exchange(HttpMethod.GET, "/articles/" + id, null, ConnectorOperation.GET);
            return node == null ? Optional.empty() : Optional.of(toRemoteArticle(node));
        } catch (ConnectorException e) {
            if (e.getCategory() != ErrorCategory.NOT_FOUND) throw e;
        }

        // The public endpoint only serves published articles
        return fetchAllPages("/articles/me/unpublished", ConnectorOperation.GET).stream()
                .filter(article -> id.equals(article.id()))
                .findFirst();
    }

    @Override
    public RemoteArticle createArticle(ArticlePayload payload, boolean published) throws ConnectorException {
        JsonNode node = exchange(HttpMethod.POST, "/articles", requestBody(payload, published), ConnectorOperation.CREATE);
        RemoteArticle created = requireArticle(node, ConnectorOperation.CREATE);
        logger.debug("Created dev.to article {} for '{}'", created.id(), payload.title());
        return created;
    }

    @Override
    public RemoteArticle updateArticle(String id, ArticlePayload payload, boolean published) throws ConnectorException {
        JsonNode node = exchange(HttpMethod.PUT, "/articles/" + id, requestBody(payload, published), ConnectorOperation.UPDATE);
        return requireArticle(node, ConnectorOperation.UPDATE);
    }

    @Override
    public void deleteArticle(String id) throws ConnectorException {
        exchange(HttpMethod.DELETE, "/articles/" + id, null, ConnectorOperation.DELETE);
        logger.debug("Deleted dev.to article {}", id);
    }

    private List<RemoteArticle> fetchAllPages(String path, ConnectorOperation operation) throws ConnectorException {
        List<RemoteArticle> articles = new ArrayList<>();

        for (int page = 1; ; page++) {
            JsonNode nodes = exchange(HttpMethod.GET,
                    path + "?page=" + page + "&per_page=" + pageSize, null, operation);

            if (nodes == null || !nodes.isArray() || nodes.isEmpty()) break;

            nodes.forEach(node -> articles.add(toRemoteArticle(node)));

            if (nodes.size() < pageSize) break;
        }

        return articles;
    }

    private Map<String, Object> requestBody(ArticlePayload payload, boolean published) {
        Map<String, Object> article = new LinkedHashMap<>();

        if (payload.includes(ArticleField.TITLE)) article.put("title", payload.title());
        if (payload.includes(ArticleField.BODY)) article.put("body_markdown", payload.body());
        if (payload.includes(ArticleField.TAGS)) article.put("tags", payload.tags());
        if (payload.includes(ArticleField.COVER_IMAGE)) article.put("main_image", nullToEmpty(payload.coverUrl()));
        if (payload.includes(ArticleField.SUBTITLE)) article.put("description", nullToEmpty(payload.subtitle()));
        if (payload.includes(ArticleField.CANONICAL_URL) && hasText(payload.canonicalUrl())) {
            article.put("canonical_url", payload.canonicalUrl());
        }
        if (payload.includes(ArticleField.SERIES)) article.put("series", nullToEmpty(payload.seriesName()));
        if (payload.includes(ArticleField.PUBLISH_STATE)) article.put("published", published);

        return Map.of("article", article);
    }

    private JsonNode exchange(HttpMethod method, String path, Object body, ConnectorOperation operation)
            throws ConnectorException {
        try {
            HttpEntity<String> request = new HttpEntity<>(
                    body == null ? null : objectMapper.writeValueAsString(body), headers());

            ResponseEntity<String> response = restTemplate.exchange(apiUrl + path, method, request, String.class);

            String text = response.getBody();
            return text == null || text.isBlank() ? null : objectMapper.readTree(text);

        } catch (RestClientException e) {
            throw HttpErrorTranslator.translate(e, ServiceKind.DEVTO, operation);

        } catch (JsonProcessingException e) {
            throw new ConnectorException("Invalid JSON exchanged with dev.to during " + operation, e, ErrorCategory.UNKNOWN);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("api-key", apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.ACCEPT, ACCEPT_V1);
        return headers;
    }

    private RemoteArticle requireArticle(JsonNode node, ConnectorOperation operation) throws ConnectorException {
        if (node == null || !node.hasNonNull("id")) {
            throw new ConnectorException("dev.to returned no article for " + operation, ErrorCategory.UNKNOWN);
        }
        return toRemoteArticle(node);
    }

    RemoteArticle toRemoteArticle(JsonNode node) {
        boolean published = node.has("published")
                ? node.path("published").asBoolean(false)
                : JsonSupport.text(node, "published_at") != null;

        var createdAt = JsonSupport.instant(node, "created_at");
        if (createdAt == null) {
            createdAt = JsonSupport.instant(node, "published_at");
        }

        return new RemoteArticle(
                ServiceKind.DEVTO,
                JsonSupport.text(node, "id"),
                JsonSupport.text(node, "title"),
                JsonSupport.text(node, "body_markdown"),
                tags(node),
                published,
                sourceCoverUrl(JsonSupport.text(node, "cover_image")),
                createdAt,
                JsonSupport.instant(node, "edited_at")
        );
    }

    // tag_list is an array on /me endpoints and a comma-separated string on /articles/{id}
    private Set<String> tags(JsonNode node) {
        Set<String> tags = new LinkedHashSet<>();
        JsonNode tagList = node.path("tag_list");
        JsonNode source = tagList.isArray() ? tagList : node.path("tags");

        if (source.isArray()) {
            source.forEach(tag -> tags.add(tag.asText().trim()));
        } else if (tagList.isTextual()) {
            Arrays.stream(tagList.asText().split(","))
                    .map(String::trim)
                    .forEach(tags::add);
        }

        tags.removeIf(String::isEmpty);
        return tags;
    }

    /**
     * dev.to answers with the cover behind its image proxy. Returns the URL the cover was set
     * from, or the value unchanged when it is not a proxy URL.
     */
    static String sourceCoverUrl(String coverImage) {
        if (coverImage == null) return null;

        Matcher proxied = PROXIED_COVER.matcher(coverImage);
        if (!proxied.matches()) return coverImage;

        String source = proxied.group(1);
        return source.contains("://") ? source : URLDecoder.decode(source, StandardCharsets.UTF_8);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
