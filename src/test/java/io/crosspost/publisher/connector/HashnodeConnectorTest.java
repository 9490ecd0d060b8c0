package io.crosspost.publisher.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.crosspost.publisher.api.dto.ArticleField;
import io.crosspost.publisher.api.dto.ArticlePayload;
import io.crosspost.publisher.api.dto.RemoteArticle;
import io.crosspost.publisher.api.exception.ConnectorException;
import io.crosspost.publisher.api.exception.ErrorCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class HashnodeConnectorTest {

    private static final String PUBLICATION_ID = "65a1b2c3d4e5f6a7b8c9d0e1";

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private HashnodeConnector connector;

    @BeforeEach
    void setUp() {
        HttpClient httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        RestTemplate restTemplate = new RestTemplate(new JdkClientHttpRequestFactory(httpClient));
        connector = new HashnodeConnector(restTemplate, new ObjectMapper(), wireMock.baseUrl() + "/graphql",
                "hn-token", "writer", PUBLICATION_ID, 2);
    }

    @Test
    @DisplayName("Should list published posts page by page, then drafts")
    void shouldListPostsAndDrafts() throws Exception {
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withHeader("Authorization", equalTo("hn-token"))
                .withRequestBody(matchingJsonPath("$.query", containing("UserPosts")))
                .withRequestBody(matchingJsonPath("$.variables.page", equalTo("1")))
                .willReturn(okJson("""
                        {"data": {"user": {"posts": {
                          "nodes": [
                            {"id": "p1", "title": "First", "content": {"markdown": "One"},
                             "coverImage": {"url": "https://cdn.example.com/1.png"},
                             "publishedAt": "2024-01-05T12:00:00.000Z", "tags": [{"name": "java"}]},
                            {"id": "p2", "title": "Second", "content": {"markdown": "Two"}, "coverImage": null,
                             "publishedAt": "2024-02-05T12:00:00.000Z", "tags": []}
                          ],
                          "pageInfo": {"hasNextPage": true}
                        }}}}
                        """)));
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("UserPosts")))
                .withRequestBody(matchingJsonPath("$.variables.page", equalTo("2")))
                .willReturn(okJson("""
                        {"data": {"user": {"posts": {
                          "nodes": [{"id": "p3", "title": "Third", "content": {"markdown": "Three"},
                                     "publishedAt": "2024-03-05T12:00:00.000Z", "tags": []}],
                          "pageInfo": {"hasNextPage": false}
                        }}}}
                        """)));
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("PublicationDrafts")))
                .withRequestBody(matchingJsonPath("$.variables.publicationId", equalTo(PUBLICATION_ID)))
                .willReturn(okJson("""
                        {"data": {"publication": {"drafts": {
                          "edges": [{"node": {"id": "d1", "title": "Draft", "content": {"markdown": "WIP"},
                                              "tags": [{"name": "misc"}]}}],
                          "pageInfo": {"hasNextPage": false, "endCursor": null}
                        }}}}
                        """)));

        List<RemoteArticle> articles = connector.listArticles();

        assertThat(articles).extracting(RemoteArticle::id).containsExactly("p1", "p2", "p3", "d1");
        assertThat(articles).extracting(RemoteArticle::published).containsExactly(true, true, true, false);

        RemoteArticle first = articles.get(0);
        assertThat(first.body()).isEqualTo("One");
        assertThat(first.coverUrl()).isEqualTo("https://cdn.example.com/1.png");
        assertThat(first.tags()).containsExactly("java");
        assertThat(first.createdAt()).isEqualTo(Instant.parse("2024-01-05T12:00:00Z"));
        assertThat(articles.get(1).coverUrl()).isNull();
        assertThat(articles.get(3).createdAt()).isNull();
    }

    @Test
    @DisplayName("Should create a draft through the publication's draft mutation")
    void shouldCreateDraft() throws Exception {
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("createDraft")))
                .willReturn(okJson("""
                        {"data": {"createDraft": {"draft": {"id": "d9", "title": "Hello", "content": {"markdown": "Body"}}}}}
                        """)));

        RemoteArticle draft = connector.createArticle(payload(ArticleField.all()), false);

        assertThat(draft.id()).isEqualTo("d9");
        assertThat(draft.published()).isFalse();

        wireMock.verify(postRequestedFor(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.variables.input.publicationId", equalTo(PUBLICATION_ID)))
                .withRequestBody(matchingJsonPath("$.variables.input.tags[0].slug", equalTo("java")))
                .withRequestBody(matchingJsonPath("$.variables.input.originalArticleURL",
                        equalTo("https://blog.example.com/hello"))));
    }

    @Test
    @DisplayName("Should publish directly when the document is not a draft")
    void shouldPublishPost() throws Exception {
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("publishPost")))
                .willReturn(okJson("""
                        {"data": {"publishPost": {"post": {"id": "p9", "title": "Hello",
                          "publishedAt": "2024-06-01T00:00:00Z", "tags": [{"name": "java"}]}}}}
                        """)));

        RemoteArticle published = connector.createArticle(payload(ArticleField.all()), true);

        assertThat(published.id()).isEqualTo("p9");
        assertThat(published.published()).isTrue();
    }

    @Test
    @DisplayName("Should send only the included fields on update")
    void shouldUpdateIncludedFields() throws Exception {
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("updatePost")))
                .willReturn(okJson("""
                        {"data": {"updatePost": {"post": {"id": "p1", "title": "Hello"}}}}
                        """)));

        connector.updateArticle("p1", payload(EnumSet.of(ArticleField.TITLE)), true);

        wireMock.verify(postRequestedFor(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.variables.input.id", equalTo("p1")))
                .withRequestBody(matchingJsonPath("$.variables.input.title", equalTo("Hello")))
                .withRequestBody(notContaining("contentMarkdown")));
    }

    @Test
    @DisplayName("Should update a draft through the draft mutation and keep it a draft")
    void shouldUpdateDraft() throws Exception {
        stubCreatedDraft("d9");
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("updateDraft")))
                .willReturn(okJson("""
                        {"data": {"updateDraft": {"draft": {"id": "d9", "title": "Hello", "content": {"markdown": "Body"}}}}}
                        """)));

        connector.createArticle(payload(ArticleField.all()), false);
        RemoteArticle updated = connector.updateArticle("d9", payload(ArticleField.all()), false);

        assertThat(updated.id()).isEqualTo("d9");
        assertThat(updated.published()).isFalse();
        wireMock.verify(postRequestedFor(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("updateDraft")))
                .withRequestBody(matchingJsonPath("$.variables.input.id", equalTo("d9")))
                .withRequestBody(matchingJsonPath("$.variables.input.contentMarkdown", equalTo("Body"))));
        wireMock.verify(0, postRequestedFor(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("updatePost"))));
        wireMock.verify(0, postRequestedFor(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("publishDraft"))));
    }

    @Test
    @DisplayName("Should publish a draft once the document is no longer a draft")
    void shouldPublishDraft() throws Exception {
        stubCreatedDraft("d9");
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("updateDraft")))
                .willReturn(okJson("""
                        {"data": {"updateDraft": {"draft": {"id": "d9", "title": "Hello"}}}}
                        """)));
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("publishDraft")))
                .withRequestBody(matchingJsonPath("$.variables.input.draftId", equalTo("d9")))
                .willReturn(okJson("""
                        {"data": {"publishDraft": {"post": {"id": "p10", "title": "Hello",
                          "publishedAt": "2024-06-02T00:00:00Z"}}}}
                        """)));
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("updatePost")))
                .willReturn(okJson("""
                        {"data": {"updatePost": {"post": {"id": "p10", "title": "Hello"}}}}
                        """)));

        connector.createArticle(payload(ArticleField.all()), false);
        RemoteArticle published = connector.updateArticle("d9", payload(ArticleField.all()), true);

        assertThat(published.id()).isEqualTo("p10");
        assertThat(published.published()).isTrue();

        // The draft id is gone once published, later updates address the post
        connector.updateArticle("p10", payload(EnumSet.of(ArticleField.TITLE)), true);
        wireMock.verify(1, postRequestedFor(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("updatePost")))
                .withRequestBody(matchingJsonPath("$.variables.input.id", equalTo("p10"))));
    }

    @Test
    @DisplayName("Should read and remove listed drafts through the draft API")
    void shouldReadAndRemoveListedDraft() throws Exception {
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("UserPosts")))
                .willReturn(okJson("""
                        {"data": {"user": {"posts": {"nodes": [], "pageInfo": {"hasNextPage": false}}}}}
                        """)));
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("PublicationDrafts")))
                .willReturn(okJson("""
                        {"data": {"publication": {"drafts": {
                          "edges": [{"node": {"id": "d1", "title": "Draft", "content": {"markdown": "WIP"}}}],
                          "pageInfo": {"hasNextPage": false, "endCursor": null}
                        }}}}
                        """)));
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("draft(id:")))
                .willReturn(okJson("""
                        {"data": {"draft": {"id": "d1", "title": "Draft", "content": {"markdown": "WIP"}}}}
                        """)));
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("removeDraft")))
                .withRequestBody(matchingJsonPath("$.variables.input.id", equalTo("d1")))
                .willReturn(okJson("""
                        {"data": {"removeDraft": {"draft": {"id": "d1"}}}}
                        """)));

        connector.listArticles();

        assertThat(connector.getArticle("d1"))
                .hasValueSatisfying(draft -> {
                    assertThat(draft.body()).isEqualTo("WIP");
                    assertThat(draft.published()).isFalse();
                });

        connector.deleteArticle("d1");

        wireMock.verify(0, postRequestedFor(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("removePost"))));
        wireMock.verify(1, postRequestedFor(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("removeDraft"))));
    }

    @Test
    @DisplayName("Should map GraphQL errors to error categories")
    void shouldTranslateGraphQlErrors() {
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("removePost")))
                .willReturn(okJson("""
                        {"errors": [{"message": "User does not have the minimum required role",
                                     "extensions": {"code": "FORBIDDEN"}}], "data": null}
                        """)));
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("UserPosts")))
                .willReturn(okJson("""
                        {"errors": [{"message": "Invalid token", "extensions": {"code": "UNAUTHENTICATED"}}]}
                        """)));

        ConnectorException denied = catchThrowableOfType(() -> connector.deleteArticle("p1"), ConnectorException.class);
        assertThat(denied.getCategory()).isEqualTo(ErrorCategory.PERMISSION_DENIED);

        ConnectorException auth = catchThrowableOfType(() -> connector.listArticles(), ConnectorException.class);
        assertThat(auth.getCategory()).isEqualTo(ErrorCategory.AUTH);
        assertThat(auth.getMessage()).contains("Invalid token");
    }

    @Test
    @DisplayName("Should report rate limiting signalled over HTTP")
    void shouldTranslateHttpRateLimit() {
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "30")));

        ConnectorException thrown = catchThrowableOfType(() -> connector.getArticle("p1"), ConnectorException.class);

        assertThat(thrown.getCategory()).isEqualTo(ErrorCategory.RATE_LIMITED);
        assertThat(thrown.getRetryAfter()).hasValueSatisfying(delay -> assertThat(delay.getSeconds()).isEqualTo(30));
    }

    @Test
    @DisplayName("Should return nothing for an unknown post")
    void shouldReturnEmptyForMissingPost() throws Exception {
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .willReturn(okJson("{\"data\": {\"post\": null}}")));

        assertThat(connector.getArticle("nope")).isEmpty();
    }

    @Test
    @DisplayName("Should fail a removal the service did not confirm")
    void shouldRejectUnconfirmedRemoval() {
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .willReturn(okJson("{\"data\": {\"removePost\": null}}")));

        ConnectorException thrown = catchThrowableOfType(() -> connector.deleteArticle("p1"), ConnectorException.class);

        assertThat(thrown.getCategory()).isEqualTo(ErrorCategory.UNKNOWN);
    }

    private static void stubCreatedDraft(String id) {
        wireMock.stubFor(post(urlEqualTo("/graphql"))
                .withRequestBody(matchingJsonPath("$.query", containing("createDraft")))
                .willReturn(okJson("""
                        {"data": {"createDraft": {"draft": {"id": "%s", "title": "Hello", "content": {"markdown": "Body"}}}}}
                        """.formatted(id))));
    }

    private static ArticlePayload payload(Set<ArticleField> fields) {
        return new ArticlePayload("Hello", null, "Body", List.of("java"), null,
                "https://blog.example.com/hello", null, null, fields);
    }
}
