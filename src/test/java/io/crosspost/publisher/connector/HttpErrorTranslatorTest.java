package io.crosspost.publisher.connector;

import io.crosspost.publisher.api.dto.ServiceKind;
import io.crosspost.publisher.api.exception.ConnectorException;
import io.crosspost.publisher.api.exception.ErrorCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpErrorTranslatorTest {

    @Test
    @DisplayName("Should treat 403 as a permission problem only for deletions")
    void shouldMapForbiddenByOperation() {
        assertThat(category(403, ConnectorOperation.DELETE)).isEqualTo(ErrorCategory.PERMISSION_DENIED);
        assertThat(category(403, ConnectorOperation.UPDATE)).isEqualTo(ErrorCategory.AUTH);
        assertThat(category(401, ConnectorOperation.DELETE)).isEqualTo(ErrorCategory.AUTH);
    }

    @Test
    @DisplayName("Should classify server and client errors")
    void shouldMapStatuses() {
        assertThat(category(404, ConnectorOperation.GET)).isEqualTo(ErrorCategory.NOT_FOUND);
        assertThat(category(429, ConnectorOperation.CREATE)).isEqualTo(ErrorCategory.RATE_LIMITED);
        assertThat(category(502, ConnectorOperation.LIST)).isEqualTo(ErrorCategory.TRANSIENT_NETWORK);
        assertThat(category(400, ConnectorOperation.CREATE)).isEqualTo(ErrorCategory.UNKNOWN);
    }

    @Test
    @DisplayName("Should keep Retry-After only for rate limiting")
    void shouldKeepRetryAfterForRateLimit() {
        ConnectorException limited = HttpErrorTranslator.forStatus(429, "limited", Duration.ofSeconds(3), null,
                ConnectorOperation.CREATE);
        ConnectorException unavailable = HttpErrorTranslator.forStatus(503, "down", Duration.ofSeconds(3), null,
                ConnectorOperation.CREATE);

        assertThat(limited.getRetryAfter()).contains(Duration.ofSeconds(3));
        assertThat(unavailable.getRetryAfter()).isEmpty();
    }

    @Test
    @DisplayName("Should parse Retry-After seconds and ignore dates")
    void shouldParseRetryAfter() {
        HttpHeaders seconds = new HttpHeaders();
        seconds.set(HttpHeaders.RETRY_AFTER, "120");
        HttpHeaders date = new HttpHeaders();
        date.set(HttpHeaders.RETRY_AFTER, "Wed, 21 Oct 2015 07:28:00 GMT");

        assertThat(HttpErrorTranslator.retryAfter(seconds)).isEqualTo(Duration.ofMinutes(2));
        assertThat(HttpErrorTranslator.retryAfter(date)).isNull();
        assertThat(HttpErrorTranslator.retryAfter(new HttpHeaders())).isNull();
    }

    @Test
    @DisplayName("Should treat connection failures as transient")
    void shouldMapNetworkErrors() {
        ConnectorException translated = HttpErrorTranslator.translate(
                new ResourceAccessException("I/O error", new IOException("Connection refused")),
                ServiceKind.DEVTO, ConnectorOperation.LIST);

        assertThat(translated.getCategory()).isEqualTo(ErrorCategory.TRANSIENT_NETWORK);
        assertThat(translated.getMessage()).contains("devto");
    }

    @Test
    @DisplayName("Should shorten long response bodies")
    void shouldAbbreviateBodies() {
        assertThat(HttpErrorTranslator.abbreviate("x".repeat(500))).hasSize(203).endsWith("...");
        assertThat(HttpErrorTranslator.abbreviate("  ")).isEqualTo("<empty body>");
    }

    private static ErrorCategory category(int status, ConnectorOperation operation) {
        return HttpErrorTranslator.forStatus(status, "status " + status, null, null, operation).getCategory();
    }
}
