package io.crosspost.publisher.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crosspost.publisher.api.dto.ServiceKind;
import io.crosspost.publisher.api.exception.PublisherConfigurationException;
import io.crosspost.publisher.config.PublisherConfig;
import io.crosspost.publisher.config.ServiceSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectorFactoryTest {

    private static final String PUBLICATION_ID = "0123456789abcdef01234567";

    private final ConnectorFactory factory = new ConnectorFactory(new RestTemplate(), new ObjectMapper());

    @Test
    @DisplayName("Should build enabled services in configured order")
    void shouldCreateRegistryInOrder() {
        ServiceRegistry registry = factory.createRegistry(config(
                hashnode("token", "writer", PUBLICATION_ID),
                new ServiceSettings("devto", false, null, null, null, null, null),
                devTo("key")));

        assertThat(registry.kinds()).containsExactly(ServiceKind.HASHNODE, ServiceKind.DEVTO);
        assertThat(registry.enabledServices().get(0).settings().publicationId()).isEqualTo(PUBLICATION_ID);
    }

    @Test
    @DisplayName("Should let the platform list override the enabled flags")
    void shouldApplyPlatformList() {
        PublisherConfig config = new PublisherConfig(List.of(
                devTo("key"),
                new ServiceSettings("hashnode", false, null, null, "token", "writer", PUBLICATION_ID)),
                List.of(" Hashnode "), null, null, null, null);

        assertThat(factory.createRegistry(config).kinds()).containsExactly(ServiceKind.HASHNODE);
    }

    @Test
    @DisplayName("Should reject an unknown name in the platform list")
    void shouldRejectUnknownPlatform() {
        PublisherConfig config = new PublisherConfig(List.of(devTo("key")), List.of("devto", "medium"),
                null, null, null, null);

        assertThatThrownBy(() -> factory.createRegistry(config))
                .isInstanceOf(PublisherConfigurationException.class)
                .hasMessageContaining("medium");
    }

    @Test
    @DisplayName("Should allow every service to be disabled")
    void shouldAllowEmptyRegistry() {
        ServiceRegistry registry = factory.createRegistry(config(
                new ServiceSettings("devto", false, null, null, null, null, null)));

        assertThat(registry.enabledServices()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an enabled service without credentials")
    void shouldRequireApiKey() {
        assertThatThrownBy(() -> factory.createRegistry(config(devTo(" "))))
                .isInstanceOf(PublisherConfigurationException.class)
                .hasMessageContaining("DEVTO_API_KEY");

        assertThatThrownBy(() -> factory.createRegistry(config(hashnode("token", null, PUBLICATION_ID))))
                .isInstanceOf(PublisherConfigurationException.class)
                .hasMessageContaining("HASHNODE_USERNAME");
    }

    @Test
    @DisplayName("Should reject a malformed Hashnode publication id")
    void shouldValidatePublicationId() {
        assertThatThrownBy(() -> factory.createRegistry(config(hashnode("token", "writer", "my-blog"))))
                .isInstanceOf(PublisherConfigurationException.class)
                .hasMessageContaining("24 hex characters");
    }

    @Test
    @DisplayName("Should reject unknown and duplicated services")
    void shouldRejectInvalidServiceList() {
        assertThatThrownBy(() -> factory.createRegistry(config(
                new ServiceSettings("medium", true, null, null, "key", null, null))))
                .isInstanceOf(PublisherConfigurationException.class)
                .hasMessageContaining("medium");

        assertThatThrownBy(() -> factory.createRegistry(config(devTo("a"), devTo("b"))))
                .isInstanceOf(PublisherConfigurationException.class)
                .hasMessageContaining("more than once");
    }

    private static PublisherConfig config(ServiceSettings... services) {
        return new PublisherConfig(List.of(services), List.of(), null, null, null, null);
    }

    private static ServiceSettings devTo(String apiKey) {
        return new ServiceSettings("devto", true, Duration.ofSeconds(1), null, apiKey, null, null);
    }

    private static ServiceSettings hashnode(String apiKey, String username, String publicationId) {
        return new ServiceSettings("hashnode", true, Duration.ofSeconds(1), null, apiKey, username, publicationId);
    }
}
