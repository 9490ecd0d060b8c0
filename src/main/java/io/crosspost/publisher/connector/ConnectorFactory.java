package io.crosspost.publisher.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crosspost.publisher.api.dto.ServiceKind;
import io.crosspost.publisher.api.exception.PublisherConfigurationException;
import io.crosspost.publisher.config.PublisherConfig;
import io.crosspost.publisher.config.ServiceSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the connectors of every enabled service, validating credentials up front so that
 * misconfiguration fails before the first remote call.
 */
public class ConnectorFactory {

    private static final Logger logger = LoggerFactory.getLogger(ConnectorFactory.class);

    private static final Pattern OBJECT_ID = Pattern.compile("^[0-9a-fA-F]{24}$");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public ConnectorFactory(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    public ServiceRegistry createRegistry(PublisherConfig config) {
        // Fails on names that match no service
        config.getEnabledPlatforms().forEach(ServiceKind::fromName);

        List<ConfiguredService> services = new ArrayList<>();
        Set<ServiceKind> seen = EnumSet.noneOf(ServiceKind.class);

        for (ServiceSettings settings : config.getEnabledServices()) {
            ServiceConnector connector = create(settings);

            if (!seen.add(connector.kind())) {
                throw new PublisherConfigurationException(
                        "Service '" + connector.kind() + "' is enabled more than once in publisher.services");
            }

            services.add(new ConfiguredService(connector, settings));
            logger.info("{} connector initialized", connector.kind());
        }

        return new ServiceRegistry(services);
    }

    public ServiceConnector create(ServiceSettings settings) {
        ServiceKind kind = ServiceKind.fromName(settings.name());

        return switch (kind) {
            case DEVTO -> {
                require(settings.apiKey(), kind, "api-key (DEVTO_API_KEY)",
                        "Get your API key from https://dev.to/settings/extensions");
                yield new DevToConnector(restTemplate, objectMapper, settings.apiUrl(), settings.apiKey());
            }
            case HASHNODE -> {
                String guidance = "Get your API key from https://hashnode.com/settings/developer " +
                        "and the publication id from https://hashnode.com/settings/blogs";
                require(settings.apiKey(), kind, "api-key (HASHNODE_API_KEY)", guidance);
                require(settings.username(), kind, "username (HASHNODE_USERNAME)", guidance);
                require(settings.publicationId(), kind, "publication-id (HASHNODE_PUBLICATION_ID)", guidance);

                if (!OBJECT_ID.matcher(settings.publicationId()).matches()) {
                    throw new PublisherConfigurationException(
                            "Hashnode publication-id must be 24 hex characters, got '" + settings.publicationId() + "'. " + guidance);
                }

                yield new HashnodeConnector(restTemplate, objectMapper, settings.apiUrl(),
                        settings.apiKey(), settings.username(), settings.publicationId());
            }
        };
    }

    private static void require(String value, ServiceKind kind, String property, String guidance) {
        if (value == null || value.isBlank()) {
            throw new PublisherConfigurationException(
                    "Missing " + property + " for enabled service '" + kind + "'. " + guidance);
        }
    }
}
