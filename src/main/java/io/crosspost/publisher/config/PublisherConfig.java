package io.crosspost.publisher.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * @param enabledPlatforms when not empty, only these services run, whatever their {@code enabled} flag says
 */
@ConfigurationProperties(prefix = "publisher")
public record PublisherConfig(
        List<ServiceSettings> services,
        List<String> enabledPlatforms,
        RetryConfig retry,
        HttpConfig http,
        ContentConfig content,
        DeletionConfig deletion
) {

    /**
     * Enabled services in configured order. This order is the per-document processing order.
     */
    public List<ServiceSettings> getEnabledServices() {
        if (services == null) return List.of();

        List<String> platforms = getEnabledPlatforms();

        return services.stream()
                .filter(service -> platforms.isEmpty()
                        ? service.enabled()
                        : service.name() != null && platforms.contains(service.name().trim().toLowerCase()))
                .toList();
    }

    public List<String> getEnabledPlatforms() {
        if (enabledPlatforms == null) return List.of();

        return enabledPlatforms.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.trim().toLowerCase())
                .toList();
    }
}
