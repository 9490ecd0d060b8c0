package io.crosspost.publisher.connector;

import io.crosspost.publisher.api.dto.ServiceKind;

import java.util.List;

/**
 * Enabled services in configured order.
 */
public class ServiceRegistry {

    private final List<ConfiguredService> services;

    public ServiceRegistry(List<ConfiguredService> services) {
        this.services = List.copyOf(services);
    }

    public List<ConfiguredService> enabledServices() {
        return services;
    }

    public List<ServiceKind> kinds() {
        return services.stream()
                .map(ConfiguredService::kind)
                .toList();
    }
}
