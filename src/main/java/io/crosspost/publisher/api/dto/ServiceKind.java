package io.crosspost.publisher.api.dto;

import io.crosspost.publisher.api.exception.PublisherConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum ServiceKind {
    DEVTO("devto"),
    HASHNODE("hashnode");

    private final String configName;

    ServiceKind(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static ServiceKind fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(kind -> kind.configName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new PublisherConfigurationException(
                        "Unknown publishing service '" + name + "', expected one of: " +
                                Arrays.stream(values()).map(ServiceKind::configName).collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() {
        return configName;
    }
}
