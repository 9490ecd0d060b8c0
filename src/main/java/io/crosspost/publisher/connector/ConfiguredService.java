package io.crosspost.publisher.connector;

import io.crosspost.publisher.api.dto.ServiceKind;
import io.crosspost.publisher.config.ServiceSettings;

public record ConfiguredService(
        ServiceConnector connector,
        ServiceSettings settings
) {
    public ServiceKind kind() {
        return connector.kind();
    }
}
