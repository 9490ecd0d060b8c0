package io.crosspost.publisher.api.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DocumentSummary(
        String documentTitle,
        Map<ServiceKind, List<PublicationResult>> results
) {
    public DocumentSummary {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public List<ServiceKind> servicesWith(Outcome outcome) {
        return results.entrySet().stream()
                .filter(entry -> entry.getValue().stream().anyMatch(result -> result.outcome() == outcome))
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean hasFailures() {
        return !servicesWith(Outcome.FAILED).isEmpty();
    }
}
