package io.crosspost.publisher.api.service;

import io.crosspost.publisher.api.dto.DocumentSummary;
import io.crosspost.publisher.api.dto.Outcome;
import io.crosspost.publisher.api.dto.PublicationResult;
import io.crosspost.publisher.api.dto.ServiceKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the results of one run in the order they were recorded.
 */
public class ResultAggregator {

    private final Map<ResultKey, List<PublicationResult>> results = new LinkedHashMap<>();

    public void record(PublicationResult result) {
        results.computeIfAbsent(new ResultKey(result.documentTitle(), result.service()), key -> new ArrayList<>())
                .add(result);
    }

    public List<PublicationResult> results() {
        return results.values().stream()
                .flatMap(List::stream)
                .toList();
    }

    public List<PublicationResult> resultsFor(String documentTitle, ServiceKind service) {
        return List.copyOf(results.getOrDefault(new ResultKey(documentTitle, service), List.of()));
    }

    /**
     * One summary per document title, services in the order their results arrived.
     */
    public List<DocumentSummary> summarize() {
        Map<String, Map<ServiceKind, List<PublicationResult>>> byDocument = new LinkedHashMap<>();

        results.forEach((key, list) -> byDocument
                .computeIfAbsent(key.documentTitle(), title -> new LinkedHashMap<>())
                .put(key.service(), List.copyOf(list)));

        return byDocument.entrySet().stream()
                .map(entry -> new DocumentSummary(entry.getKey(), entry.getValue()))
                .toList();
    }

    public Map<Outcome, Integer> countsByOutcome() {
        Map<Outcome, Integer> counts = new EnumMap<>(Outcome.class);
        for (Outcome outcome : Outcome.values()) {
            counts.put(outcome, 0);
        }
        results().forEach(result -> counts.merge(result.outcome(), 1, Integer::sum));
        return counts;
    }

    public boolean hasFailures() {
        return results().stream().anyMatch(result -> !result.success());
    }

    private record ResultKey(String documentTitle, ServiceKind service) {}
}
