package io.crosspost.publisher.api.service;

import io.crosspost.publisher.api.dto.DocumentSummary;
import io.crosspost.publisher.api.dto.Outcome;
import io.crosspost.publisher.api.dto.PublicationResult;
import io.crosspost.publisher.api.dto.ServiceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class RunReportPrinter {
    private static final Logger logger = LoggerFactory.getLogger(RunReportPrinter.class);

    public void print(ResultAggregator aggregator) {
        List<DocumentSummary> summaries = aggregator.summarize();

        logger.info("Publishing report ({} documents)", summaries.size());

        for (DocumentSummary summary : summaries) {
            String outcomes = summary.results().entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + describe(entry.getValue()))
                    .collect(Collectors.joining(", "));
            logger.info("  {}: {}", summary.documentTitle(), outcomes);

            summary.results().forEach((service, results) -> results.stream()
                    .filter(result -> result.outcome() == Outcome.FAILED || result.outcome() == Outcome.WARNING)
                    .forEach(result -> logProblem(service, result)));
        }

        Map<Outcome, Integer> counts = aggregator.countsByOutcome();
        logger.info("Totals: {} created, {} updated, {} skipped, {} deleted, {} warnings, {} failed",
                counts.get(Outcome.CREATED), counts.get(Outcome.UPDATED), counts.get(Outcome.SKIPPED),
                counts.get(Outcome.DELETED), counts.get(Outcome.WARNING), counts.get(Outcome.FAILED));
    }

    private static String describe(List<PublicationResult> results) {
        return results.stream()
                .map(result -> result.outcome().name())
                .collect(Collectors.joining("/"));
    }

    private static void logProblem(ServiceKind service, PublicationResult result) {
        if (result.outcome() == Outcome.FAILED) {
            logger.error("    {} failed ({}): {}", service, result.errorCategory(), result.errorMessage());
        } else {
            logger.warn("    {} warning ({}): {}", service, result.errorCategory(), result.errorMessage());
        }
    }
}
