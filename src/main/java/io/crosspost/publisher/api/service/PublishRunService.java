package io.crosspost.publisher.api.service;

import io.crosspost.publisher.api.dto.LocalDocument;
import io.crosspost.publisher.content.DocumentScanner;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One publishing run per application start. Exit code 1 when any document or deletion failed.
 */
@Service
public class PublishRunService implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger logger = LoggerFactory.getLogger(PublishRunService.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 120;

    private final DocumentScanner documentScanner;
    private final ReconciliationEngine reconciliationEngine;
    private final RunReportPrinter reportPrinter;

    private final CancellationToken cancellation = new CancellationToken();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean running;
    private volatile int exitCode;

    public PublishRunService(DocumentScanner documentScanner,
                             ReconciliationEngine reconciliationEngine,
                             RunReportPrinter reportPrinter) {
        this.documentScanner = documentScanner;
        this.reconciliationEngine = reconciliationEngine;
        this.reportPrinter = reportPrinter;
    }

    @Override
    public void run(String... args) {
        running = true;
        try {
            List<LocalDocument> documents = documentScanner.scan();

            if (documents.isEmpty()) {
                // An empty scan would turn every remote article into an orphan
                logger.warn("No documents found, nothing is published or deleted");
                return;
            }

            ResultAggregator results = reconciliationEngine.reconcile(documents, cancellation);
            reportPrinter.print(results);

            exitCode = results.hasFailures() ? 1 : 0;

        } finally {
            running = false;
            finished.countDown();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CancellationToken cancellation() {
        return cancellation;
    }

    /**
     * Lets the document in flight finish before the context goes away.
     */
    @PreDestroy
    public void stop() {
        if (!running) return;

        logger.info("Shutdown requested, finishing the current document");
        cancellation.requestStop();

        try {
            if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Run did not finish within {}s of the shutdown request", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the run to finish");
        }
    }
}
