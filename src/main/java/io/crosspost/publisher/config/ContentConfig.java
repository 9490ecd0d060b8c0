package io.crosspost.publisher.config;

import java.time.Duration;
import java.util.List;

public record ContentConfig(
        String directory,
        String pattern,
        List<String> excludeFiles,
        Duration documentDelay
) {
    public long getDocumentDelayMs() {
        return documentDelay == null ? 0L : documentDelay.toMillis();
    }
}
