package io.crosspost.publisher.api.dto;

public enum Outcome {
    CREATED,
    UPDATED,
    SKIPPED,
    DELETED,
    WARNING,    // Non-fatal, e.g. an orphan we are not allowed to delete
    FAILED
}
