package io.crosspost.publisher.config;

/**
 * @param orphanSweep          delete remote articles whose local document is gone
 * @param skipPermissionErrors report a permission error on delete as a warning instead of a failure
 */
public record DeletionConfig(
        boolean orphanSweep,
        boolean skipPermissionErrors
) {}
