package io.crosspost.publisher.config;

public record HttpConfig(
        int connectTimeout,
        int readTimeout,
        String userAgent
) {}
