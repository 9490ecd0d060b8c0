package io.crosspost.publisher.content;

import java.util.Map;

public record FrontMatter(
        Map<String, Object> metadata,
        String body
) {}
