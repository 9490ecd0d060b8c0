package io.crosspost.publisher.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.crosspost.publisher.api.exception.DocumentParseException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a Markdown file into its YAML header block (between two {@code ---} lines) and body.
 */
@Component
public class FrontMatterParser {

    private static final Pattern FRONT_MATTER = Pattern.compile("\\A\\uFEFF?---\\R(?:(.*?)\\R)?---[ \\t]*(?:\\R|\\z)", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public FrontMatter parse(String text) throws DocumentParseException {
        if (text == null) return new FrontMatter(Map.of(), "");

        Matcher matcher = FRONT_MATTER.matcher(text);
        if (!matcher.find()) {
            return new FrontMatter(Map.of(), text);
        }

        String block = matcher.group(1);
        String body = text.substring(matcher.end());

        if (block == null || block.isBlank()) {
            return new FrontMatter(Map.of(), body);
        }

        try {
            Map<String, Object> metadata = yamlMapper.readValue(block, METADATA_TYPE);
            return new FrontMatter(metadata == null ? Map.of() : new LinkedHashMap<>(metadata), body);
        } catch (JsonProcessingException e) {
            throw new DocumentParseException("Invalid front matter: " + e.getOriginalMessage(), e);
        }
    }
}
