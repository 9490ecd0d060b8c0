package io.crosspost.publisher.content;

import io.crosspost.publisher.api.dto.LocalDocument;
import io.crosspost.publisher.api.exception.DocumentParseException;
import io.crosspost.publisher.config.ContentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads every Markdown file of the configured directory into a {@link LocalDocument}.
 */
@Component
public class MarkdownDirectoryScanner implements DocumentScanner {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownDirectoryScanner.class);

    private final ContentConfig contentConfig;
    private final FrontMatterParser frontMatterParser;
    private final ContentTransformer contentTransformer;

    public MarkdownDirectoryScanner(ContentConfig contentConfig,
                                    FrontMatterParser frontMatterParser,
                                    ContentTransformer contentTransformer) {
        this.contentConfig = contentConfig;
        this.frontMatterParser = frontMatterParser;
        this.contentTransformer = contentTransformer;
    }

    @Override
    public List<LocalDocument> scan() {
        Path directory = Path.of(contentConfig.directory());

        if (!Files.isDirectory(directory)) {
            logger.warn("Content directory {} does not exist", directory.toAbsolutePath());
            return List.of();
        }

        Map<String, LocalDocument> documentsByTitle = new LinkedHashMap<>();

        for (Path file : listMarkdownFiles(directory)) {
            readDocument(file).ifPresent(document -> {
                LocalDocument existing = documentsByTitle.putIfAbsent(document.title(), document);
                if (existing != null) {
                    logger.warn("Duplicate title '{}' in {} ignored, already defined by {}",
                            document.title(), file, existing.path());
                }
            });
        }

        logger.info("Found {} documents in {}", documentsByTitle.size(), directory);
        return List.copyOf(documentsByTitle.values());
    }

    private List<Path> listMarkdownFiles(Path directory) {
        PathMatcher matcher = directory.getFileSystem().getPathMatcher("glob:" + contentConfig.pattern());
        List<String> excluded = contentConfig.excludeFiles() == null ? List.of() : contentConfig.excludeFiles();

        try (Stream<Path> paths = Files.list(directory)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> matcher.matches(path.getFileName()))
                    .filter(path -> !excluded.contains(path.getFileName().toString()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list content directory " + directory, e);
        }
    }

    Optional<LocalDocument> readDocument(Path file) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            FrontMatter frontMatter = frontMatterParser.parse(text);
            Map<String, Object> metadata = frontMatter.metadata();

            String title = string(metadata, "title");
            if (title == null || title.isBlank()) {
                logger.error("Missing required 'title' field in {}, skipping", file);
                return Optional.empty();
            }

            String slug = string(metadata, "slug");
            String domain = string(metadata, "domain");
            String canonicalUrl = string(metadata, "canonicalUrl");
            if (canonicalUrl == null && domain != null && !domain.isBlank()) {
                canonicalUrl = "https://" + domain + "/" + (slug == null ? "" : slug);
            }

            Set<String> tags = tags(metadata.get("tags"));
            boolean draft = bool(metadata.get("saveAsDraft"), false);
            String cover = string(metadata, "cover");
            String body = frontMatter.body();

            String fingerprint = DocumentFingerprint.of(
                    contentTransformer.normalizeForComparison(body), tags, title, draft, cover);

            LocalDocument document = new LocalDocument(
                    file,
                    title,
                    string(metadata, "subtitle"),
                    slug,
                    tags,
                    draft,
                    bool(metadata.get("enableToc"), true),
                    cover,
                    canonicalUrl,
                    string(metadata, "seriesName"),
                    body,
                    fingerprint
            );

            logger.debug("Parsed {}: title='{}', tags={}, draft={}", file, title, tags, draft);
            return Optional.of(document);

        } catch (IOException e) {
            logger.error("Cannot read {}: {}", file, e.getMessage());
            return Optional.empty();

        } catch (DocumentParseException e) {
            logger.error("Cannot parse {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static String string(Map<String, Object> metadata, String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString().trim();
    }

    private static boolean bool(Object value, boolean defaultValue) {
        if (value == null) return defaultValue;
        if (value instanceof Boolean flag) return flag;
        return Boolean.parseBoolean(value.toString().trim());
    }

    private static Set<String> tags(Object value) {
        Set<String> tags = new LinkedHashSet<>();

        if (value instanceof Collection<?> list) {
            list.stream()
                    .filter(Objects::nonNull)
                    .forEach(tag -> splitInto(tag.toString(), tags));
        } else if (value != null) {
            splitInto(value.toString(), tags);
        }

        return tags;
    }

    private static void splitInto(String raw, Set<String> tags) {
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .forEach(tags::add);
    }
}
