package io.crosspost.publisher.content;

import io.crosspost.publisher.api.dto.ArticleField;
import io.crosspost.publisher.api.dto.ArticlePayload;
import io.crosspost.publisher.api.dto.LocalDocument;
import io.crosspost.publisher.api.dto.ServiceKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class MarkdownContentTransformer implements ContentTransformer {

    static final String TOC_START = "<!-- toc -->";
    static final String TOC_END = "<!-- /toc -->";

    private static final String HASHNODE_CDN = "https://cdn.hashnode.com/";

    private static final int DEVTO_MAX_TAGS = 4;
    private static final int HASHNODE_MAX_TAGS = 5;

    private static final Pattern FRONT_MATTER = Pattern.compile("\\A\\uFEFF?---\\R(?:.*?\\R)?---[ \\t]*(?:\\R|\\z)", Pattern.DOTALL);
    private static final Pattern TOC_BLOCK = Pattern.compile(
            Pattern.quote(TOC_START) + ".*?" + Pattern.quote(TOC_END), Pattern.DOTALL);
    private static final Pattern ALIGN_ATTRIBUTE = Pattern.compile("\\s*align=\"[^\"]*\"");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*#*\\s*$");

    @Override
    public ArticlePayload toPayload(LocalDocument document, ServiceKind service) {
        String body = document.body() == null ? "" : document.body();

        if (document.tableOfContents()) {
            String toc = tableOfContents(body);
            if (!toc.isEmpty()) {
                body = toc + "\n\n" + body;
            }
        }

        if (service == ServiceKind.HASHNODE) {
            // Hashnode rejects HTML alignment attributes
            body = ALIGN_ATTRIBUTE.matcher(body).replaceAll("");
        }

        return new ArticlePayload(
                document.title(),
                document.subtitle(),
                body,
                formatTags(document.tags(), service),
                document.coverUrl(),
                document.canonicalUrl(),
                document.seriesName(),
                document.slug(),
                ArticleField.all()
        );
    }

    @Override
    public String normalizeForComparison(String body) {
        if (body == null) return "";

        String normalized = FRONT_MATTER.matcher(body).replaceFirst("");
        normalized = TOC_BLOCK.matcher(normalized).replaceAll("");
        normalized = ALIGN_ATTRIBUTE.matcher(normalized).replaceAll("");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");

        return normalized.trim();
    }

    @Override
    public boolean hasTableOfContents(String body) {
        return body != null && TOC_BLOCK.matcher(body).find();
    }

    @Override
    public boolean sameCover(String localUrl, String remoteUrl, ServiceKind service) {
        String local = blankToNull(localUrl);
        String remote = blankToNull(remoteUrl);

        if (local == null || remote == null) return local == remote;
        if (local.equals(remote)) return true;

        // Hashnode copies external covers to its CDN and drops the source URL
        return service == ServiceKind.HASHNODE && remote.startsWith(HASHNODE_CDN);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public List<String> formatTags(Collection<String> tags, ServiceKind service) {
        if (tags == null || tags.isEmpty()) return List.of();

        Set<String> formatted = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag == null) continue;

            Arrays.stream(tag.split(","))
                    .map(part -> service == ServiceKind.HASHNODE ? hashnodeTag(part) : devToTag(part))
                    .filter(part -> !part.isEmpty())
                    .forEach(formatted::add);
        }

        int limit = service == ServiceKind.HASHNODE ? HASHNODE_MAX_TAGS : DEVTO_MAX_TAGS;
        return formatted.stream()
                .limit(limit)
                .toList();
    }

    private String hashnodeTag(String tag) {
        return tag.toLowerCase(Locale.ROOT).trim()
                .replaceAll("[^a-z0-9\\s-]", "")
                .replaceAll("\\s+", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");
    }

    private String devToTag(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * GitHub-style table of contents of the body's headings, wrapped in marker comments.
     * Headings inside fenced code blocks are ignored. Empty when the body has no headings.
     */
    String tableOfContents(String body) {
        List<String> entries = new ArrayList<>();
        boolean inFence = false;

        for (String line : body.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("```") || trimmed.startsWith("~~~")) {
                inFence = !inFence;
                continue;
            }
            if (inFence) continue;

            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                int level = heading.group(1).length();
                String title = heading.group(2);
                entries.add("  ".repeat(level - 1) + "- [" + title + "](#" + anchor(title) + ")");
            }
        }

        if (entries.isEmpty()) return "";

        return TOC_START + "\n## Table of Contents\n\n" + String.join("\n", entries) + "\n" + TOC_END;
    }

    private String anchor(String title) {
        return title.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\w\\s-]", "")
                .trim()
                .replaceAll("[-\\s]+", "-");
    }
}
