package io.crosspost.publisher.content;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

public final class DocumentFingerprint {

    private static final char SEPARATOR = '\u001F';

    private DocumentFingerprint() {
    }

    /**
     * @param normalizedBody body already passed through {@link ContentTransformer#normalizeForComparison}
     */
    public static String of(String normalizedBody, Collection<String> tags, String title, boolean draft, String coverUrl) {
        StringBuilder material = new StringBuilder()
                .append(title == null ? "" : title).append(SEPARATOR)
                .append(draft).append(SEPARATOR)
                .append(coverUrl == null ? "" : coverUrl.trim()).append(SEPARATOR)
                .append(String.join(",", new TreeSet<>(tags == null ? List.of() : tags))).append(SEPARATOR)
                .append(normalizedBody == null ? "" : normalizedBody);

        return DigestUtils.sha256Hex(material.toString());
    }
}
