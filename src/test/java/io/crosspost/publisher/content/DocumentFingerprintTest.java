package io.crosspost.publisher.content;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentFingerprintTest {

    @Test
    @DisplayName("Should not depend on tag order")
    void shouldIgnoreTagOrder() {
        assertThat(DocumentFingerprint.of("body", List.of("java", "spring"), "Title", false, null))
                .isEqualTo(DocumentFingerprint.of("body", List.of("spring", "java"), "Title", false, null));
    }

    @Test
    @DisplayName("Should change when any compared field changes")
    void shouldChangeWithContent() {
        String base = DocumentFingerprint.of("body", List.of("java"), "Title", false, null);

        assertThat(DocumentFingerprint.of("body!", List.of("java"), "Title", false, null)).isNotEqualTo(base);
        assertThat(DocumentFingerprint.of("body", List.of("java"), "Title 2", false, null)).isNotEqualTo(base);
        assertThat(DocumentFingerprint.of("body", List.of("java"), "Title", true, null)).isNotEqualTo(base);
        assertThat(DocumentFingerprint.of("body", List.of("java"), "Title", false, "https://img")).isNotEqualTo(base);
        assertThat(base).hasSize(64);
    }
}
