package org.example.kbsync.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashesTest {

    @Test
    void lineEndingsAndSurroundingWhitespaceDoNotChangeTheHash() {
        assertThat(ContentHashes.sha256("line one\r\nline two\n"))
                .isEqualTo(ContentHashes.sha256("  line one\nline two"));
    }

    @Test
    void differentContentHasDifferentHash() {
        assertThat(ContentHashes.sha256("a")).isNotEqualTo(ContentHashes.sha256("b"));
    }

    @Test
    void matchesIgnoresHexCase() {
        String hash = ContentHashes.sha256("flood");
        assertThat(ContentHashes.matches("flood", hash.toUpperCase())).isTrue();
        assertThat(ContentHashes.matches("flood", null)).isFalse();
        assertThat(ContentHashes.matches("drought", hash)).isFalse();
    }
}
