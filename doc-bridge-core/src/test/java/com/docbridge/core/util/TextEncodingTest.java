package com.docbridge.core.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TextEncoding}.
 */
class TextEncodingTest {

    @Test
    void toUtf8_validText_encodesExactly() {
        assertThat(TextEncoding.toUtf8("Ünïcode ✓", "test")).isEqualTo("Ünïcode ✓".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void toUtf8_loneSurrogate_fallsBackToReplacement() {
        byte[] bytes = TextEncoding.toUtf8("a\uD800b", "test");

        assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("a?b");
    }
}
