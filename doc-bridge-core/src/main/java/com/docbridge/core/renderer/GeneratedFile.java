package com.docbridge.core.renderer;

import com.docbridge.core.util.TextEncoding;

import java.util.Objects;

/**
 * A translated document ready to be written.
 *
 * @param relativePath path of the output file relative to the output directory
 *                     (e.g., "guide/index.adoc")
 * @param content translated text
 * @param source path of the tree file the content was translated from, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String source
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    /**
     * Encodes the content as UTF-8, reporting characters that cannot be encoded.
     *
     * @return UTF-8 bytes
     */
    public byte[] encoded() {
        return TextEncoding.toUtf8(content, relativePath);
    }
}
