package com.docbridge.core.util;

import java.util.Map;

/**
 * Escapes visible text for safe placement in AsciiDoc output.
 *
 * <p>Reserved punctuation ({@code { } \ |}) is backslash-escaped. Characters at or above
 * code point 127 are written as {@code \'<hex>}. Everything else passes through unchanged.
 */
public final class AsciiDocEscaper {

    private static final Map<Integer, String> RESERVED = Map.of(
        (int) '{', "\\{",
        (int) '}', "\\}",
        (int) '\\', "\\\\",
        (int) '|', "\\|"
    );

    private static final int FIRST_ESCAPED_CODE_POINT = 127;

    private AsciiDocEscaper() {
        // Utility class
    }

    /**
     * Escapes a text fragment.
     *
     * @param text text to escape, may be null
     * @return escaped text, empty for null input
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            String reserved = RESERVED.get(codePoint);
            if (reserved != null) {
                sb.append(reserved);
            } else if (codePoint < FIRST_ESCAPED_CODE_POINT) {
                sb.appendCodePoint(codePoint);
            } else {
                sb.append("\\'").append(Integer.toHexString(codePoint));
            }
        });
        return sb.toString();
    }
}
