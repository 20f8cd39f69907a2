package com.docbridge.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 encoding of translated text.
 *
 * <p>Text produced from a document tree can contain unpaired surrogates. Strict encoding
 * reports them; this utility logs the failure and falls back to lenient encoding, which
 * writes a replacement character, instead of letting the error escape.
 */
public final class TextEncoding {

    private static final Logger log = LoggerFactory.getLogger(TextEncoding.class);

    private TextEncoding() {
        // Utility class
    }

    /**
     * Encodes text as UTF-8.
     *
     * @param text text to encode
     * @param origin description of the text for log messages (e.g., a file name)
     * @return UTF-8 bytes
     */
    public static byte[] toUtf8(String text, String origin) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer buffer = encoder.encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            log.error("Output for {} is not valid UTF-8 ({}); invalid characters were replaced",
                origin, e.getMessage());
            return text.getBytes(StandardCharsets.UTF_8);
        }
    }
}
