package com.docbridge.core.translator;

/**
 * Raised by host-side operations around a translation (reading a tree, writing output)
 * when they cannot complete. The translation itself never throws for data-shape problems.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
