package com.docbridge.core.translator;

import com.docbridge.core.model.DocNode;

/**
 * Interface for translators that turn a parsed document tree into target markup text.
 *
 * <p>A translator is stateless between calls: every {@link #translate(DocNode, TranslatorOptions)}
 * call builds its own context and output buffer, so one instance may serve many documents,
 * including concurrent ones.
 *
 * <p>Translators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.docbridge.core.translator.DocumentTranslator}
 *
 * @see TranslatorOptions
 */
public interface DocumentTranslator {

    /**
     * Returns unique identifier for this translator (e.g., "asciidoc").
     *
     * @return unique translator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this translator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for translated documents.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Translates a document tree.
     *
     * <p>Malformed or unknown nodes never abort the translation; they degrade to visible
     * diagnostics or to no output.
     *
     * @param document root of the document tree
     * @param options translation options
     * @return translated markup text
     * @throws NullPointerException if document or options is null
     */
    String translate(DocNode document, TranslatorOptions options);
}
