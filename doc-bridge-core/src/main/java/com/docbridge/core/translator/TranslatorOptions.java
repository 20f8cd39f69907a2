package com.docbridge.core.translator;

/**
 * Options recognised by the translator.
 *
 * @param emitRenderedToc render the parser's table of contents literally instead of
 *                        emitting the AsciiDoc {@code :toc:} directive
 * @param defaultColumnAlignment alignment for table columns without an explicit spec
 * @param computeColumnWidthPercentages derive {@code cols} width percentages from
 *                                      column widths instead of leaving layout to AsciiDoc
 * @param escapeSpecialCharacters escape reserved punctuation and non-ASCII characters in text
 */
public record TranslatorOptions(
    boolean emitRenderedToc,
    ColumnAlignment defaultColumnAlignment,
    boolean computeColumnWidthPercentages,
    boolean escapeSpecialCharacters
) {
    /**
     * Compact constructor with validation.
     */
    public TranslatorOptions {
        if (defaultColumnAlignment == null) {
            defaultColumnAlignment = ColumnAlignment.UNSPECIFIED;
        }
    }

    /**
     * Creates the default options: auto TOC directive, unspecified alignment,
     * auto column layout, no escaping.
     *
     * @return default translator options
     */
    public static TranslatorOptions defaults() {
        return new TranslatorOptions(false, ColumnAlignment.UNSPECIFIED, false, false);
    }

    public TranslatorOptions withEmitRenderedToc(boolean value) {
        return new TranslatorOptions(value, defaultColumnAlignment, computeColumnWidthPercentages, escapeSpecialCharacters);
    }

    public TranslatorOptions withDefaultColumnAlignment(ColumnAlignment value) {
        return new TranslatorOptions(emitRenderedToc, value, computeColumnWidthPercentages, escapeSpecialCharacters);
    }

    public TranslatorOptions withComputeColumnWidthPercentages(boolean value) {
        return new TranslatorOptions(emitRenderedToc, defaultColumnAlignment, value, escapeSpecialCharacters);
    }

    public TranslatorOptions withEscapeSpecialCharacters(boolean value) {
        return new TranslatorOptions(emitRenderedToc, defaultColumnAlignment, computeColumnWidthPercentages, value);
    }
}
