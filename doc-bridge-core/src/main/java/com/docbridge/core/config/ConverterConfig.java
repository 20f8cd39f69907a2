package com.docbridge.core.config;

import com.docbridge.core.translator.ColumnAlignment;
import com.docbridge.core.translator.TranslatorOptions;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for DocBridge conversions.
 *
 * <p>Loaded from {@code docbridge.yaml}. Defines translator options and output settings.
 * Sections or keys left out of the file fall back to their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * translator:
 *   emitRenderedToc: false
 *   defaultColumnAlignment: unspecified
 *   computeColumnWidthPercentages: true
 *   escapeSpecialCharacters: false
 *
 * output:
 *   directory: "./build/asciidoc"
 *   extension: "adoc"
 * }</pre>
 *
 * @param translator translator settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConverterConfig(
    @JsonProperty("translator") TranslatorSettings translator,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling missing sections with defaults.
     */
    public ConverterConfig {
        if (translator == null) {
            translator = TranslatorSettings.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ConverterConfig defaults() {
        return new ConverterConfig(TranslatorSettings.defaults(), OutputConfig.defaults());
    }

    /**
     * Converts the translator section into translator options.
     *
     * @return translator options
     * @throws IllegalArgumentException if the column alignment is not recognised
     */
    public TranslatorOptions toTranslatorOptions() {
        return new TranslatorOptions(
            translator.emitRenderedToc(),
            ColumnAlignment.fromConfig(translator.defaultColumnAlignment()),
            translator.computeColumnWidthPercentages(),
            translator.escapeSpecialCharacters()
        );
    }

    /**
     * Translator settings.
     *
     * @param emitRenderedToc render the parser's contents topic instead of {@code :toc:}
     * @param defaultColumnAlignment {@code left}, {@code right}, {@code center} or {@code unspecified}
     * @param computeColumnWidthPercentages derive table column widths
     * @param escapeSpecialCharacters escape reserved and non-ASCII characters
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TranslatorSettings(
        @JsonProperty("emitRenderedToc") Boolean emitRenderedToc,
        @JsonProperty("defaultColumnAlignment") String defaultColumnAlignment,
        @JsonProperty("computeColumnWidthPercentages") Boolean computeColumnWidthPercentages,
        @JsonProperty("escapeSpecialCharacters") Boolean escapeSpecialCharacters
    ) {
        /**
         * Compact constructor filling missing values with defaults.
         */
        public TranslatorSettings {
            emitRenderedToc = emitRenderedToc != null ? emitRenderedToc : Boolean.FALSE;
            defaultColumnAlignment = defaultColumnAlignment != null ? defaultColumnAlignment : "unspecified";
            computeColumnWidthPercentages = computeColumnWidthPercentages != null
                ? computeColumnWidthPercentages
                : Boolean.TRUE;
            escapeSpecialCharacters = escapeSpecialCharacters != null ? escapeSpecialCharacters : Boolean.FALSE;
        }

        public static TranslatorSettings defaults() {
            return new TranslatorSettings(null, null, null, null);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param extension extension of written files, without leading dot
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("extension") String extension
    ) {
        /**
         * Compact constructor filling missing values with defaults.
         */
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = "./build/asciidoc";
            }
            if (extension == null || extension.isBlank()) {
                extension = "adoc";
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }
}
