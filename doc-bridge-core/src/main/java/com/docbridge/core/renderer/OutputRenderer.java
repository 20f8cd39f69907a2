package com.docbridge.core.renderer;

/**
 * Interface for renderers that deliver translated files to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.docbridge.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Delivers the translated files.
     *
     * @param output translated files
     * @param context destination settings
     * @throws com.docbridge.core.translator.TranslationException if a file cannot be delivered
     */
    void render(GeneratedOutput output, RenderContext context);
}
