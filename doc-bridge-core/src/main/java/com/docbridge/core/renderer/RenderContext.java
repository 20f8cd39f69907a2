package com.docbridge.core.renderer;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where renderers put their output.
 *
 * @param outputDirectory directory translated files are written under
 * @param console stream console output goes to
 * @param showHeaders whether console output names each file before its content
 */
public record RenderContext(
    Path outputDirectory,
    PrintStream console,
    boolean showHeaders
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (console == null) {
            console = System.out;
        }
    }

    /**
     * Creates a context writing files under a directory.
     *
     * @param outputDirectory output directory
     * @return render context
     */
    public static RenderContext forDirectory(Path outputDirectory) {
        return new RenderContext(outputDirectory, System.out, true);
    }
}
