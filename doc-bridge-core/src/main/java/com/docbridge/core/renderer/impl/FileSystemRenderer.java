package com.docbridge.core.renderer.impl;

import com.docbridge.core.renderer.GeneratedFile;
import com.docbridge.core.renderer.GeneratedOutput;
import com.docbridge.core.renderer.OutputRenderer;
import com.docbridge.core.renderer.RenderContext;
import com.docbridge.core.translator.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes translated files to the filesystem as UTF-8.
 *
 * <p>Creates the directory structure automatically and overwrites existing files.
 * Relative paths that would escape the output directory are rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = GeneratedOutput.of(
 *     new GeneratedFile("guide/index.adoc", "= Guide\n", "build/xml/guide/index.xml"));
 *
 * new FileSystemRenderer().render(output, RenderContext.forDirectory(Path.of("build/asciidoc")));
 * // Creates: build/asciidoc/guide/index.adoc
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory().toAbsolutePath().normalize();
        log.info("Writing {} files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new TranslationException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
        log.debug("Wrote {} files to {}", output.files().size(), outputDir);
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new TranslationException("Output path escapes the output directory: " + file.relativePath());
        }

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            byte[] bytes = file.encoded();
            Files.write(targetPath, bytes);
            log.info("Wrote {} ({} bytes)", file.relativePath(), bytes.length);
        } catch (IOException e) {
            throw new TranslationException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
