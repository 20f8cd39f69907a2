package com.docbridge.core.renderer.impl;

import com.docbridge.core.renderer.GeneratedFile;
import com.docbridge.core.renderer.GeneratedOutput;
import com.docbridge.core.renderer.RenderContext;
import com.docbridge.core.translator.TranslationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withSingleFile_writesUtf8FileToOutputDirectory() throws IOException {
        // Given
        String content = "\n== Überblick\n\nHello\n";
        GeneratedOutput output = GeneratedOutput.of(new GeneratedFile("guide.adoc", content, "guide.xml"));

        // When
        renderer.render(output, RenderContext.forDirectory(tempDir));

        // Then
        Path expectedFile = tempDir.resolve("guide.adoc");
        assertThat(expectedFile).exists();
        assertThat(Files.readAllBytes(expectedFile)).isEqualTo(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void render_withNestedPath_createsParentDirectories() throws IOException {
        // Given
        GeneratedOutput output = GeneratedOutput.of(new GeneratedFile("api/v1/index.adoc", "= API\n", "index.xml"));

        // When
        renderer.render(output, RenderContext.forDirectory(tempDir.resolve("out")));

        // Then
        Path expectedFile = tempDir.resolve("out/api/v1/index.adoc");
        assertThat(expectedFile).exists();
        assertThat(Files.readString(expectedFile)).isEqualTo("= API\n");
    }

    @Test
    void render_withExistingFile_overwritesContent() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("guide.adoc"), "old content that is longer");
        GeneratedOutput output = GeneratedOutput.of(new GeneratedFile("guide.adoc", "new", "guide.xml"));

        // When
        renderer.render(output, RenderContext.forDirectory(tempDir));

        // Then
        assertThat(Files.readString(tempDir.resolve("guide.adoc"))).isEqualTo("new");
    }

    @Test
    void render_withPathOutsideOutputDirectory_throwsException() {
        // Given
        GeneratedOutput output = GeneratedOutput.of(new GeneratedFile("../escape.adoc", "x", "x.xml"));
        RenderContext context = RenderContext.forDirectory(tempDir.resolve("out"));

        // When / Then
        assertThatThrownBy(() -> renderer.render(output, context))
            .isInstanceOf(TranslationException.class)
            .hasMessageContaining("escapes");
        assertThat(tempDir.resolve("escape.adoc")).doesNotExist();
    }

    @Test
    void render_withEmptyOutput_createsOnlyDirectory() {
        // When
        renderer.render(new GeneratedOutput(List.of()), RenderContext.forDirectory(tempDir.resolve("empty")));

        // Then
        assertThat(tempDir.resolve("empty")).isDirectory().isEmptyDirectory();
    }
}
