package com.docbridge.core.renderer.impl;

import com.docbridge.core.renderer.GeneratedFile;
import com.docbridge.core.renderer.GeneratedOutput;
import com.docbridge.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ConsoleRenderer renderer;
    private ByteArrayOutputStream outputStream;
    private PrintStream console;

    @BeforeEach
    void setUp() {
        renderer = new ConsoleRenderer();
        outputStream = new ByteArrayOutputStream();
        console = new PrintStream(outputStream, true, StandardCharsets.UTF_8);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_singleFileWithoutHeaders_printsContentOnly() {
        // Given
        GeneratedOutput output = GeneratedOutput.of(new GeneratedFile("guide.adoc", "\n== Intro\n", "guide.xml"));

        // When
        renderer.render(output, new RenderContext(Path.of("."), console, false));

        // Then
        assertThat(printed()).isEqualTo("\n== Intro\n");
    }

    @Test
    void render_multipleFilesWithHeaders_separatesFilesWithHeaderLines() {
        // Given
        GeneratedOutput output = GeneratedOutput.of(
            new GeneratedFile("a.adoc", "A\n", "a.xml"),
            new GeneratedFile("b.adoc", "B\n", "b.xml"));

        // When
        renderer.render(output, new RenderContext(Path.of("."), console, true));

        // Then
        String separator = System.lineSeparator();
        assertThat(printed()).isEqualTo(
            "// ==== a.adoc ====" + separator + "A\n"
                + separator
                + "// ==== b.adoc ====" + separator + "B\n");
    }

    @Test
    void render_emptyOutput_printsNothing() {
        // When
        renderer.render(new GeneratedOutput(List.of()), new RenderContext(Path.of("."), console, true));

        // Then
        assertThat(printed()).isEmpty();
    }

    private String printed() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }
}
