package com.docbridge;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocBridgeCLI}.
 */
class DocBridgeCLITest {

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final PrintStream originalOut = System.out;

    @BeforeEach
    void setUp() {
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void execute_noArguments_printsBanner() {
        int exitCode = DocBridgeCLI.commandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(output()).contains("DocBridge - docutils/Sphinx to AsciiDoc converter");
    }

    @Test
    void execute_quiet_printsNothing() {
        int exitCode = DocBridgeCLI.commandLine().execute("-q");

        assertThat(exitCode).isZero();
        assertThat(output()).isEmpty();
    }

    @Test
    void execute_version_printsVersion() {
        int exitCode = DocBridgeCLI.commandLine().execute("--version");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("DocBridge 1.0.0-SNAPSHOT");
    }

    @Test
    void execute_unknownCommand_returnsUsageError() {
        int exitCode = DocBridgeCLI.commandLine().execute("publish");

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void commandLine_registersSubcommands() {
        assertThat(DocBridgeCLI.commandLine().getSubcommands()).containsOnlyKeys("convert", "list");
    }

    private String output() {
        return outContent.toString(StandardCharsets.UTF_8);
    }
}
