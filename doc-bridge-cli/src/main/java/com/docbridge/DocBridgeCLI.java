package com.docbridge;

import com.docbridge.cli.ConvertCommand;
import com.docbridge.cli.ListCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for DocBridge.
 *
 * <p>DocBridge converts document trees produced by docutils or Sphinx (XML or JSON) into
 * AsciiDoc files.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code convert} - Translate tree files to AsciiDoc</li>
 *   <li>{@code list} - List supported node kinds, translators, readers or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Convert the Sphinx XML build of a project
 * docbridge convert build/xml -o build/asciidoc
 *
 * # Print one converted page
 * docbridge convert build/xml/index.xml --stdout
 *
 * # Show which node kinds are rendered
 * docbridge list kinds
 * }</pre>
 */
@Command(
    name = "docbridge",
    mixinStandardHelpOptions = true,
    version = "DocBridge 1.0.0-SNAPSHOT",
    description = "Converts docutils/Sphinx document trees to AsciiDoc",
    subcommands = {
        ConvertCommand.class,
        ListCommand.class
    }
)
public class DocBridgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocBridgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("DocBridge - docutils/Sphinx to AsciiDoc converter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docbridge --help' to see available commands");
        System.out.println("Use 'docbridge <command> --help' for command-specific help");
    }

    /**
     * Creates the command line with logging configured from the global options before any
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DocBridgeCLI app = new DocBridgeCLI();
        CommandLine commandLine = new CommandLine(app);
        commandLine.setExecutionStrategy(app::execute);
        return commandLine;
    }

    private int execute(ParseResult parseResult) {
        configureLogging();
        log.debug("Executing: {}", parseResult.originalArgs());
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
