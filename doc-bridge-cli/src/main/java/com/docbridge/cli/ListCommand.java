package com.docbridge.cli;

import com.docbridge.core.model.NodeKind;
import com.docbridge.core.reader.DocumentReader;
import com.docbridge.core.reader.DocumentReaders;
import com.docbridge.core.renderer.OutputRenderer;
import com.docbridge.core.translator.DocumentTranslator;
import com.docbridge.core.translator.impl.AsciiDocTranslator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to list supported node kinds, translators, readers or renderers.
 *
 * <p>Translators and renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Node kinds with rendering rules, grouped by rule family
 * docbridge list kinds
 *
 * # Available translators, readers and renderers
 * docbridge list translators
 * docbridge list readers
 * docbridge list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported node kinds, translators, readers or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: kinds, translators, readers or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "kinds", "kind" -> listKinds();
            case "translators", "translator" -> listTranslators();
            case "readers", "reader" -> listReaders();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: kinds, translators, readers or renderers", type);
                yield 1;
            }
        };
    }

    private int listKinds() {
        System.out.println("Supported Node Kinds:");
        System.out.println();

        Map<String, Set<NodeKind>> kindsByFamily = new AsciiDocTranslator().registry().kindsByFamily();
        kindsByFamily.forEach((family, kinds) -> {
            System.out.printf("  • %s (%d)%n", family, kinds.size());
            System.out.printf("    %s%n", kinds.stream().map(NodeKind::tagName).collect(Collectors.joining(", ")));
            System.out.println();
        });
        System.out.println("  Elements not listed render their content only.");
        return 0;
    }

    private int listTranslators() {
        System.out.println("Available Translators:");
        System.out.println();

        boolean found = false;
        for (DocumentTranslator translator : ServiceLoader.load(DocumentTranslator.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", translator.getDisplayName(), translator.getId());
            System.out.printf("    File Extension: .%s%n", translator.getFileExtension());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No translators found.");
        }
        return 0;
    }

    private int listReaders() {
        System.out.println("Available Readers:");
        System.out.println();

        for (DocumentReader reader : DocumentReaders.all()) {
            System.out.printf("  • %s%n", reader.getId());
            System.out.printf("    Extensions: %s%n", reader.getSupportedExtensions());
            System.out.println();
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
