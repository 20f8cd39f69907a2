package com.docbridge.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docbridge.core.config.ConfigLoader;
import com.docbridge.core.config.ConverterConfig;
import com.docbridge.core.model.DocNode;
import com.docbridge.core.reader.DocumentReader;
import com.docbridge.core.reader.DocumentReaders;
import com.docbridge.core.renderer.GeneratedFile;
import com.docbridge.core.renderer.GeneratedOutput;
import com.docbridge.core.renderer.OutputRenderer;
import com.docbridge.core.renderer.RenderContext;
import com.docbridge.core.translator.DocumentTranslator;
import com.docbridge.core.translator.TranslationException;
import com.docbridge.core.translator.TranslatorOptions;
import com.docbridge.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to translate document tree files to AsciiDoc.
 *
 * <p>Runs the conversion pipeline:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Collect tree files (directories are searched for {@code .xml} and {@code .json})</li>
 *   <li>Read and translate each file; a failing file is reported and skipped</li>
 *   <li>Render the results to the output directory or the console</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Convert a Sphinx XML build, keeping its directory layout
 * docbridge convert build/xml
 *
 * # Convert single files into a custom directory
 * docbridge convert index.xml usage.xml -o docs/modules/ROOT/pages
 *
 * # Print the result instead of writing files
 * docbridge convert index.xml --stdout
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Translate docutils/Sphinx tree files (XML or JSON) to AsciiDoc",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    static final String TREE_FILE_GLOB = "**.{xml,json}";

    @Parameters(
        arity = "1..*",
        description = "Tree files or directories containing them"
    )
    private List<Path> inputs = new ArrayList<>();

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--stdout"},
        description = "Print the translated documents instead of writing files"
    )
    private boolean stdout;

    @Option(
        names = {"-t", "--translator"},
        description = "Translator ID (default: asciidoc)"
    )
    private String translatorId = "asciidoc";

    @Override
    public Integer call() {
        try {
            ConverterConfig config = ConfigLoader.load(configPath);
            TranslatorOptions options = config.toTranslatorOptions();
            DocumentTranslator translator = findTranslator(translatorId);
            String extension = config.output().extension();

            Map<Path, String> files = collectInputs();
            if (files.isEmpty()) {
                System.err.println("✗ No tree files found in: " + inputs);
                return 1;
            }
            log.info("Converting {} files with {}", files.size(), translator.getDisplayName());

            List<GeneratedFile> converted = new ArrayList<>();
            int failures = 0;
            for (Map.Entry<Path, String> entry : files.entrySet()) {
                try {
                    converted.add(convert(entry.getKey(), entry.getValue() + "." + extension, translator, options));
                } catch (IOException | IllegalArgumentException | TranslationException e) {
                    failures++;
                    log.error("Failed to convert {}: {}", entry.getKey(), e.getMessage());
                    log.debug("Conversion failure", e);
                    System.err.println("✗ " + entry.getKey() + ": " + e.getMessage());
                }
            }

            renderOutput(new GeneratedOutput(converted), resolveOutputDirectory(config));
            if (!stdout) {
                System.out.println("✓ Converted " + converted.size() + " of " + files.size()
                    + " files to: " + resolveOutputDirectory(config));
            }
            return failures == 0 ? 0 : 1;

        } catch (IOException | IllegalArgumentException | IllegalStateException | TranslationException e) {
            log.error("Conversion failed", e);
            System.err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Maps every input tree file to its output path without extension, relative to the
     * output directory. Files found in a directory keep their path below it.
     */
    private Map<Path, String> collectInputs() throws IOException {
        Map<Path, String> files = new LinkedHashMap<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                for (Path file : FileUtils.findFiles(input, TREE_FILE_GLOB)) {
                    Path relative = input.relativize(file);
                    Path parent = relative.getParent();
                    String stem = FileUtils.getStem(file);
                    files.put(file, parent == null ? stem : parent.resolve(stem).toString().replace('\\', '/'));
                }
            } else if (Files.isRegularFile(input)) {
                files.put(input, FileUtils.getStem(input));
            } else {
                throw new IllegalArgumentException("Input not found: " + input);
            }
        }
        return files;
    }

    private GeneratedFile convert(Path file, String relativePath, DocumentTranslator translator,
                                  TranslatorOptions options) throws IOException {
        DocumentReader reader = DocumentReaders.forPath(file);
        log.debug("Reading {} with {}", file, reader.getId());
        DocNode document = reader.read(file);
        String content = translator.translate(document, options);
        log.info("Translated {} -> {}", file, relativePath);
        return new GeneratedFile(relativePath, content, file.toString());
    }

    private DocumentTranslator findTranslator(String id) {
        List<String> available = new ArrayList<>();
        for (DocumentTranslator translator : ServiceLoader.load(DocumentTranslator.class)) {
            if (translator.getId().equals(id)) {
                return translator;
            }
            available.add(translator.getId());
        }
        throw new IllegalArgumentException("Unknown translator: " + id + ". Available: " + available);
    }

    private void renderOutput(GeneratedOutput output, Path directory) {
        String rendererId = stdout ? "console" : "filesystem";
        OutputRenderer renderer = ServiceLoader.load(OutputRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(candidate -> candidate.getId().equals(rendererId))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Renderer not available: " + rendererId));

        RenderContext context = new RenderContext(directory, System.out, output.files().size() > 1);
        renderer.render(output, context);
    }

    private Path resolveOutputDirectory(ConverterConfig config) {
        return outputDir != null ? outputDir : Paths.get(config.output().directory());
    }
}
