package com.docbridge.core.reader;

import com.docbridge.core.util.FileUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Picks a {@link DocumentReader} for a tree file.
 */
public final class DocumentReaders {

    private static final List<DocumentReader> READERS = List.of(new DocutilsXmlReader(), new JsonTreeReader());

    private DocumentReaders() {
        // Utility class
    }

    /**
     * Returns all built-in readers.
     *
     * @return readers
     */
    public static List<DocumentReader> all() {
        return READERS;
    }

    /**
     * Chooses a reader by file extension.
     *
     * @param file tree file
     * @return reader for the file
     * @throws IllegalArgumentException if no reader supports the extension
     */
    public static DocumentReader forPath(Path file) {
        String extension = FileUtils.getExtension(file).toLowerCase(Locale.ROOT);
        return READERS.stream()
            .filter(reader -> reader.getSupportedExtensions().contains(extension))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "No reader for " + file + "; supported extensions: " + supportedExtensions()));
    }

    private static String supportedExtensions() {
        return READERS.stream()
            .flatMap(reader -> reader.getSupportedExtensions().stream())
            .sorted()
            .collect(Collectors.joining(", "));
    }
}
