package com.docbridge.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>Example patterns: {@code *.xml}, {@code build/xml/*.xml}.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern, matched against paths relative to the root
     * @return matching paths in sorted order
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(rootPath.relativize(path)))
                .sorted()
                .toList();
        }
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return base name, the whole file name if it has no extension
     */
    public static String getStem(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Derives the stem of a source reference as docutils records it in the {@code source}
     * attribute (a path using {@code /} separators).
     *
     * @param source source path string, may be null
     * @return stem, empty if the source is null or blank
     */
    public static String stemOf(String source) {
        if (source == null || source.isBlank()) {
            return "";
        }
        String fileName = source.substring(source.lastIndexOf('/') + 1);
        int firstDot = fileName.indexOf('.');
        return firstDot > 0 ? fileName.substring(0, firstDot) : fileName;
    }
}
