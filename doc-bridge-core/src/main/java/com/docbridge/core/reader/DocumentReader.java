package com.docbridge.core.reader;

import com.docbridge.core.model.DocNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads a serialized document tree into {@link DocNode}s.
 *
 * <p>Readers only rebuild the tree the parser produced; they never interpret markup.
 *
 * @see DocumentReaders
 */
public interface DocumentReader {

    /**
     * Returns unique identifier for this reader (e.g., "docutils-xml").
     *
     * @return reader identifier
     */
    String getId();

    /**
     * Returns the file extensions this reader accepts, lowercase and without leading dot.
     *
     * @return supported extensions
     */
    Set<String> getSupportedExtensions();

    /**
     * Parses serialized tree content.
     *
     * @param content serialized tree
     * @param origin description of the content for error messages (e.g., a file name)
     * @return root node
     * @throws IllegalArgumentException if the content is not a well-formed tree
     */
    DocNode parse(String content, String origin);

    /**
     * Reads a tree file, decoded as UTF-8.
     *
     * @param file file to read
     * @return root node
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is not a well-formed tree
     */
    default DocNode read(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }
}
