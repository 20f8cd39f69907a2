package com.docbridge.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Translated files of one conversion run, in input order.
 *
 * @param files translated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile... files) {
        return new GeneratedOutput(List.of(files));
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
