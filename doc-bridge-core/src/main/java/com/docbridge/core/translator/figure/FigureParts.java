package com.docbridge.core.translator.figure;

import com.docbridge.core.model.DocNode;

import java.util.Optional;

/**
 * The parts of one figure, collected before rendering.
 *
 * @param image embedded image node, if any
 * @param caption caption node, if any
 * @param legend legend node, if any
 * @param reference link reference wrapping the image, if any
 */
public record FigureParts(
    Optional<DocNode> image,
    Optional<DocNode> caption,
    Optional<DocNode> legend,
    Optional<DocNode> reference
) {
    private static final FigureParts EMPTY =
        new FigureParts(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    /**
     * Compact constructor normalising null slots to empty.
     */
    public FigureParts {
        image = image == null ? Optional.empty() : image;
        caption = caption == null ? Optional.empty() : caption;
        legend = legend == null ? Optional.empty() : legend;
        reference = reference == null ? Optional.empty() : reference;
    }

    public static FigureParts empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return image.isEmpty() && caption.isEmpty() && legend.isEmpty() && reference.isEmpty();
    }
}
