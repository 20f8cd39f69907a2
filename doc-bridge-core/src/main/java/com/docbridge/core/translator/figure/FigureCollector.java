package com.docbridge.core.translator.figure;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;

import java.util.Optional;

/**
 * Collects the parts of a figure from its subtree.
 *
 * <p>The first image, caption, legend and reference in document order are kept; later
 * duplicates are ignored.
 */
public final class FigureCollector {

    private FigureCollector() {
        // Utility class
    }

    /**
     * Collects the parts of a figure.
     *
     * @param figure figure node
     * @return collected parts, possibly empty
     */
    public static FigureParts collect(DocNode figure) {
        return new FigureParts(
            first(figure, NodeKind.IMAGE),
            first(figure, NodeKind.CAPTION),
            first(figure, NodeKind.LEGEND),
            first(figure, NodeKind.REFERENCE));
    }

    private static Optional<DocNode> first(DocNode figure, NodeKind kind) {
        return figure.descendants().stream().filter(node -> node.is(kind)).findFirst();
    }
}
