package com.docbridge.core.translator.figure;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.util.AsciiDocEscaper;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders collected figure parts in AsciiDoc order: block title, link attribute, image macro.
 *
 * <p>The parser places the caption after the image while AsciiDoc expects the title in
 * front of the block, so figures are collected first and rendered on exit.
 */
public final class FigureRenderer {

    private FigureRenderer() {
        // Utility class
    }

    /**
     * Renders a figure.
     *
     * @param parts collected parts
     * @param escape whether caption and legend text is escaped
     * @return output fragments in order, empty for an empty figure
     */
    public static List<String> render(FigureParts parts, boolean escape) {
        List<String> fragments = new ArrayList<>();

        String caption = parts.caption().map(FigureRenderer::flatText).orElse("");
        String legend = parts.legend().map(FigureRenderer::flatText).orElse("");
        if (escape) {
            caption = AsciiDocEscaper.escape(caption);
            legend = AsciiDocEscaper.escape(legend);
        }
        if (caption.startsWith(".")) {
            // a second leading dot would not be read as a block title
            caption = "\\" + caption;
        }
        if (parts.caption().isPresent() || parts.legend().isPresent()) {
            String title = Stream.of(caption, legend)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining(" "));
            fragments.add("\n." + title + "\n");
        }

        parts.reference()
            .flatMap(reference -> reference.nonBlankAttribute("refuri"))
            .ifPresent(uri -> fragments.add("[link=" + uri + "]\n"));

        parts.image().ifPresent(image -> fragments.add("image::" + imageTarget(image) + "\n"));
        return fragments;
    }

    /**
     * Renders the target and alt text of an image macro, e.g. {@code diagram.png[Diagram]}.
     *
     * @param image image node
     * @return macro target with bracketed alt text
     */
    public static String imageTarget(DocNode image) {
        return image.attribute("uri").orElse("") + "[" + image.attribute("alt").orElse("") + "]";
    }

    private static String flatText(DocNode node) {
        return node.asText().strip().replaceAll("\\s*\\n\\s*", " ");
    }
}
