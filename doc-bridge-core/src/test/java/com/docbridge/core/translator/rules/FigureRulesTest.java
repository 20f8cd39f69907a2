package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.TranslatorTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FigureRules}.
 */
class FigureRulesTest extends TranslatorTestBase {

    @Test
    void translate_figure_rendersTitleThenLinkThenImage() {
        DocNode figure = node(NodeKind.FIGURE)
            .child(node(NodeKind.REFERENCE)
                .attribute("refuri", "http://x")
                .child(image()))
            .child(textNode(NodeKind.CAPTION, "Result"))
            .child(node(NodeKind.LEGEND).child(paragraph("Details")))
            .build();

        String result = translateBody(figure, paragraph("After"));

        assertThat(result).isEqualTo("\n.Result Details\n[link=http://x]\nimage::chart.png[Chart]\n\nAfter\n");
    }

    @Test
    void translate_figureWithImageOnly_rendersImageMacro() {
        DocNode figure = node(NodeKind.FIGURE).child(image()).build();

        assertThat(translateBody(figure)).isEqualTo("image::chart.png[Chart]\n");
    }

    @Test
    void translate_figureCaptionAfterImage_isStillRenderedFirst() {
        DocNode figure = node(NodeKind.FIGURE)
            .child(image())
            .child(textNode(NodeKind.CAPTION, "Late caption"))
            .build();

        assertThat(translateBody(figure)).isEqualTo("\n.Late caption\nimage::chart.png[Chart]\n");
    }

    @Test
    void translate_figureCaptionWithEscaping_escapesTitle() {
        options = options.withEscapeSpecialCharacters(true);
        DocNode figure = node(NodeKind.FIGURE)
            .child(image())
            .child(textNode(NodeKind.CAPTION, "a|b"))
            .build();

        assertThat(translateBody(figure)).startsWith("\n.a\\|b\n");
    }

    @Test
    void translate_standaloneImage_rendersBlockImage() {
        assertThat(translateBody(image())).isEqualTo("\nimage::chart.png[Chart]\n\n");
    }

    @Test
    void translate_captionAndLegendOutsideFigure_renderFallbackMarkup() {
        assertThat(translateBody(textNode(NodeKind.CAPTION, "Cap"))).isEqualTo("\n:toctitle: Cap\n\n");
        assertThat(translateBody(textNode(NodeKind.LEGEND, "Leg"))).isEqualTo("LEGEND:Leg:LEGEND");
    }

    private static DocNode image() {
        return node(NodeKind.IMAGE).attribute("uri", "chart.png").attribute("alt", "Chart").build();
    }
}
