package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.figure.FigureCollector;
import com.docbridge.core.translator.figure.FigureRenderer;
import com.docbridge.core.translator.state.Mode;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;

/**
 * Rules for figures and for images, captions and legends outside of figures.
 *
 * <p>A figure mutes its subtree while the walk passes through it and renders the collected
 * parts on exit, title first.
 */
public final class FigureRules implements RuleFamily {

    @Override
    public String name() {
        return "figures";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(NodeKind.FIGURE, NodeRule.of(FigureRules::enterFigure, FigureRules::exitFigure));
        registry.register(NodeKind.IMAGE, NodeRule.of(
            (node, context, out) -> {
                if (!context.isIn(Mode.FIGURE)) {
                    out.append("\nimage::" + FigureRenderer.imageTarget(node));
                }
            },
            outsideFigure("\n\n")));
        registry.register(NodeKind.CAPTION, NodeRule.of(outsideFigure("\n:toctitle: "), outsideFigure("\n\n")));
        registry.register(NodeKind.LEGEND, NodeRule.of(outsideFigure("LEGEND:"), outsideFigure(":LEGEND")));
    }

    private static NodeRule.Step outsideFigure(String text) {
        return (node, context, out) -> {
            if (!context.isIn(Mode.FIGURE)) {
                out.append(text);
            }
        };
    }

    private static void enterFigure(DocNode node, TranslationContext context, OutputBuffer out) {
        context.set(Mode.FIGURE, true);
        context.stageFigure(FigureCollector.collect(node));
        out.mute();
    }

    private static void exitFigure(DocNode node, TranslationContext context, OutputBuffer out) {
        out.unmute();
        FigureRenderer.render(context.figure(), context.options().escapeSpecialCharacters())
            .forEach(out::append);
        context.set(Mode.FIGURE, false);
        context.clearFigure();
    }
}
