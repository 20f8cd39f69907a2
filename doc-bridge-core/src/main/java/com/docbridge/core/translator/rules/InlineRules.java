package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.state.Mode;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;
import com.docbridge.core.util.AsciiDocEscaper;

/**
 * Rules for text leaves and inline markup.
 */
public final class InlineRules implements RuleFamily {

    private static final String LINE_BREAK_MARKER = " +";

    @Override
    public String name() {
        return "inline";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(NodeKind.TEXT, NodeRule.of(InlineRules::enterText, NodeRule.Step.NONE));
        registry.register(NodeKind.STRONG, NodeRule.delimited("*", "*"));
        registry.register(NodeKind.EMPHASIS, NodeRule.delimited(" _", "_"));
        registry.register(NodeKind.LITERAL, NodeRule.delimited("`", "`"));
        registry.register(NodeKind.LITERAL_STRONG, NodeRule.delimited("`*", "*`"));
        registry.register(NodeKind.LITERAL_EMPHASIS, NodeRule.delimited(" `*", "*`"));
        registry.register(NodeKind.TITLE_REFERENCE, NodeRule.delimited("`*", "*`"));
        registry.register(NodeKind.SUBSCRIPT, NodeRule.delimited("~", "~"));
        registry.register(NodeKind.SUPERSCRIPT, NodeRule.delimited("^", "^"));
        registry.register(NodeKind.MANPAGE, NodeRule.delimited("_", "_"));
    }

    private static void enterText(DocNode node, TranslationContext context, OutputBuffer out) {
        // figure text is rendered from the collected parts on figure exit
        if (context.suppressingContents() || context.isIn(Mode.FIGURE)) {
            return;
        }
        String text = context.options().escapeSpecialCharacters()
            ? AsciiDocEscaper.escape(node.text())
            : node.text();
        out.append(context.isIn(Mode.LINE_BLOCK) ? text + LINE_BREAK_MARKER : text);
    }
}
